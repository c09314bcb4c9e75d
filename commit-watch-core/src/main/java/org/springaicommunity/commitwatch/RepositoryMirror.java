package org.springaicommunity.commitwatch;

/**
 * Keeps a local copy of the watched branch up to date.
 */
public interface RepositoryMirror {

	/**
	 * Clone the repository if no local copy exists, otherwise update it. An update
	 * failure is logged and the existing copy is used as is.
	 * @param request what to mirror and where
	 * @return true if this call performed the initial clone
	 * @throws MirrorCloneException if the initial clone fails
	 */
	boolean ensureMirror(MirrorRequest request);

}
