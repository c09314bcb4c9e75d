package org.springaicommunity.commitwatch;

/**
 * Thrown when the initial clone of a repository fails. Fatal to the run.
 */
public class MirrorCloneException extends RuntimeException {

	public MirrorCloneException(String message, Throwable cause) {
		super(message, cause);
	}

}
