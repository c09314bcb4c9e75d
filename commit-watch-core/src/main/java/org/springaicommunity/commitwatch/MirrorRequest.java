package org.springaicommunity.commitwatch;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Parameters of a {@link RepositoryMirror#ensureMirror(MirrorRequest)} call.
 *
 * @param repositoryUrl remote repository URL
 * @param branch branch to mirror
 * @param directory local mirror directory
 * @param credentials optional credentials, {@code null} for anonymous access
 */
public record MirrorRequest(String repositoryUrl, String branch, Path directory,
		@Nullable GitCredentials credentials) {

	/**
	 * Build the request for the repository described by a configuration.
	 * @param configuration watch configuration
	 * @return mirror request
	 */
	public static MirrorRequest from(WatchConfiguration configuration) {
		return new MirrorRequest(configuration.repositoryUrl(), configuration.branch(),
				configuration.mirrorDirectory(), configuration.credentials());
	}

}
