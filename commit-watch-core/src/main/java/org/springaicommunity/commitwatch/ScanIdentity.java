package org.springaicommunity.commitwatch;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Identity of a watched repository and branch. Checkpoints are keyed by this value.
 *
 * @param repositoryName repository name derived from its URL (e.g. {@code spring-ai})
 * @param branch watched branch
 */
public record ScanIdentity(String repositoryName, String branch) {

	public ScanIdentity {
		if (repositoryName.isBlank()) {
			throw new IllegalArgumentException("Repository name cannot be empty");
		}
		if (branch.isBlank()) {
			throw new IllegalArgumentException("Branch cannot be empty");
		}
	}

	/**
	 * Derive the identity from a repository URL. The name is the last path segment
	 * without its extension, URL-decoded, so {@code https://host/org/my%20repo.git}
	 * becomes {@code my repo}. SCP-style URLs ({@code git@host:org/repo.git}) are
	 * accepted as well. A segment that is not valid percent-encoding is used as written.
	 * @param repositoryUrl remote repository URL
	 * @param branch watched branch
	 * @return the identity
	 */
	public static ScanIdentity of(String repositoryUrl, String branch) {
		String path;
		try {
			URI uri = new URI(repositoryUrl);
			path = uri.getRawPath() != null && !uri.getRawPath().isEmpty() ? uri.getRawPath()
					: uri.getRawSchemeSpecificPart();
		}
		catch (URISyntaxException e) {
			path = repositoryUrl;
		}

		while (path.endsWith("/")) {
			path = path.substring(0, path.length() - 1);
		}
		String segment = path.substring(Math.max(path.lastIndexOf('/'), path.lastIndexOf(':')) + 1);
		int extension = segment.lastIndexOf('.');
		if (extension > 0) {
			segment = segment.substring(0, extension);
		}
		return new ScanIdentity(decode(segment), branch);
	}

	// a stray '%' that does not start an escape is kept as written
	private static String decode(String segment) {
		try {
			return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
		}
		catch (IllegalArgumentException e) {
			return segment;
		}
	}

	/**
	 * Name of the checkpoint table for this identity.
	 * @return repository name immediately followed by the branch
	 */
	public String tableName() {
		return repositoryName + branch;
	}

	@Override
	public String toString() {
		return repositoryName + "@" + branch;
	}

}
