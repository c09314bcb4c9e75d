package org.springaicommunity.commitwatch;

import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;

/**
 * Access token for a private repository, handed to the mirror for the duration of a git
 * operation. The token is never embedded in a URL and never printed.
 *
 * @param token personal access token
 */
public record GitCredentials(String token) {

	public GitCredentials {
		if (token.isBlank()) {
			throw new IllegalArgumentException("Token cannot be empty");
		}
	}

	/**
	 * Create a JGit credentials provider for this token. The token is sent as the user
	 * name with an empty password, which is how token authentication over HTTPS works
	 * for GitHub, GitLab and Bitbucket.
	 * @return a new credentials provider
	 */
	public CredentialsProvider toCredentialsProvider() {
		return new UsernamePasswordCredentialsProvider(token, "");
	}

	@Override
	public String toString() {
		return "GitCredentials[token=****]";
	}

}
