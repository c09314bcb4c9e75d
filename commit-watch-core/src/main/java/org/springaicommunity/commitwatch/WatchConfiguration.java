package org.springaicommunity.commitwatch;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Deployment settings for one watched repository, read once at startup and passed
 * explicitly to every component.
 *
 * @param repositoryUrl remote URL of the watched repository
 * @param accessToken optional access token for private repositories
 * @param branch branch to watch
 * @param databaseFile SQLite file holding the checkpoint log
 * @param reposDirectory parent directory of local mirrors
 * @param analysisBaseUrl base URL of the analysis service
 * @param analysisEndpoint path appended to the base URL
 * @param analysisApiKey bearer token for the analysis service
 * @param analysisModel model identifier sent with each request
 * @param projectDescription free text describing the project, used as prompt context
 * @param smtpHost SMTP submission host
 * @param smtpPort SMTP submission port
 * @param smtpUsername SMTP login
 * @param smtpPassword SMTP password
 * @param fromAddress sender address
 * @param recipient notification recipient
 */
public record WatchConfiguration(String repositoryUrl, @Nullable String accessToken, String branch,
		Path databaseFile, Path reposDirectory, String analysisBaseUrl, String analysisEndpoint,
		String analysisApiKey, String analysisModel, String projectDescription, String smtpHost, int smtpPort,
		String smtpUsername, String smtpPassword, String fromAddress, String recipient) {

	public static final String DEFAULT_BRANCH = "main";

	public static final String DEFAULT_DATABASE_FILE = "commit-watch.db";

	public static final String DEFAULT_REPOS_DIRECTORY = "./repos";

	public static final String DEFAULT_ANALYSIS_ENDPOINT = "/v1/chat/completions";

	public static final String DEFAULT_ANALYSIS_MODEL = "llama3.2-cybersec:latest";

	public static final int DEFAULT_SMTP_PORT = 587;

	/**
	 * Load the configuration from {@link EnvironmentSupport}.
	 * @return validated configuration
	 * @throws ConfigurationException if any required variable is missing or malformed
	 */
	public static WatchConfiguration fromEnvironment() {
		return load(EnvironmentSupport::get);
	}

	/**
	 * Load the configuration from an arbitrary variable lookup.
	 * @param lookup resolves a variable name to its value, or {@code null}
	 * @return validated configuration
	 * @throws ConfigurationException if any required variable is missing or malformed
	 */
	public static WatchConfiguration load(Function<String, @Nullable String> lookup) {
		List<String> problems = new ArrayList<>();

		String repositoryUrl = required(lookup, "REPO_URL", problems);
		String branch = optional(lookup, "REPO_BRANCH", DEFAULT_BRANCH);
		if (!repositoryUrl.isEmpty()) {
			try {
				ScanIdentity.of(repositoryUrl, branch);
			}
			catch (IllegalArgumentException e) {
				problems.add("REPO_URL does not name a repository (got: " + repositoryUrl + ")");
			}
		}
		String databaseFile = optional(lookup, "DB_FILE", DEFAULT_DATABASE_FILE);
		String reposDirectory = optional(lookup, "REPOS_DIR", DEFAULT_REPOS_DIRECTORY);

		String analysisBaseUrl = required(lookup, "BASE_LLM_API", problems);
		String analysisEndpoint = optional(lookup, "PROMPT_LLM_API_ENDPOINT", DEFAULT_ANALYSIS_ENDPOINT);
		String analysisApiKey = required(lookup, "LLM_API_KEY", problems);
		String analysisModel = optional(lookup, "LLM_MODEL", DEFAULT_ANALYSIS_MODEL);

		// older deployments use the misspelled variable name
		String projectDescription = optional(lookup, "PROJECT_DESCRIPTION",
				optional(lookup, "PROJECT_DESCRPTION", ""));

		String smtpHost = required(lookup, "SMTP_SERVER", problems);
		int smtpPort = DEFAULT_SMTP_PORT;
		String smtpPortValue = lookup.apply("SMTP_PORT");
		if (!isBlank(smtpPortValue)) {
			try {
				smtpPort = Integer.parseInt(smtpPortValue.trim());
				if (smtpPort <= 0 || smtpPort > 65535) {
					problems.add("SMTP_PORT must be between 1 and 65535 (got: " + smtpPortValue + ")");
				}
			}
			catch (NumberFormatException e) {
				problems.add("SMTP_PORT must be a number (got: " + smtpPortValue + ")");
			}
		}
		String smtpUsername = required(lookup, "SMTP_USERNAME", problems);
		String smtpPassword = required(lookup, "SMTP_PASSWORD", problems);
		String fromAddress = required(lookup, "FROM_EMAIL", problems);
		String recipient = required(lookup, "TO_EMAIL", problems);

		if (!problems.isEmpty()) {
			throw new ConfigurationException(problems);
		}

		String accessToken = lookup.apply("PERSONAL_TOKEN");
		return new WatchConfiguration(repositoryUrl, isBlank(accessToken) ? null : accessToken.trim(), branch,
				Paths.get(databaseFile), Paths.get(reposDirectory), analysisBaseUrl, analysisEndpoint, analysisApiKey,
				analysisModel, projectDescription, smtpHost, smtpPort, smtpUsername, smtpPassword, fromAddress,
				recipient);
	}

	/**
	 * Identity under which checkpoints for this repository and branch are stored.
	 * @return scan identity
	 */
	public ScanIdentity identity() {
		return ScanIdentity.of(repositoryUrl, branch);
	}

	/**
	 * Local directory holding the mirror of this repository.
	 * @return mirror directory
	 */
	public Path mirrorDirectory() {
		return reposDirectory.resolve(identity().repositoryName());
	}

	/**
	 * Credentials for the mirror, if an access token is configured.
	 * @return credentials, or {@code null} for anonymous access
	 */
	@Nullable
	public GitCredentials credentials() {
		return accessToken != null ? new GitCredentials(accessToken) : null;
	}

	/**
	 * Subject line of the notification email.
	 * @return subject
	 */
	public String notificationSubject() {
		return identity().repositoryName() + " (branch: " + branch + ") code update";
	}

	@Override
	public String toString() {
		return "WatchConfiguration[repositoryUrl=" + repositoryUrl + ", branch=" + branch + ", databaseFile="
				+ databaseFile + ", reposDirectory=" + reposDirectory + ", analysisUrl=" + analysisBaseUrl
				+ analysisEndpoint + ", analysisModel=" + analysisModel + ", smtp=" + smtpHost + ":" + smtpPort
				+ ", fromAddress=" + fromAddress + ", recipient=" + recipient + ", accessToken="
				+ (accessToken != null ? "****" : "(none)") + "]";
	}

	private static String required(Function<String, @Nullable String> lookup, String name, List<String> problems) {
		String value = lookup.apply(name);
		if (isBlank(value)) {
			problems.add(name + " is required");
			return "";
		}
		return value.trim();
	}

	private static String optional(Function<String, @Nullable String> lookup, String name, String defaultValue) {
		String value = lookup.apply(name);
		return isBlank(value) ? defaultValue : value.trim();
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.trim().isEmpty();
	}

}
