package org.springaicommunity.commitwatch;

/**
 * Tunable settings for a scan run.
 *
 * <p>
 * Unlike {@link WatchConfiguration}, which holds the deployment-specific values read
 * from the environment, these properties have defaults suitable for most installations.
 * They can be set directly via setters or passed to {@link CommitWatchBuilder}.
 */
public class WatchProperties {

	/**
	 * Minimum delimiter length accepted by {@link DelimiterGenerator}.
	 */
	public static final int MIN_DELIMITER_LENGTH = 64;

	/**
	 * Number of days scanned after a fresh clone.
	 */
	private int lookbackDays = 10;

	/**
	 * Length of the random delimiter fencing the digest inside the prompt.
	 */
	private int delimiterLength = MIN_DELIMITER_LENGTH;

	/**
	 * Connect timeout in seconds for the analysis service.
	 */
	private int analysisConnectTimeoutSeconds = 30;

	/**
	 * Overall request timeout in seconds for the analysis service.
	 */
	private int analysisRequestTimeoutSeconds = 300;

	/**
	 * Timeout in seconds for git network operations (clone, pull).
	 */
	private int gitTimeoutSeconds = 300;

	/**
	 * Connection, read and write timeout in seconds for SMTP submission.
	 */
	private int smtpTimeoutSeconds = 60;

	public int getLookbackDays() {
		return lookbackDays;
	}

	public void setLookbackDays(int lookbackDays) {
		if (lookbackDays <= 0) {
			throw new IllegalArgumentException("Lookback days must be positive: " + lookbackDays);
		}
		this.lookbackDays = lookbackDays;
	}

	public int getDelimiterLength() {
		return delimiterLength;
	}

	public void setDelimiterLength(int delimiterLength) {
		if (delimiterLength < MIN_DELIMITER_LENGTH) {
			throw new IllegalArgumentException(
					"Delimiter length must be at least " + MIN_DELIMITER_LENGTH + ": " + delimiterLength);
		}
		this.delimiterLength = delimiterLength;
	}

	public int getAnalysisConnectTimeoutSeconds() {
		return analysisConnectTimeoutSeconds;
	}

	public void setAnalysisConnectTimeoutSeconds(int analysisConnectTimeoutSeconds) {
		this.analysisConnectTimeoutSeconds = analysisConnectTimeoutSeconds;
	}

	public int getAnalysisRequestTimeoutSeconds() {
		return analysisRequestTimeoutSeconds;
	}

	public void setAnalysisRequestTimeoutSeconds(int analysisRequestTimeoutSeconds) {
		this.analysisRequestTimeoutSeconds = analysisRequestTimeoutSeconds;
	}

	public int getGitTimeoutSeconds() {
		return gitTimeoutSeconds;
	}

	public void setGitTimeoutSeconds(int gitTimeoutSeconds) {
		this.gitTimeoutSeconds = gitTimeoutSeconds;
	}

	public int getSmtpTimeoutSeconds() {
		return smtpTimeoutSeconds;
	}

	public void setSmtpTimeoutSeconds(int smtpTimeoutSeconds) {
		this.smtpTimeoutSeconds = smtpTimeoutSeconds;
	}

}
