package org.springaicommunity.commitwatch;

/**
 * How a successful run ended.
 */
public enum ScanOutcome {

	/**
	 * Changes were analyzed and the result was delivered.
	 */
	NOTIFIED,

	/**
	 * No commits were found; nothing was sent.
	 */
	NO_CHANGES,

	/**
	 * The prompt was built and logged; nothing was sent and no checkpoint was written.
	 */
	DRY_RUN

}
