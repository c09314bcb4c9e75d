package org.springaicommunity.commitwatch;

/**
 * Thrown when commits or diffs cannot be read from the mirror. Fatal to the run.
 */
public class HarvestException extends RuntimeException {

	public HarvestException(String message) {
		super(message);
	}

	public HarvestException(String message, Throwable cause) {
		super(message, cause);
	}

}
