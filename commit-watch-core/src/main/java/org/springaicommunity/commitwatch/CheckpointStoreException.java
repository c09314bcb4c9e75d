package org.springaicommunity.commitwatch;

/**
 * Thrown when the checkpoint log cannot be read or written. Always fatal to the run.
 */
public class CheckpointStoreException extends RuntimeException {

	public CheckpointStoreException(String message, Throwable cause) {
		super(message, cause);
	}

}
