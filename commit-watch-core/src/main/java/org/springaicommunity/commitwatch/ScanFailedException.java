package org.springaicommunity.commitwatch;

/**
 * Thrown when a run ends in {@link PipelineState#FAILED}. No checkpoint is written for
 * a failed run, so the same commit range is processed again by the next one.
 */
public class ScanFailedException extends RuntimeException {

	private final PipelineState failedState;

	public ScanFailedException(PipelineState failedState, Throwable cause) {
		super("Scan failed during " + failedState + ": " + cause.getMessage(), cause);
		this.failedState = failedState;
	}

	/**
	 * State the run was in when the failure occurred.
	 * @return the failed state
	 */
	public PipelineState getFailedState() {
		return failedState;
	}

}
