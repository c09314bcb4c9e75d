package org.springaicommunity.commitwatch;

/**
 * States of a scan run. {@link #DONE} and {@link #FAILED} are terminal.
 */
public enum PipelineState {

	MIRRORING, CHECKPOINT_READ, HARVESTING, NO_CHANGE, PROMPTING, DISPATCHING, NOTIFYING, CHECKPOINT_ADVANCE, DONE,
	FAILED

}
