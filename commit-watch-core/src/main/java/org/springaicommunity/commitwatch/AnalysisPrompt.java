package org.springaicommunity.commitwatch;

/**
 * Prompt sent to the analysis service.
 *
 * @param delimiter random token fencing the untrusted digest
 * @param text complete prompt text
 */
public record AnalysisPrompt(String delimiter, String text) {

	@Override
	public String toString() {
		return "AnalysisPrompt[delimiter=" + delimiter + ", length=" + text.length() + "]";
	}

}
