package org.springaicommunity.commitwatch;

import java.util.List;

/**
 * Thrown at startup when required configuration is missing or malformed.
 *
 * <p>
 * Carries every problem found, so a single run reports the complete list.
 */
public class ConfigurationException extends RuntimeException {

	private final List<String> problems;

	public ConfigurationException(List<String> problems) {
		super(formatMessage(problems));
		this.problems = List.copyOf(problems);
	}

	public List<String> getProblems() {
		return problems;
	}

	private static String formatMessage(List<String> problems) {
		StringBuilder message = new StringBuilder("Configuration validation failed:");
		for (String problem : problems) {
			message.append("\n  - ").append(problem);
		}
		return message.toString();
	}

}
