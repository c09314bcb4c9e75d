package org.springaicommunity.commitwatch;

import org.jspecify.annotations.Nullable;

/**
 * Parsed command-line options.
 */
public class ParsedArguments {

	public boolean dryRun = false;

	public boolean verbose = false;

	public boolean history = false;

	public boolean helpRequested = false;

	// null = use WatchProperties default
	@Nullable
	public Integer lookbackDays;

}
