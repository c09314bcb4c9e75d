package org.springaicommunity.commitwatch;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Summary of a successful run.
 *
 * @param identity repository and branch scanned
 * @param since lower bound used for harvesting
 * @param checkpoint checkpoint written by the run, {@code null} for a dry run
 * @param commitCount commits in range
 * @param fileCount file diffs in range
 * @param outcome how the run ended
 */
public record ScanReport(ScanIdentity identity, Instant since, @Nullable Instant checkpoint, int commitCount,
		int fileCount, ScanOutcome outcome) {
}
