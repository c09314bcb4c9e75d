package org.springaicommunity.commitwatch;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * A commit read from the mirror together with its per-file diffs against the first
 * parent.
 *
 * @param hash full commit id
 * @param timestamp committer timestamp in the committer's offset
 * @param files changed files in diff order
 */
public record CommitRecord(String hash, OffsetDateTime timestamp, List<FileDiff> files) {

	public CommitRecord {
		files = List.copyOf(files);
	}

}
