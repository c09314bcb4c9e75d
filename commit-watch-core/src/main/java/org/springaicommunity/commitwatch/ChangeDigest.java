package org.springaicommunity.commitwatch;

import java.util.List;

/**
 * Ordered textual digest of every commit and file diff in a scan range.
 *
 * <p>
 * Commits appear oldest first. Each commit contributes a header line followed by one
 * block per changed file; nothing in range is dropped. An empty range yields
 * {@link #NO_CHANGES}.
 *
 * @param text digest text sent to the analysis service
 * @param commitCount number of commits in the digest
 * @param fileCount number of file diffs in the digest
 */
public record ChangeDigest(String text, int commitCount, int fileCount) {

	/**
	 * Sentinel for an empty commit range.
	 */
	public static final ChangeDigest NO_CHANGES = new ChangeDigest("No changes.", 0, 0);

	/**
	 * Build the digest for a list of commits.
	 * @param commits commits ordered oldest first
	 * @return the digest, or {@link #NO_CHANGES} if the list is empty
	 */
	public static ChangeDigest of(List<CommitRecord> commits) {
		if (commits.isEmpty()) {
			return NO_CHANGES;
		}
		StringBuilder text = new StringBuilder();
		int fileCount = 0;
		for (CommitRecord commit : commits) {
			text.append("\nCommit ").append(commit.hash()).append(" - ").append(commit.timestamp());
			for (FileDiff file : commit.files()) {
				text.append("\nFile: ").append(file.path()).append('\n').append(file.diffText());
				fileCount++;
			}
		}
		return new ChangeDigest(text.toString(), commits.size(), fileCount);
	}

	/**
	 * Whether this digest is the empty-range sentinel.
	 * @return true if no commits were found
	 */
	public boolean isEmpty() {
		return commitCount == 0;
	}

}
