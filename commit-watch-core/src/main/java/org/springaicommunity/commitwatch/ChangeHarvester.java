package org.springaicommunity.commitwatch;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Reads the commits of a branch made since a given instant.
 */
public interface ChangeHarvester {

	/**
	 * List commits on {@code branch} with a committer timestamp at or after
	 * {@code since}, oldest first, each with its diffs against its first parent.
	 * @param mirrorDirectory local repository
	 * @param branch branch to walk
	 * @param since inclusive lower bound
	 * @return commits in range
	 * @throws HarvestException if the repository cannot be read
	 */
	List<CommitRecord> collectCommits(Path mirrorDirectory, String branch, Instant since);

	/**
	 * Collect the commits in range and render them as a digest.
	 * @param mirrorDirectory local repository
	 * @param branch branch to walk
	 * @param since inclusive lower bound
	 * @return the digest, or {@link ChangeDigest#NO_CHANGES} for an empty range
	 * @throws HarvestException if the repository cannot be read
	 */
	default ChangeDigest harvest(Path mirrorDirectory, String branch, Instant since) {
		return ChangeDigest.of(collectCommits(mirrorDirectory, branch, since));
	}

}
