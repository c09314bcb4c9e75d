package org.springaicommunity.commitwatch;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of scan checkpoints, one append-only log per {@link ScanIdentity}.
 *
 * <p>
 * A single writer per identity is assumed. Runs for the same repository and branch must
 * be serialized by the scheduler.
 */
public interface CheckpointStore {

	/**
	 * Resolve the instant from which commits should be harvested.
	 * @param identity repository and branch
	 * @param freshMirror true when the mirror was cloned by the current run; the
	 * configured lookback window is then used regardless of stored rows
	 * @return the lookback start for a fresh mirror, otherwise the latest recorded
	 * timestamp, or {@link Instant#EPOCH} when nothing has been recorded yet
	 * @throws CheckpointStoreException if the log cannot be read
	 */
	Instant getLastScan(ScanIdentity identity, boolean freshMirror);

	/**
	 * Append a checkpoint.
	 * @param identity repository and branch
	 * @param timestamp instant up to which commits were processed
	 * @throws CheckpointStoreException if the row cannot be written
	 */
	void recordScan(ScanIdentity identity, Instant timestamp);

	/**
	 * Latest recorded checkpoint.
	 * @param identity repository and branch
	 * @return the row with the highest id, or empty
	 */
	Optional<ScanCheckpoint> latest(ScanIdentity identity);

	/**
	 * Every recorded checkpoint, oldest first.
	 * @param identity repository and branch
	 * @return rows in id order
	 */
	List<ScanCheckpoint> history(ScanIdentity identity);

}
