package org.springaicommunity.commitwatch;

import java.time.Instant;

/**
 * One row of the append-only checkpoint log.
 *
 * @param id ordinal assigned by the store, used only to find the latest row
 * @param scanTimestamp instant up to which commits were processed
 */
public record ScanCheckpoint(long id, Instant scanTimestamp) {
}
