package org.springaicommunity.commitwatch;

/**
 * Unified diff of a single file within a commit.
 *
 * @param path repository-relative path (the old path for deletions)
 * @param diffText full unified diff text, including the {@code diff --git} header
 */
public record FileDiff(String path, String diffText) {
}
