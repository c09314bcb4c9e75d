package org.springaicommunity.commitwatch;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.RawTextComparator;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevSort;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link ChangeHarvester} backed by Eclipse JGit.
 *
 * <p>
 * Commit times have one-second resolution, so {@code since} is compared at second
 * granularity. Diff bytes are decoded as UTF-8 with malformed input replaced.
 */
public class JGitChangeHarvester implements ChangeHarvester {

	private static final Logger logger = LoggerFactory.getLogger(JGitChangeHarvester.class);

	@Override
	public List<CommitRecord> collectCommits(Path mirrorDirectory, String branch, Instant since) {
		long start = System.currentTimeMillis();
		try (Git git = Git.open(mirrorDirectory.toFile())) {
			Repository repository = git.getRepository();
			ObjectId head = resolveBranch(repository, branch);

			try (RevWalk walk = new RevWalk(repository)) {
				List<RevCommit> inRange = commitsSince(walk, head, since);
				List<CommitRecord> records = new ArrayList<>(inRange.size());
				for (RevCommit commit : inRange) {
					records.add(toRecord(repository, walk, commit));
				}
				logger.info("Harvested {} commits on {} since {} in {}ms", records.size(), branch, since,
						System.currentTimeMillis() - start);
				return records;
			}
		}
		catch (IOException e) {
			throw new HarvestException("Failed to read commits from " + mirrorDirectory + ": " + e.getMessage(), e);
		}
	}

	private ObjectId resolveBranch(Repository repository, String branch) throws IOException {
		for (String name : List.of("refs/heads/" + branch, "refs/remotes/origin/" + branch)) {
			Ref ref = repository.exactRef(name);
			if (ref != null && ref.getObjectId() != null) {
				return ref.getObjectId();
			}
		}
		ObjectId resolved = repository.resolve(branch);
		if (resolved == null) {
			throw new HarvestException("Branch '" + branch + "' not found in " + repository.getDirectory());
		}
		return resolved;
	}

	private List<RevCommit> commitsSince(RevWalk walk, ObjectId head, Instant since) throws IOException {
		walk.markStart(walk.parseCommit(head));
		walk.sort(RevSort.COMMIT_TIME_DESC);

		long sinceSeconds = since.getEpochSecond();
		List<RevCommit> inRange = new ArrayList<>();
		for (RevCommit commit : walk) {
			if (commit.getCommitTime() >= sinceSeconds) {
				inRange.add(commit);
			}
		}
		Collections.reverse(inRange);
		return inRange;
	}

	private CommitRecord toRecord(Repository repository, RevWalk walk, RevCommit commit) throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try (ObjectReader reader = repository.newObjectReader(); DiffFormatter formatter = new DiffFormatter(out)) {
			formatter.setRepository(repository);
			formatter.setDiffComparator(RawTextComparator.DEFAULT);
			formatter.setDetectRenames(true);

			AbstractTreeIterator oldTree;
			if (commit.getParentCount() > 0) {
				RevCommit parent = walk.parseCommit(commit.getParent(0));
				oldTree = new CanonicalTreeParser(null, reader, parent.getTree());
			}
			else {
				oldTree = new EmptyTreeIterator();
			}
			AbstractTreeIterator newTree = new CanonicalTreeParser(null, reader, commit.getTree());

			List<FileDiff> files = new ArrayList<>();
			for (DiffEntry entry : formatter.scan(oldTree, newTree)) {
				formatter.format(entry);
				formatter.flush();
				String text = new String(out.toByteArray(), StandardCharsets.UTF_8);
				out.reset();
				String path = entry.getChangeType() == DiffEntry.ChangeType.DELETE ? entry.getOldPath()
						: entry.getNewPath();
				files.add(new FileDiff(path, text));
			}

			logger.debug("Commit {} touches {} files", commit.getName(), files.size());
			return new CommitRecord(commit.getName(), timestampOf(commit), files);
		}
	}

	private static OffsetDateTime timestampOf(RevCommit commit) {
		PersonIdent committer = commit.getCommitterIdent();
		ZoneOffset offset = ZoneOffset.ofTotalSeconds(committer.getTimeZoneOffset() * 60);
		return OffsetDateTime.ofInstant(Instant.ofEpochSecond(commit.getCommitTime()), offset);
	}

}
