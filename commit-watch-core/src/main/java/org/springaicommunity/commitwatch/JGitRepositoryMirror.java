package org.springaicommunity.commitwatch;

import org.eclipse.jgit.api.CloneCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.PullCommand;
import org.eclipse.jgit.api.PullResult;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link RepositoryMirror} backed by Eclipse JGit.
 *
 * <p>
 * Any existing, non-empty directory is treated as the mirror and only pulled, even when
 * it is not a git repository; the harvester then reports it. A clone only happens into
 * a missing or empty directory, and a failed clone removes only what it wrote.
 */
public class JGitRepositoryMirror implements RepositoryMirror {

	private static final Logger logger = LoggerFactory.getLogger(JGitRepositoryMirror.class);

	private final int timeoutSeconds;

	public JGitRepositoryMirror(int timeoutSeconds) {
		this.timeoutSeconds = timeoutSeconds;
	}

	@Override
	public boolean ensureMirror(MirrorRequest request) {
		Path directory = request.directory();
		boolean existed = Files.exists(directory);
		if (existed && !isEmptyDirectory(directory)) {
			if (!Files.isDirectory(directory.resolve(".git"))) {
				logger.warn("{} exists but is not a git repository, leaving it untouched", directory);
			}
			pull(request);
			return false;
		}
		cloneRepository(request, existed);
		return true;
	}

	private void cloneRepository(MirrorRequest request, boolean directoryExisted) {
		Path directory = request.directory();
		logger.info("Cloning {} (branch {}) into {}", request.repositoryUrl(), request.branch(), directory);
		long start = System.currentTimeMillis();

		CloneCommand clone = Git.cloneRepository()
			.setURI(request.repositoryUrl())
			.setDirectory(directory.toFile())
			.setBranch(request.branch())
			.setBranchesToClone(List.of("refs/heads/" + request.branch()))
			.setTimeout(timeoutSeconds);
		if (request.credentials() != null) {
			clone.setCredentialsProvider(request.credentials().toCredentialsProvider());
		}

		try (Git git = clone.call()) {
			logger.info("Clone completed in {}ms", System.currentTimeMillis() - start);
		}
		catch (GitAPIException | JGitInternalException e) {
			logger.error("Clone of {} failed, removing partial mirror", request.repositoryUrl());
			deletePartialMirror(directory, directoryExisted);
			throw new MirrorCloneException("Failed to clone " + request.repositoryUrl() + ": " + e.getMessage(), e);
		}
	}

	private void pull(MirrorRequest request) {
		logger.info("Updating mirror {} (branch {})", request.directory(), request.branch());
		try (Git git = Git.open(request.directory().toFile())) {
			PullCommand pull = git.pull()
				.setRemote("origin")
				.setRemoteBranchName(request.branch())
				.setTimeout(timeoutSeconds);
			if (request.credentials() != null) {
				pull.setCredentialsProvider(request.credentials().toCredentialsProvider());
			}
			PullResult result = pull.call();
			if (!result.isSuccessful()) {
				logger.warn("Pull of {} was not successful ({}), continuing with existing mirror",
						request.repositoryUrl(), result);
			}
		}
		catch (IOException | GitAPIException | JGitInternalException e) {
			logger.warn("Error pulling {}: {}. Continuing with existing mirror", request.repositoryUrl(),
					e.getMessage());
		}
	}

	private void deletePartialMirror(Path directory, boolean directoryExisted) {
		try {
			if (!directoryExisted) {
				FileSystemUtils.deleteRecursively(directory);
				return;
			}
			// keep the pre-existing directory itself, drop what the clone wrote into it
			try (Stream<Path> children = Files.list(directory)) {
				for (Path child : children.collect(Collectors.toList())) {
					FileSystemUtils.deleteRecursively(child);
				}
			}
		}
		catch (IOException e) {
			logger.warn("Failed to delete partial mirror {}: {}", directory, e.getMessage());
		}
	}

	private static boolean isEmptyDirectory(Path directory) {
		if (!Files.isDirectory(directory)) {
			return false;
		}
		try (Stream<Path> entries = Files.list(directory)) {
			return entries.findAny().isEmpty();
		}
		catch (IOException e) {
			logger.warn("Cannot list {}, treating it as an existing mirror: {}", directory, e.getMessage());
			return false;
		}
	}

}
