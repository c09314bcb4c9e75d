package org.springaicommunity.commitwatch.cli;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.PersonIdent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.TimeZone;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the exit codes of {@link CommitWatchCli}. Scans run against a local origin
 * with the configuration supplied through a variable map.
 */
@DisplayName("CommitWatchCli Tests")
class CommitWatchCliTest {

	private final ByteArrayOutputStream output = new ByteArrayOutputStream();

	private PrintStream originalOut;

	@BeforeEach
	void setUp() {
		originalOut = System.out;
		System.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));
	}

	@AfterEach
	void tearDown() {
		System.setOut(originalOut);
	}

	@Test
	@DisplayName("Should print help and exit 0")
	void shouldPrintHelp() {
		int exitCode = CommitWatchCli.run(new String[] { "--help" });

		assertThat(exitCode).isEqualTo(CommitWatchCli.EXIT_OK);
		assertThat(output.toString(StandardCharsets.UTF_8)).contains("Usage: commit-watch").contains("EXIT CODES");
	}

	@Test
	@DisplayName("Should exit 2 for an unknown option")
	void shouldRejectUnknownOption() {
		assertThat(CommitWatchCli.run(new String[] { "--no-such-option" })).isEqualTo(CommitWatchCli.EXIT_USAGE);
	}

	@Test
	@DisplayName("Should exit 2 for an invalid lookback value")
	void shouldRejectInvalidLookback() {
		assertThat(CommitWatchCli.run(new String[] { "--lookback-days", "zero" })).isEqualTo(CommitWatchCli.EXIT_USAGE);
	}

	@Test
	@DisplayName("Should exit 2 when history and dry run are combined")
	void shouldRejectConflictingFlags() {
		assertThat(CommitWatchCli.run(new String[] { "--history", "-d" })).isEqualTo(CommitWatchCli.EXIT_USAGE);
	}

	@Nested
	@DisplayName("Scan Exit Codes")
	class ScanExitCodeTest {

		@TempDir
		Path tempDir;

		private Map<String, String> variables(String repositoryUrl) {
			Map<String, String> variables = new HashMap<>();
			variables.put("REPO_URL", repositoryUrl);
			variables.put("REPOS_DIR", tempDir.resolve("repos").toString());
			variables.put("DB_FILE", tempDir.resolve("checkpoints.db").toString());
			variables.put("BASE_LLM_API", "http://localhost:1");
			variables.put("LLM_API_KEY", "test-key");
			variables.put("SMTP_SERVER", "localhost");
			variables.put("SMTP_USERNAME", "watcher");
			variables.put("SMTP_PASSWORD", "secret");
			variables.put("FROM_EMAIL", "watcher@example.com");
			variables.put("TO_EMAIL", "security@example.com");
			return variables;
		}

		private String originWithOldCommit() throws Exception {
			Path origin = tempDir.resolve("origin");
			try (Git git = Git.init().setDirectory(origin.toFile()).setInitialBranch("main").call()) {
				Files.writeString(origin.resolve("README.md"), "hello\n");
				git.add().addFilepattern("README.md").call();
				PersonIdent ident = new PersonIdent("Test Author", "author@example.com",
						Date.from(Instant.parse("2020-01-01T00:00:00Z")), TimeZone.getTimeZone("UTC"));
				git.commit().setMessage("Initial").setAuthor(ident).setCommitter(ident).setSign(false).call();
			}
			return origin.toUri().toString();
		}

		@Test
		@DisplayName("Should exit 2 when required configuration is missing")
		void shouldExitUsageForMissingConfiguration() {
			assertThat(CommitWatchCli.run(new String[0], name -> null)).isEqualTo(CommitWatchCli.EXIT_USAGE);
		}

		@Test
		@DisplayName("Should exit 1 when the repository cannot be cloned")
		void shouldExitFailedForUnreachableRepository() {
			Map<String, String> variables = variables(tempDir.resolve("missing").toUri().toString());

			assertThat(CommitWatchCli.run(new String[0], variables::get)).isEqualTo(CommitWatchCli.EXIT_SCAN_FAILED);
			assertThat(tempDir.resolve("repos/missing")).doesNotExist();
		}

		@Test
		@DisplayName("Should exit 0 for a run with no new commits and record the checkpoint")
		void shouldExitOkForEmptyRange() throws Exception {
			Map<String, String> variables = variables(originWithOldCommit());

			assertThat(CommitWatchCli.run(new String[0], variables::get)).isEqualTo(CommitWatchCli.EXIT_OK);
			assertThat(CommitWatchCli.run(new String[0], variables::get)).isEqualTo(CommitWatchCli.EXIT_OK);
			assertThat(CommitWatchCli.run(new String[] { "--history" }, variables::get))
				.isEqualTo(CommitWatchCli.EXIT_OK);
			assertThat(tempDir.resolve("checkpoints.db")).exists();
		}

	}

}
