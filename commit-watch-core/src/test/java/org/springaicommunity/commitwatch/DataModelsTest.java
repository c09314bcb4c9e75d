package org.springaicommunity.commitwatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the value types passed between pipeline stages.
 */
@DisplayName("Data Model Tests")
class DataModelsTest {

	@Nested
	@DisplayName("ScanIdentity")
	class ScanIdentityTest {

		@ParameterizedTest
		@CsvSource({ "https://github.com/org/myrepo.git, myrepo", "https://github.com/org/myrepo, myrepo",
				"https://github.com/org/myrepo/, myrepo", "git@github.com:org/myrepo.git, myrepo",
				"https://gitlab.example.com/group/sub/my%20repo.git, my repo",
				"https://github.com/org/c++lib.git, c++lib", "file:///srv/git/tools.git/, tools",
				"ssh://git@host:2222/org/app.git, app", "https://host/org/100%.git, 100%",
				"https://host/org/a%zzb.git, a%zzb" })
		@DisplayName("Should derive the repository name from the URL")
		void shouldDeriveName(String url, String expected) {
			assertThat(ScanIdentity.of(url, "main").repositoryName()).isEqualTo(expected);
		}

		@Test
		@DisplayName("Should name the checkpoint table after repository and branch")
		void shouldBuildTableName() {
			ScanIdentity identity = new ScanIdentity("myrepo", "main");

			assertThat(identity.tableName()).isEqualTo("myrepomain");
			assertThat(identity.toString()).isEqualTo("myrepo@main");
		}

		@Test
		@DisplayName("Should reject blank parts")
		void shouldRejectBlank() {
			assertThatThrownBy(() -> new ScanIdentity(" ", "main")).isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> new ScanIdentity("repo", "")).isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("ChangeDigest")
	class ChangeDigestTest {

		private final OffsetDateTime when = OffsetDateTime.parse("2024-06-01T10:00:00+02:00");

		@Test
		@DisplayName("Should use the sentinel for an empty range")
		void shouldUseSentinel() {
			ChangeDigest digest = ChangeDigest.of(List.of());

			assertThat(digest).isSameAs(ChangeDigest.NO_CHANGES);
			assertThat(digest.text()).isEqualTo("No changes.");
			assertThat(digest.isEmpty()).isTrue();
		}

		@Test
		@DisplayName("Should list every commit and file in order")
		void shouldFormatAllCommits() {
			CommitRecord first = new CommitRecord("aaa", when,
					List.of(new FileDiff("a.txt", "+a"), new FileDiff("b.txt", "+b")));
			CommitRecord second = new CommitRecord("bbb", when.plusHours(1), List.of(new FileDiff("c.txt", "+c")));

			ChangeDigest digest = ChangeDigest.of(List.of(first, second));

			assertThat(digest.text()).isEqualTo("\nCommit aaa - 2024-06-01T10:00+02:00" + "\nFile: a.txt\n+a"
					+ "\nFile: b.txt\n+b" + "\nCommit bbb - 2024-06-01T11:00+02:00" + "\nFile: c.txt\n+c");
			assertThat(digest.commitCount()).isEqualTo(2);
			assertThat(digest.fileCount()).isEqualTo(3);
			assertThat(digest.isEmpty()).isFalse();
		}

		@Test
		@DisplayName("Should count a commit without file changes")
		void shouldCountEmptyCommit() {
			ChangeDigest digest = ChangeDigest.of(List.of(new CommitRecord("aaa", when, List.of())));

			assertThat(digest.isEmpty()).isFalse();
			assertThat(digest.text()).contains("Commit aaa");
		}

	}

	@Nested
	@DisplayName("Records")
	class RecordsTest {

		@Test
		@DisplayName("CommitRecord should copy its file list")
		void commitRecordShouldCopyFiles() {
			List<FileDiff> files = new ArrayList<>(List.of(new FileDiff("a", "+a")));
			CommitRecord record = new CommitRecord("abc", OffsetDateTime.parse("2024-06-01T10:00:00Z"), files);
			files.clear();

			assertThat(record.files()).hasSize(1);
			assertThatThrownBy(() -> record.files().add(new FileDiff("b", "+b")))
				.isInstanceOf(UnsupportedOperationException.class);
		}

		@Test
		@DisplayName("GitCredentials should reject blank tokens and mask its value")
		void gitCredentialsShouldMask() {
			assertThatThrownBy(() -> new GitCredentials(" ")).isInstanceOf(IllegalArgumentException.class);
			assertThat(new GitCredentials("ghp_secret").toString()).doesNotContain("ghp_secret");
		}

		@Test
		@DisplayName("ConfigurationException should list each problem on its own line")
		void configurationExceptionShouldListProblems() {
			ConfigurationException exception = new ConfigurationException(List.of("A is required", "B is required"));

			assertThat(exception.getMessage())
				.isEqualTo("Configuration validation failed:\n  - A is required\n  - B is required");
		}

		@Test
		@DisplayName("ScanFailedException should carry the failed state")
		void scanFailedExceptionShouldCarryState() {
			ScanFailedException exception = new ScanFailedException(PipelineState.NOTIFYING,
					new NotificationDeliveryException("SMTP down", new RuntimeException()));

			assertThat(exception.getFailedState()).isEqualTo(PipelineState.NOTIFYING);
			assertThat(exception).hasMessageContaining("NOTIFYING").hasMessageContaining("SMTP down");
		}

	}

}
