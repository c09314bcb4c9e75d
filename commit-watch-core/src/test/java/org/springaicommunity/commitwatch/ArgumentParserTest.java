package org.springaicommunity.commitwatch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ArgumentParser}.
 */
@DisplayName("ArgumentParser Tests")
class ArgumentParserTest {

	private ArgumentParser parser;

	@BeforeEach
	void setUp() {
		parser = new ArgumentParser(new WatchProperties());
	}

	@Nested
	@DisplayName("Flag Parsing")
	class FlagParsingTest {

		@Test
		@DisplayName("Should default every flag to off")
		void shouldDefaultToOff() {
			ParsedArguments parsed = parser.parse(new String[0]);

			assertThat(parsed.dryRun).isFalse();
			assertThat(parsed.verbose).isFalse();
			assertThat(parsed.history).isFalse();
			assertThat(parsed.helpRequested).isFalse();
			assertThat(parsed.lookbackDays).isNull();
		}

		@ParameterizedTest
		@CsvSource({ "-d", "--dry-run" })
		@DisplayName("Should parse dry run")
		void shouldParseDryRun(String flag) {
			assertThat(parser.parse(new String[] { flag }).dryRun).isTrue();
		}

		@ParameterizedTest
		@CsvSource({ "-h", "--help" })
		@DisplayName("Should parse help")
		void shouldParseHelp(String flag) {
			assertThat(parser.parse(new String[] { flag }).helpRequested).isTrue();
		}

		@Test
		@DisplayName("Should parse combined flags")
		void shouldParseCombined() {
			ParsedArguments parsed = parser.parse(new String[] { "-v", "--lookback-days", "30", "--dry-run" });

			assertThat(parsed.verbose).isTrue();
			assertThat(parsed.dryRun).isTrue();
			assertThat(parsed.lookbackDays).isEqualTo(30);
		}

		@Test
		@DisplayName("Should apply lookback override to properties")
		void shouldApplyLookback() {
			WatchProperties properties = new WatchProperties();

			parser.applyTo(parser.parse(new String[] { "--lookback-days", "3" }), properties);

			assertThat(properties.getLookbackDays()).isEqualTo(3);
		}

	}

	@Nested
	@DisplayName("Invalid Arguments")
	class InvalidArgumentsTest {

		@Test
		@DisplayName("Should reject unknown options")
		void shouldRejectUnknown() {
			assertThatThrownBy(() -> parser.parse(new String[] { "--repo" })).isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown option: --repo");
		}

		@ParameterizedTest
		@CsvSource({ "abc", "0", "-5" })
		@DisplayName("Should reject invalid lookback values")
		void shouldRejectInvalidLookback(String value) {
			assertThatThrownBy(() -> parser.parse(new String[] { "--lookback-days", value }))
				.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should reject a missing lookback value")
		void shouldRejectMissingValue() {
			assertThatThrownBy(() -> parser.parse(new String[] { "--lookback-days" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Missing value");
		}

		@Test
		@DisplayName("Should reject history combined with dry run")
		void shouldRejectHistoryWithDryRun() {
			assertThatThrownBy(() -> parser.parse(new String[] { "--history", "--dry-run" }))
				.isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Test
	@DisplayName("Should document options, variables and exit codes in help")
	void shouldGenerateHelp() {
		String help = parser.generateHelpText();

		assertThat(help).contains("--dry-run", "--lookback-days", "--history", "REPO_URL", "LLM_API_KEY", "TO_EMAIL",
				"EXIT CODES", "default: 10");
	}

}
