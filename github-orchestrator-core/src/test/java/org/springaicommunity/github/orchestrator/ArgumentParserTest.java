package org.springaicommunity.github.orchestrator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ArgumentParser using plain JUnit only.
 */
@DisplayName("ArgumentParser Tests")
class ArgumentParserTest {

	private OrchestratorProperties defaultProperties;

	private ArgumentParser argumentParser;

	@BeforeEach
	void setUp() {
		defaultProperties = new OrchestratorProperties();
		argumentParser = new ArgumentParser(defaultProperties);
	}

	@Nested
	@DisplayName("Basic Argument Parsing Tests")
	class BasicArgumentParsingTest {

		@ParameterizedTest
		@ValueSource(strings = { "status", "ensure-gap-issue", "promote-next", "merge-ready" })
		@DisplayName("Should accept every command")
		void shouldParseCommand(String command) {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { command });

			assertThat(config.command).isEqualTo(command);
		}

		@Test
		@DisplayName("Should parse options in any position")
		void shouldParseOptions() {
			String[] args = { "--repo", "owner/repo", "merge-ready", "--merge-method", "REBASE", "--no-delete-branch",
					"--no-mark-ready", "--retries", "3", "--pending-dir", "q/pending", "--processed-dir", "q/done",
					"--assignee", "bot", "--json", "-v" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.command).isEqualTo("merge-ready");
			assertThat(config.repository).isEqualTo("owner/repo");
			assertThat(config.mergeMethod).isEqualTo("rebase");
			assertThat(config.deleteBranch).isFalse();
			assertThat(config.markReady).isFalse();
			assertThat(config.retries).isEqualTo(3);
			assertThat(config.pendingDir).isEqualTo("q/pending");
			assertThat(config.processedDir).isEqualTo("q/done");
			assertThat(config.assignee).isEqualTo("bot");
			assertThat(config.json).isTrue();
			assertThat(config.verbose).isTrue();
		}

		@Test
		@DisplayName("Should start from the default properties")
		void shouldUseDefaults() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "status" });

			assertThat(config.mergeMethod).isEqualTo("squash");
			assertThat(config.deleteBranch).isTrue();
			assertThat(config.markReady).isTrue();
			assertThat(config.pendingDir).isEqualTo("planning/issue_queue/pending");
			assertThat(config.repository).isEmpty();
		}

		@Test
		@DisplayName("Should copy flags onto properties")
		void shouldApplyToProperties() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "status", "-r", "owner/repo", "--merge-method", "merge" });
			OrchestratorProperties properties = new OrchestratorProperties();

			config.applyTo(properties);

			assertThat(properties.getRepository()).isEqualTo("owner/repo");
			assertThat(properties.getMergeMethod()).isEqualTo("merge");
		}

	}

	@Nested
	@DisplayName("Validation Tests")
	class ValidationTest {

		@Test
		@DisplayName("Should require a command")
		void shouldRequireCommand() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--json" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("A command is required");
		}

		@Test
		@DisplayName("Should reject unknown commands and options")
		void shouldRejectUnknown() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "collect" }))
				.hasMessageContaining("Unknown command 'collect'");
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "status", "--zip" }))
				.hasMessageContaining("Unknown option: --zip");
		}

		@Test
		@DisplayName("Should allow only one command per run")
		void shouldRejectTwoCommands() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "status", "merge-ready" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Only one command");
		}

		@Test
		@DisplayName("Should collect every configuration error")
		void shouldCollectErrors() {
			String[] args = { "status", "--repo", "not-a-repo", "--merge-method", "octopus", "--retries", "-1" };

			assertThatThrownBy(() -> argumentParser.parseAndValidate(args)).isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("owner/repo")
				.hasMessageContaining("octopus")
				.hasMessageContaining("non-negative");
		}

		@Test
		@DisplayName("Should reject a missing option value")
		void shouldRejectMissingValue() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "status", "--repo" }))
				.hasMessageContaining("Missing value for repo");
		}

		@Test
		@DisplayName("Should skip validation when help is requested")
		void shouldSkipValidationForHelp() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "--help" });

			assertThat(config.helpRequested).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "status", "-h" })).isTrue();
		}

	}

	@Test
	@DisplayName("Should describe commands, environment and exit codes in the help text")
	void shouldGenerateHelpText() {
		String help = argumentParser.generateHelpText();

		assertThat(help).contains("ensure-gap-issue", "promote-next", "merge-ready", "ORCHESTRATOR_REPOSITORY",
				"EXIT CODES", "planning/issue_queue/pending");
	}

}
