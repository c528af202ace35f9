package org.springaicommunity.github.orchestrator.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.orchestrator.*;

import java.io.PrintStream;
import java.util.function.Function;

/**
 * GitHub Orchestrator CLI Application
 *
 * Plain Java command-line application that advances the issue/PR loop of one repository
 * by exactly one step per run. Uses OrchestratorBuilder for service wiring.
 *
 * Usage: java -jar github-orchestrator-cli.jar COMMAND [OPTIONS]
 *
 * Environment Variables: ORCHESTRATOR_REPOSITORY, ORCHESTRATOR_GITHUB_TOKEN (or
 * GITHUB_TOKEN), see --help for the rest.
 *
 * Examples: java -jar github-orchestrator-cli.jar status --repo owner/repo java -jar
 * github-orchestrator-cli.jar promote-next --json java -jar github-orchestrator-cli.jar
 * merge-ready --merge-method merge
 */
public class OrchestratorCli {

	private static final Logger logger = LoggerFactory.getLogger(OrchestratorCli.class);

	static final int EXIT_COMPLETED = 0;

	static final int EXIT_ERROR = 1;

	static final int EXIT_USAGE = 2;

	static final int EXIT_NOTHING_TO_DO = 3;

	static final int EXIT_REFUSED = 4;

	static final int EXIT_FAILED = 5;

	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args) {
		OrchestratorProperties properties;
		try {
			properties = OrchestratorProperties.fromEnvironment();
		}
		catch (IllegalArgumentException e) {
			System.err.println("Error: " + e.getMessage());
			return EXIT_USAGE;
		}
		return run(args, properties,
				props -> OrchestratorBuilder.create().properties(props).buildLoopController(), System.out,
				System.err);
	}

	static int run(String[] args, OrchestratorProperties properties,
			Function<OrchestratorProperties, LoopController> loopFactory, PrintStream out, PrintStream err) {
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_COMPLETED;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
			config.applyTo(properties);
			properties.validate();
		}
		catch (IllegalArgumentException | IllegalStateException e) {
			err.println("Error: " + e.getMessage());
			err.println("Run with --help for usage.");
			return EXIT_USAGE;
		}

		if (config.verbose) {
			enableDebugLogging();
		}
		logger.debug("Running '{}' against {}", config.command, properties.getRepository());

		try {
			LoopController loop = loopFactory.apply(properties);
			ObjectMapper objectMapper = ObjectMapperFactory.create();
			switch (config.command) {
				case "status":
					StageSnapshot snapshot = loop.getStageSnapshot();
					print(out, objectMapper, config.json, snapshot, formatSnapshot(snapshot));
					return EXIT_COMPLETED;
				case "ensure-gap-issue":
					return report(out, objectMapper, config.json, loop.ensureGapAnalysisIssue());
				case "promote-next":
					return report(out, objectMapper, config.json, loop.promoteNextQueueItem());
				default:
					return report(out, objectMapper, config.json, loop.mergeNextReadyPullRequest());
			}
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			err.println("GitHub API error" + (e.getStatusCode() > 0 ? " (" + e.getStatusCode() + ")" : "") + ": "
					+ e.getMessage());
			if (config.verbose) {
				e.printStackTrace(err);
			}
			return EXIT_ERROR;
		}
		catch (RuntimeException e) {
			err.println("Error: " + e.getMessage());
			if (config.verbose) {
				e.printStackTrace(err);
			}
			return EXIT_ERROR;
		}
	}

	static int exitCodeFor(ActionStatus status) {
		return switch (status) {
			case COMPLETED -> EXIT_COMPLETED;
			case NOTHING_TO_DO -> EXIT_NOTHING_TO_DO;
			case REFUSED -> EXIT_REFUSED;
			case FAILED -> EXIT_FAILED;
		};
	}

	private static int report(PrintStream out, ObjectMapper objectMapper, boolean json, ActionResult<?> result) {
		print(out, objectMapper, json, result, formatResult(result));
		return exitCodeFor(result.status());
	}

	private static void print(PrintStream out, ObjectMapper objectMapper, boolean json, Object value, String text) {
		if (!json) {
			out.println(text);
			return;
		}
		try {
			out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to write JSON output", e);
		}
	}

	static String formatSnapshot(StageSnapshot snapshot) {
		StringBuilder text = new StringBuilder();
		text.append("Stage: ")
			.append(snapshot.stage())
			.append(" (")
			.append(snapshot.stageLabel())
			.append(") step ")
			.append(snapshot.activeStep() + 1)
			.append(" of ")
			.append(Stage.values().length)
			.append('\n');
		Focus focus = snapshot.focus();
		if (focus != null) {
			text.append("Focus: ").append(focus.category().label()).append(" - ").append(focus.title());
			if (focus.issueNumber() != null) {
				text.append(" (issue #").append(focus.issueNumber()).append(')');
			}
			if (focus.pullRequestNumber() != null) {
				text.append(" (PR #").append(focus.pullRequestNumber()).append(')');
			}
			text.append('\n');
		}
		else {
			text.append("Focus: none, waiting for queued work\n");
		}
		StageCounts counts = snapshot.counts();
		text.append("Queue: ")
			.append(counts.pending())
			.append(" pending (")
			.append(counts.pendingCapabilityUpdates())
			.append(" capability, ")
			.append(counts.pendingDevelopment())
			.append(" development), ")
			.append(counts.processed())
			.append(" processed, ")
			.append(counts.excluded())
			.append(" excluded\n");
		text.append("Issues: ")
			.append(counts.openIssues())
			.append(" open (")
			.append(counts.openGapAnalysisIssues())
			.append(" gap analysis, ")
			.append(counts.openCapabilityUpdateIssues())
			.append(" capability, ")
			.append(counts.openDevelopmentIssues())
			.append(" development)\n");
		text.append("Pull requests: ")
			.append(counts.openPullRequests())
			.append(" open, ")
			.append(counts.readyPullRequests())
			.append(" ready");
		LastAction lastAction = snapshot.lastAction();
		if (lastAction != null) {
			text.append("\nLast activity: ").append(lastAction.summary()).append(" at ").append(lastAction.timestamp());
		}
		for (Warning warning : snapshot.warnings()) {
			text.append("\nWarning: ").append(warning.kind()).append(": ").append(warning.message());
		}
		return text.toString();
	}

	static String formatResult(ActionResult<?> result) {
		StringBuilder text = new StringBuilder("Result: ").append(result.status());
		Object value = result.value();
		if (value instanceof GapAnalysisResult gap) {
			text.append("\nGap analysis issue #")
				.append(gap.issueNumber())
				.append(gap.created() ? " created" : gap.repaired() ? " repaired" : " already open")
				.append(": ")
				.append(gap.issueUrl());
		}
		else if (value instanceof PromotionResult promotion) {
			text.append("\nIssue #")
				.append(promotion.issueNumber())
				.append(promotion.created() ? " created" : " already existed")
				.append(": ")
				.append(promotion.issueUrl())
				.append("\nMoved ")
				.append(promotion.queuePath())
				.append(" -> ")
				.append(promotion.processedPath());
		}
		else if (value instanceof MergeResult merge) {
			text.append("\nMerged PR #")
				.append(merge.pullRequestNumber())
				.append(" (")
				.append(merge.category().label())
				.append(") as ")
				.append(merge.sha())
				.append(merge.branchDeleted() ? ", branch deleted" : "");
			CapabilityUpdateResult update = merge.capabilityUpdate();
			if (update != null) {
				text.append("\nCapability update issue #")
					.append(update.issueNumber())
					.append(update.created() ? " created" : " already open")
					.append(": ")
					.append(update.issueUrl());
			}
		}
		for (String reason : result.reasons()) {
			text.append("\nReason: ").append(reason);
		}
		for (Warning warning : result.warnings()) {
			text.append("\nWarning: ").append(warning.kind()).append(": ").append(warning.message());
		}
		return text.toString();
	}

	private static void enableDebugLogging() {
		org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
			logbackRoot.setLevel(Level.DEBUG);
		}
	}

}
