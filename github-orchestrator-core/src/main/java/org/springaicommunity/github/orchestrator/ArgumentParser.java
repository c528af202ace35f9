package org.springaicommunity.github.orchestrator;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the orchestrator CLI. Pure Java, no I/O, for maximum
 * testability.
 */
public class ArgumentParser {

	/**
	 * The commands the CLI understands, one per loop operation.
	 */
	public static final List<String> COMMANDS = List.of("status", "ensure-gap-issue", "promote-next", "merge-ready");

	private final OrchestratorProperties defaultProperties;

	public ArgumentParser(OrchestratorProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-r", "--repo":
					config.repository = getRequiredValue(args, i, "repo");
					i++;
					break;

				case "--pending-dir":
					config.pendingDir = getRequiredValue(args, i, "pending-dir");
					i++;
					break;

				case "--processed-dir":
					config.processedDir = getRequiredValue(args, i, "processed-dir");
					i++;
					break;

				case "--assignee":
					config.assignee = getRequiredValue(args, i, "assignee");
					i++;
					break;

				case "--merge-method":
					config.mergeMethod = getRequiredValue(args, i, "merge-method").toLowerCase();
					i++;
					break;

				case "--no-delete-branch":
					config.deleteBranch = false;
					break;

				case "--no-mark-ready":
					config.markReady = false;
					break;

				case "--retries":
					String retriesStr = getRequiredValue(args, i, "retries");
					try {
						config.retries = Integer.parseInt(retriesStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid retries '" + retriesStr + "': must be a non-negative integer");
					}
					i++;
					break;

				case "--json":
					config.json = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					if (!config.command.isEmpty()) {
						throw new IllegalArgumentException(
								"Only one command per run: got '" + config.command + "' and '" + arg + "'");
					}
					config.command = arg;
					break;
			}
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}
		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: orchestrate.java COMMAND [OPTIONS]\n");
		help.append("\n");
		help.append("Advance a GitHub issue/PR loop by exactly one step.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    status                  Show the current pipeline stage (read only)\n");
		help.append("    ensure-gap-issue        Make sure exactly one gap analysis issue is open\n");
		help.append("    promote-next            Turn the oldest pending queue file into an issue\n");
		help.append("    merge-ready             Merge at most one ready pull request\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -r, --repo REPO         Repository in format owner/repo\n");
		help.append("    --pending-dir DIR       Pending queue directory (default: ")
			.append(defaultProperties.getPendingDir())
			.append(")\n");
		help.append("    --processed-dir DIR     Processed queue directory (default: ")
			.append(defaultProperties.getProcessedDir())
			.append(")\n");
		help.append("    --assignee LOGIN        Automation actor to assign (default: ")
			.append(defaultProperties.getAutomationAssignee())
			.append(")\n");
		help.append("    --merge-method METHOD   merge, squash or rebase (default: ")
			.append(defaultProperties.getMergeMethod())
			.append(")\n");
		help.append("    --no-delete-branch      Keep the head branch after merging\n");
		help.append("    --no-mark-ready         Never flip draft pull requests to ready for review\n");
		help.append("    --retries N             Retry failed GET requests N times (default: ")
			.append(defaultProperties.getMaxRetries())
			.append(")\n");
		help.append("    --json                  Print the result as JSON\n");
		help.append("    -v, --verbose           Enable debug logging and stack traces\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES (also read from .env):\n");
		help.append("    ORCHESTRATOR_REPOSITORY      Target repository (owner/repo)\n");
		help.append("    ORCHESTRATOR_GITHUB_TOKEN    GitHub token (falls back to GITHUB_TOKEN)\n");
		help.append("    GITHUB_BASE_URL              REST API base URL for GitHub Enterprise\n");
		help.append("    ORCHESTRATOR_PENDING_DIR     Pending queue directory\n");
		help.append("    ORCHESTRATOR_PROCESSED_DIR   Processed queue directory\n");
		help.append("    COPILOT_ASSIGNEE             Automation actor login\n");
		help.append("    ORCHESTRATOR_MERGE_METHOD    merge, squash or rebase\n");
		help.append("    ORCHESTRATOR_DELETE_BRANCH   true or false\n");
		help.append("    ORCHESTRATOR_MARK_READY      true or false\n");
		help.append("    ORCHESTRATOR_MAX_RETRIES     Retries for GET requests\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0 completed, 1 GitHub or unexpected error, 2 usage error,\n");
		help.append("    3 nothing to do, 4 refused, 5 failed\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    ./orchestrate.java status --repo owner/repo\n");
		help.append("    ./orchestrate.java promote-next --json\n");
		help.append("    ./orchestrate.java merge-ready --merge-method merge --no-delete-branch\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.command.isEmpty()) {
			errors.add("A command is required: one of " + COMMANDS);
		}
		else if (!COMMANDS.contains(config.command)) {
			errors.add("Unknown command '" + config.command + "': must be one of " + COMMANDS);
		}

		if (!config.repository.isEmpty() && !config.repository.matches("[^/\\s]+/[^/\\s]+")) {
			errors.add("Repository must be in format 'owner/repo': " + config.repository);
		}

		if (!OrchestratorProperties.MERGE_METHODS.contains(config.mergeMethod)) {
			errors.add("Invalid merge method '" + config.mergeMethod + "': must be 'merge', 'squash', or 'rebase'");
		}

		if (config.retries < 0) {
			errors.add("Retries must be non-negative: " + config.retries);
		}

		if (config.pendingDir.isBlank() || config.processedDir.isBlank()) {
			errors.add("Queue directories cannot be empty");
		}

		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Configuration errors:\n  - " + String.join("\n  - ", errors));
		}
	}

}
