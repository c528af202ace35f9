package org.springaicommunity.github.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Best-effort assignment of the automation actor. A failure, or an assignment GitHub
 * accepted but did not keep, becomes a warning.
 */
final class AssigneeSupport {

	private static final Logger logger = LoggerFactory.getLogger(AssigneeSupport.class);

	private static final String BOT_SUFFIX = "[bot]";

	private static final String COPILOT = "copilot";

	private AssigneeSupport() {
	}

	static void assign(RepositoryService repositoryService, int issueNumber, String assignee,
			List<Warning> warnings) {
		if (assignee.isBlank()) {
			return;
		}
		List<String> assigned;
		try {
			assigned = repositoryService.addAssignees(issueNumber, List.of(assignee));
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			logger.warn("Could not assign issue #{} to {}: {}", issueNumber, assignee, e.getMessage());
			warnings.add(new Warning(Warning.Kind.ASSIGNEE_UNAVAILABLE,
					"Issue #" + issueNumber + " was not assigned to " + assignee + ": " + e.getMessage()));
			return;
		}
		if (!isAssigned(assignee, assigned)) {
			logger.warn("GitHub accepted {} for issue #{} but the assignees are {}", assignee, issueNumber, assigned);
			warnings.add(new Warning(Warning.Kind.ASSIGNEE_UNAVAILABLE, "Issue #" + issueNumber
					+ " was not assigned to " + assignee + ": GitHub returned assignees " + assigned));
		}
	}

	/**
	 * Whether the requested login appears among the returned ones. Logins compare
	 * case-insensitively without a {@code [bot]} suffix, and GitHub may list the Copilot
	 * agent as plain {@code Copilot}.
	 */
	static boolean isAssigned(String requested, List<String> assigned) {
		String wanted = normalize(requested);
		for (String login : assigned) {
			String actual = normalize(login);
			if (actual.equals(wanted) || (wanted.contains(COPILOT) && actual.contains(COPILOT))) {
				return true;
			}
		}
		return false;
	}

	private static String normalize(String login) {
		String lower = login.trim().toLowerCase(Locale.ROOT);
		return lower.endsWith(BOT_SUFFIX) ? lower.substring(0, lower.length() - BOT_SUFFIX.length()) : lower;
	}

}
