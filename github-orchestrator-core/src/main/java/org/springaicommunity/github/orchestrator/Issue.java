package org.springaicommunity.github.orchestrator;

import java.time.Instant;
import java.util.List;

/**
 * A GitHub issue as the loop sees it.
 *
 * <p>
 * Pull requests returned by the issues endpoint never become {@code Issue} instances.
 *
 * @param number the issue number within the repository
 * @param title the issue title
 * @param body the issue body, empty when GitHub has none
 * @param category category inferred from labels, then from the title
 * @param state OPEN or CLOSED
 * @param htmlUrl the web URL of the issue
 * @param labels label names
 * @param assignees assignee logins
 * @param createdAt when the issue was opened
 * @param updatedAt when the issue last changed
 */
public record Issue(int number, String title, String body, WorkCategory category, State state, String htmlUrl,
		List<String> labels, List<String> assignees, Instant createdAt, Instant updatedAt) {

	public enum State {

		OPEN, CLOSED

	}

	public Issue {
		labels = List.copyOf(labels);
		assignees = List.copyOf(assignees);
	}

	public boolean gapAnalysis() {
		return category == WorkCategory.GAP_ANALYSIS;
	}

	public boolean isOpen() {
		return state == State.OPEN;
	}

}
