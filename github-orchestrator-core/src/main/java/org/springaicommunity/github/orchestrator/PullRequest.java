package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * A GitHub pull request with the signals the merge gate and stage classifier need.
 *
 * @param number the pull request number
 * @param nodeId GraphQL node id, used to flip drafts to ready-for-review
 * @param title the title
 * @param body the description, empty when GitHub has none
 * @param state OPEN, CLOSED or MERGED
 * @param draft whether GitHub marks the pull request as a draft
 * @param reviewRequested whether a reviewer or team was requested, or a review was
 * already submitted
 * @param conflicted whether GitHub reports merge conflicts
 * @param baseRef target branch
 * @param headRef source branch
 * @param headRepository full name of the head repository, {@code null} if the fork was
 * deleted
 * @param sourceIssueNumber issue referenced by a closing keyword in the body, if any
 * @param category category of the linked issue, else from labels or title
 * @param labels label names
 * @param htmlUrl the web URL
 * @param createdAt when the pull request was opened
 * @param updatedAt when the pull request last changed
 */
public record PullRequest(int number, String nodeId, String title, String body, State state, boolean draft,
		boolean reviewRequested, boolean conflicted, String baseRef, String headRef, @Nullable String headRepository,
		@Nullable Integer sourceIssueNumber, WorkCategory category, List<String> labels, String htmlUrl,
		Instant createdAt, Instant updatedAt) {

	public enum State {

		OPEN, CLOSED, MERGED

	}

	public PullRequest {
		labels = List.copyOf(labels);
	}

	public boolean isOpen() {
		return state == State.OPEN;
	}

	/**
	 * Whether the head branch lives outside the given repository.
	 * @param repository "owner/repo" of the base repository
	 * @return true for forks and for deleted head repositories
	 */
	public boolean isFromFork(String repository) {
		return headRepository == null || !headRepository.equalsIgnoreCase(repository);
	}

	/**
	 * Copy with the category resolved from the linked issue.
	 * @param category the resolved category
	 * @return a new pull request
	 */
	public PullRequest withCategory(WorkCategory category) {
		return new PullRequest(number, nodeId, title, body, state, draft, reviewRequested, conflicted, baseRef, headRef,
				headRepository, sourceIssueNumber, category, labels, htmlUrl, createdAt, updatedAt);
	}

	/**
	 * Copy with review information merged in from the reviews endpoint.
	 * @param reviewRequested the combined review signal
	 * @return a new pull request
	 */
	public PullRequest withReviewRequested(boolean reviewRequested) {
		return new PullRequest(number, nodeId, title, body, state, draft, reviewRequested, conflicted, baseRef, headRef,
				headRepository, sourceIssueNumber, category, labels, htmlUrl, createdAt, updatedAt);
	}

}
