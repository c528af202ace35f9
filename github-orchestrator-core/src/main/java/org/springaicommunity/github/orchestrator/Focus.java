package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;

/**
 * The specific piece of work a stage is about.
 *
 * @param category category of the work
 * @param title issue, pull request or queue item title
 * @param issueNumber the issue, if one exists
 * @param issueUrl web URL of the issue
 * @param pullRequestNumber the pull request, if one exists
 * @param pullRequestUrl web URL of the pull request
 * @param queuePath pending queue file, for issue-creation stages
 */
public record Focus(WorkCategory category, String title, @Nullable Integer issueNumber, @Nullable String issueUrl,
		@Nullable Integer pullRequestNumber, @Nullable String pullRequestUrl, @Nullable String queuePath) {

	static Focus ofIssue(Issue issue, @Nullable PullRequest pr) {
		return new Focus(issue.category(), issue.title(), issue.number(), issue.htmlUrl(),
				pr != null ? pr.number() : null, pr != null ? pr.htmlUrl() : null, null);
	}

	static Focus ofPullRequest(PullRequest pr) {
		return new Focus(pr.category(), pr.title(), pr.sourceIssueNumber(), null, pr.number(), pr.htmlUrl(), null);
	}

	static Focus ofQueueItem(QueueItem item, WorkCategory category) {
		return new Focus(category, item.fileName(), null, null, null, null, item.path().toString());
	}

	static Focus ofCategory(WorkCategory category, String title) {
		return new Focus(category, title, null, null, null, null, null);
	}

}
