package org.springaicommunity.github.orchestrator;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of everything the loop looks at, read once per call.
 *
 * @param queueItems files in the pending directory, excluded ones included, ordered by
 * file name
 * @param processedCount number of files in the processed directory
 * @param openIssues open issues, ascending by number
 * @param openPullRequests open pull requests with category linked from their source
 * issue, ascending by number
 * @param readAt when the snapshot was taken
 */
public record PipelineState(List<QueueItem> queueItems, int processedCount, List<Issue> openIssues,
		List<PullRequest> openPullRequests, Instant readAt) {

	public PipelineState {
		queueItems = queueItems.stream()
			.sorted(Comparator.comparing(QueueItem::fileName))
			.collect(Collectors.toUnmodifiableList());
		openIssues = openIssues.stream()
			.sorted(Comparator.comparingInt(Issue::number))
			.collect(Collectors.toUnmodifiableList());
		openPullRequests = openPullRequests.stream()
			.sorted(Comparator.comparingInt(PullRequest::number))
			.collect(Collectors.toUnmodifiableList());
	}

	/**
	 * @return promotable items, oldest first
	 */
	public List<QueueItem> pendingItems() {
		return queueItems.stream().filter(item -> !item.isExcluded()).collect(Collectors.toList());
	}

	public List<QueueItem> pendingItems(QueueCategory category) {
		return queueItems.stream().filter(item -> item.category() == category).collect(Collectors.toList());
	}

	public int excludedCount() {
		return (int) queueItems.stream().filter(QueueItem::isExcluded).count();
	}

	public List<Issue> openIssues(WorkCategory category) {
		return openIssues.stream().filter(issue -> issue.category() == category).collect(Collectors.toList());
	}

	public List<PullRequest> openPullRequests(WorkCategory category) {
		return openPullRequests.stream().filter(pr -> pr.category() == category).collect(Collectors.toList());
	}

	/**
	 * Open pull requests whose closing keyword references the given issue.
	 * @param issue the issue
	 * @return linked pull requests, ascending by number
	 */
	public List<PullRequest> pullRequestsFor(Issue issue) {
		return openPullRequests.stream()
			.filter(pr -> pr.sourceIssueNumber() != null && pr.sourceIssueNumber() == issue.number())
			.collect(Collectors.toList());
	}

}
