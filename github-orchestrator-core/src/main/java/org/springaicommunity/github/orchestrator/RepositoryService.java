package org.springaicommunity.github.orchestrator;

import java.util.List;

/**
 * Issue and pull request operations against one GitHub repository.
 *
 * <p>
 * Returns strongly-typed records instead of raw JSON. Every method may throw
 * {@link GitHubHttpClient.GitHubApiException}; implementations never retry.
 */
public interface RepositoryService {

	/**
	 * The repository this service talks to.
	 * @return repository in "owner/repo" format
	 */
	String repository();

	/**
	 * List every open issue, excluding pull requests.
	 * @return open issues in ascending number order
	 */
	List<Issue> listOpenIssues();

	/**
	 * Create an issue.
	 * @param title issue title
	 * @param body markdown body
	 * @param labels label names to apply
	 * @return the created issue
	 */
	Issue createIssue(String title, String body, List<String> labels);

	/**
	 * Replace the body of an issue.
	 * @param issueNumber issue number
	 * @param body new markdown body
	 */
	void updateIssueBody(int issueNumber, String body);

	/**
	 * Add assignees to an issue. GitHub silently drops logins it cannot assign, so callers
	 * must check the returned list.
	 * @param issueNumber issue number
	 * @param logins user or bot logins
	 * @return the issue's assignee logins after the call
	 */
	List<String> addAssignees(int issueNumber, List<String> logins);

	/**
	 * List every open pull request. Mergeability is not populated by this listing.
	 * @return open pull requests in ascending number order
	 */
	List<PullRequest> listOpenPullRequests();

	/**
	 * Get a single pull request, including mergeability.
	 * @param number pull request number
	 * @return the pull request
	 */
	PullRequest getPullRequest(int number);

	/**
	 * Get the reviews submitted on a pull request.
	 * @param number pull request number
	 * @return reviews in submission order
	 */
	List<Review> getPullRequestReviews(int number);

	/**
	 * Get conversation comments, reviews and inline review comments of a pull request.
	 * @param number pull request number
	 * @return discussion entries ordered by creation time
	 */
	List<DiscussionItem> getPullRequestDiscussion(int number);

	/**
	 * Merge a pull request.
	 * @param number pull request number
	 * @param mergeMethod "merge", "squash" or "rebase"
	 * @return GitHub's merge response
	 */
	MergeOutcome mergePullRequest(int number, String mergeMethod);

	/**
	 * Mark a draft pull request as ready for review (GraphQL
	 * {@code markPullRequestReadyForReview}).
	 * @param nodeId GraphQL node id of the pull request
	 */
	void setReadyForReview(String nodeId);

	/**
	 * Delete a branch.
	 * @param repository repository owning the branch, "owner/repo"
	 * @param ref branch name without {@code refs/heads/}
	 */
	void deleteBranch(String repository, String ref);

}
