package org.springaicommunity.github.orchestrator;

/**
 * Machine-readable classification of orchestrator failures.
 */
public enum ErrorKind {

	EMPTY_QUEUE,

	NO_READY_PULL_REQUEST,

	MERGE_REFUSED,

	TEMPLATE_CORRUPTED,

	QUEUE_IO,

	/**
	 * GitHub API failure, raised as {@link GitHubHttpClient.GitHubApiException}.
	 */
	UPSTREAM_API

}
