package org.springaicommunity.github.orchestrator;

/**
 * Why a pull request is not mergeable.
 */
public enum RefusalReason {

	NOT_OPEN,

	IS_DRAFT,

	WORK_IN_PROGRESS,

	REVIEW_NOT_REQUESTED,

	MERGE_CONFLICT,

	/**
	 * GitHub answered the merge request with 405, 409 or 422.
	 */
	MERGE_REJECTED

}
