package org.springaicommunity.github.orchestrator;

/**
 * A best-effort step that failed without failing the action.
 *
 * @param kind what degraded
 * @param message human-readable detail
 */
public record Warning(Kind kind, String message) {

	public enum Kind {

		ASSIGNEE_UNAVAILABLE,

		READY_FOR_REVIEW_FAILED,

		BRANCH_DELETION_FAILED,

		CAPABILITY_UPDATE_FAILED,

		MULTIPLE_GAP_ANALYSIS_ISSUES

	}

}
