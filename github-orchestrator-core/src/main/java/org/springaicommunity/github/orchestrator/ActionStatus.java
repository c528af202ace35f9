package org.springaicommunity.github.orchestrator;

/**
 * How a loop action ended.
 */
public enum ActionStatus {

	COMPLETED,

	NOTHING_TO_DO,

	REFUSED,

	FAILED

}
