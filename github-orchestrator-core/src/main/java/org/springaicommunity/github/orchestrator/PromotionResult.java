package org.springaicommunity.github.orchestrator;

import java.util.List;

/**
 * Outcome of promoting one queue item.
 *
 * @param issueNumber the issue now tracking the item
 * @param issueUrl web URL of the issue
 * @param queuePath where the item was read from
 * @param processedPath where the item was moved to
 * @param created false when an open issue for the item already existed
 * @param warnings degraded best-effort steps
 */
public record PromotionResult(int issueNumber, String issueUrl, String queuePath, String processedPath,
		boolean created, List<Warning> warnings) {

	public PromotionResult {
		warnings = List.copyOf(warnings);
	}

}
