package org.springaicommunity.github.orchestrator;

import java.util.List;

/**
 * Outcome of ensuring the gap analysis issue.
 *
 * @param created whether a new issue was opened
 * @param repaired whether an existing issue's unsafe body was rewritten
 * @param issueNumber the gap analysis issue
 * @param issueUrl web URL of the issue
 * @param warnings degraded best-effort steps
 */
public record GapAnalysisResult(boolean created, boolean repaired, int issueNumber, String issueUrl,
		List<Warning> warnings) {

	public GapAnalysisResult {
		warnings = List.copyOf(warnings);
	}

}
