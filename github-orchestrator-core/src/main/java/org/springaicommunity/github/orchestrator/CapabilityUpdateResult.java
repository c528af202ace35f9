package org.springaicommunity.github.orchestrator;

import java.util.List;

/**
 * Outcome of spawning a capability update issue after a development merge.
 *
 * @param issueNumber the capability update issue
 * @param issueUrl web URL of the issue
 * @param created false when an open issue with the same title already existed
 * @param warnings degraded best-effort steps
 */
public record CapabilityUpdateResult(int issueNumber, String issueUrl, boolean created, List<Warning> warnings) {

	public CapabilityUpdateResult {
		warnings = List.copyOf(warnings);
	}

}
