package org.springaicommunity.github.orchestrator;

import java.util.Map;
import java.util.Set;

/**
 * Thrown when no open pull request passes the merge gate.
 */
public class NoReadyPullRequestException extends OrchestratorException {

	private final Map<Integer, Set<RefusalReason>> refusals;

	/**
	 * @param message description
	 * @param refusals why each open pull request was not ready, keyed by number
	 */
	public NoReadyPullRequestException(String message, Map<Integer, Set<RefusalReason>> refusals) {
		super(ErrorKind.NO_READY_PULL_REQUEST, message);
		this.refusals = Map.copyOf(refusals);
	}

	public Map<Integer, Set<RefusalReason>> getRefusals() {
		return refusals;
	}

}
