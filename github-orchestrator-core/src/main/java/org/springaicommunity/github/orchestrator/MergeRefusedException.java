package org.springaicommunity.github.orchestrator;

import java.util.List;
import java.util.Set;

/**
 * Thrown when the merge gate, or GitHub itself, refuses to merge a pull request.
 */
public class MergeRefusedException extends OrchestratorException {

	private final int pullRequestNumber;

	private final Set<RefusalReason> reasons;

	private final List<Warning> warnings;

	public MergeRefusedException(int pullRequestNumber, Set<RefusalReason> reasons, List<Warning> warnings) {
		super(ErrorKind.MERGE_REFUSED, "Pull request #" + pullRequestNumber + " cannot be merged: " + reasons);
		this.pullRequestNumber = pullRequestNumber;
		this.reasons = Set.copyOf(reasons);
		this.warnings = List.copyOf(warnings);
	}

	public int getPullRequestNumber() {
		return pullRequestNumber;
	}

	public Set<RefusalReason> getReasons() {
		return reasons;
	}

	/**
	 * Warnings collected before the refusal, such as a failed draft flip.
	 * @return warnings, possibly empty
	 */
	public List<Warning> getWarnings() {
		return warnings;
	}

}
