package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a successful merge.
 *
 * @param pullRequestNumber the merged pull request
 * @param category its work category
 * @param sha merge commit SHA
 * @param branchDeleted whether the head branch was deleted
 * @param warnings degraded best-effort steps
 * @param capabilityUpdate the follow-up capability update issue, for development merges
 */
public record MergeResult(int pullRequestNumber, WorkCategory category, @Nullable String sha, boolean branchDeleted,
		List<Warning> warnings, @Nullable CapabilityUpdateResult capabilityUpdate) {

	public MergeResult {
		warnings = List.copyOf(warnings);
	}

	public MergeResult(int pullRequestNumber, WorkCategory category, @Nullable String sha, boolean branchDeleted,
			List<Warning> warnings) {
		this(pullRequestNumber, category, sha, branchDeleted, warnings, null);
	}

	MergeResult withCapabilityUpdate(@Nullable CapabilityUpdateResult update, List<Warning> extraWarnings) {
		List<Warning> combined = new ArrayList<>(warnings);
		combined.addAll(extraWarnings);
		return new MergeResult(pullRequestNumber, category, sha, branchDeleted, combined, update);
	}

}
