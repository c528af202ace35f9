package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;

/**
 * Response of the GitHub merge endpoint.
 *
 * @param merged whether GitHub merged the pull request
 * @param sha the merge commit SHA
 * @param message GitHub's message
 */
public record MergeOutcome(boolean merged, @Nullable String sha, String message) {
}
