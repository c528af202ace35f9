package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Represents a GitHub pull request review.
 *
 * @param id the unique review identifier
 * @param body the review comment body, empty if none was given
 * @param state "APPROVED", "CHANGES_REQUESTED", "COMMENTED", "DISMISSED" or "PENDING"
 * @param submittedAt when the review was submitted (null if pending)
 * @param author login of the reviewer
 * @param htmlUrl the web URL for viewing this review
 */
public record Review(long id, String body, String state, @Nullable Instant submittedAt, String author,
		String htmlUrl) {

	public boolean isSubmitted() {
		return submittedAt != null && !"PENDING".equals(state);
	}

}
