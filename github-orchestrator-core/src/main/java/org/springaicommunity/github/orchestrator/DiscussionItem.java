package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * One entry of a pull request's discussion: a conversation comment, a review, or an
 * inline review comment.
 *
 * @param createdAt when the entry was posted
 * @param kind where the entry came from
 * @param author login of the author
 * @param body markdown text
 * @param url web URL of the entry, if GitHub provides one
 */
public record DiscussionItem(Instant createdAt, Kind kind, String author, String body, @Nullable String url) {

	public enum Kind {

		ISSUE_COMMENT, REVIEW, REVIEW_COMMENT

	}

}
