package org.springaicommunity.github.orchestrator;

import java.time.Instant;

/**
 * Most recent activity visible in a snapshot, derived from open issues and pull requests.
 *
 * @param timestamp when the activity happened
 * @param summary one-line description
 */
public record LastAction(Instant timestamp, String summary) {
}
