package org.springaicommunity.github.orchestrator;

import java.time.Instant;

/**
 * Rate limit headers observed on a GitHub API response.
 *
 * @param limit the maximum number of requests allowed per hour
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 * @param used the number of requests used in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if fewer than {@code threshold} requests remain in the window.
	 * @param threshold remaining-request threshold
	 * @return true if the remaining budget is below the threshold
	 */
	public boolean isBelow(int threshold) {
		return remaining >= 0 && remaining < threshold;
	}

}
