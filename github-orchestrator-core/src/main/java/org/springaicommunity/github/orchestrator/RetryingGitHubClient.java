package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Caller-side decorator that retries idempotent reads on a {@link GitHubClient}.
 *
 * <p>
 * The orchestrator engine itself never retries: every mutating call (issue creation,
 * assignment, merge, branch deletion, GraphQL mutation) is passed straight through so that
 * a failure surfaces to the caller exactly once. Only GET requests are repeated, and only
 * for transient failures (5xx, network) or rate limit errors.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Exponential backoff for transient errors</li>
 * <li>Reset-aware backoff for rate limit errors: sleeps until {@code X-RateLimit-Reset}
 * instead of blind exponential delay</li>
 * </ul>
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(token))
 *     .maxRetries(2)
 *     .initialDelay(Duration.ofSeconds(1))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	/**
	 * Maximum time to wait for a rate limit reset. Beyond this the exponential delay is
	 * used instead.
	 */
	private static final long MAX_RESET_WAIT_SECONDS = 600;

	private final GitHubClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private RetryingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path) {
		return executeWithRetry(() -> delegate.get(path), "GET " + path);
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String desc = "GET " + path + (queryString != null ? "?" + queryString : "");
		return executeWithRetry(() -> delegate.getWithQuery(path, queryString), desc);
	}

	@Override
	public String post(String path, String jsonBody) {
		return delegate.post(path, jsonBody);
	}

	@Override
	public String put(String path, String jsonBody) {
		return delegate.put(path, jsonBody);
	}

	@Override
	public String patch(String path, String jsonBody) {
		return delegate.patch(path, jsonBody);
	}

	@Override
	public String delete(String path) {
		return delegate.delete(path);
	}

	@Override
	public String postGraphQL(String body) {
		return delegate.postGraphQL(body);
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	private String executeWithRetry(Supplier<String> supplier, String description) {
		long delay = initialDelayMs;

		for (int attempt = 0;; attempt++) {
			try {
				return supplier.get();
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				if (!e.isTransient() && !e.isRateLimitError()) {
					throw e;
				}
				if (attempt >= maxRetries) {
					logger.error("{} failed after {} attempts", description, attempt + 1);
					throw e;
				}
				long waitMs = computeWaitTime(e, delay);
				logger.warn("{} failed (attempt {}/{}): {}. Waiting {}ms...", description, attempt + 1,
						maxRetries + 1, e.getMessage(), waitMs);
				sleep(waitMs);
				delay *= 2;
			}
		}
	}

	/**
	 * Rate limit errors with a known, near reset wait until that reset (+1s). Everything
	 * else uses the exponential delay.
	 */
	private long computeWaitTime(GitHubHttpClient.GitHubApiException e, long defaultDelay) {
		if (e.isRateLimitError() && e.getResetEpochSeconds() > 0) {
			long waitSeconds = e.getResetEpochSeconds() - Instant.now().getEpochSecond() + 1;
			if (waitSeconds > 0 && waitSeconds <= MAX_RESET_WAIT_SECONDS) {
				logger.info("Rate limit exceeded. Waiting {} seconds until reset at epoch {}", waitSeconds,
						e.getResetEpochSeconds());
				return waitSeconds * 1000;
			}
		}
		return defaultDelay;
	}

	private void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubHttpClient.GitHubApiException("Retry interrupted", e);
		}
	}

	/**
	 * Builder for {@link RetryingGitHubClient}. Defaults: 2 retries, 1 second initial
	 * delay.
	 */
	public static class Builder {

		private @Nullable GitHubClient delegate;

		private int maxRetries = 2;

		private long initialDelayMs = 1000;

		private Builder() {
		}

		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Build the RetryingGitHubClient.
		 * @return configured RetryingGitHubClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingGitHubClient(this);
		}

	}

}
