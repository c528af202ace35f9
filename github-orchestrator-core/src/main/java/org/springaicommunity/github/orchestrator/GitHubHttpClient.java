package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client wrapper for GitHub API calls using the JDK {@link HttpClient}.
 *
 * <p>
 * Supports the REST verbs the orchestrator needs (GET, POST, PUT, PATCH, DELETE) plus the
 * GraphQL endpoint. The GraphQL URL is derived from the REST base URL so that GitHub
 * Enterprise Server installations ({@code https://host/api/v3}) resolve to
 * {@code https://host/api/graphql}.
 *
 * <p>
 * Extracts rate limit headers from all responses and makes them available via
 * {@link #getLastRateLimitInfo()}. No retries happen here; see
 * {@link RetryingGitHubClient}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	public static final String DEFAULT_API_BASE = "https://api.github.com";

	private static final String USER_AGENT = "github-orchestrator";

	private final HttpClient httpClient;

	private final String token;

	private final String apiBase;

	private final String graphQLEndpoint;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient(String token) {
		this(token, DEFAULT_API_BASE);
	}

	public GitHubHttpClient(String token, String apiBaseUrl) {
		this.token = token;
		this.apiBase = stripTrailingSlash(apiBaseUrl);
		this.graphQLEndpoint = graphQLEndpointFor(this.apiBase);
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	/**
	 * Derive the GraphQL endpoint from a REST API base URL.
	 * @param apiBase REST base URL without trailing slash
	 * @return GraphQL endpoint URL
	 */
	static String graphQLEndpointFor(String apiBase) {
		String base = stripTrailingSlash(apiBase);
		if (base.endsWith("/api/v3")) {
			return base.substring(0, base.length() - "/api/v3".length()) + "/api/graphql";
		}
		return base + "/graphql";
	}

	private static String stripTrailingSlash(String url) {
		String trimmed = url.trim();
		while (trimmed.endsWith("/")) {
			trimmed = trimmed.substring(0, trimmed.length() - 1);
		}
		return trimmed;
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public String get(String path) {
		String url = resolve(path);
		return send("GET", url, request(url).GET().build());
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String url = resolve(path);
		if (queryString != null && !queryString.isEmpty()) {
			url += "?" + queryString;
		}
		return send("GET", url, request(url).GET().build());
	}

	@Override
	public String post(String path, String jsonBody) {
		String url = resolve(path);
		return send("POST", url, request(url).POST(HttpRequest.BodyPublishers.ofString(jsonBody)).build());
	}

	@Override
	public String put(String path, String jsonBody) {
		String url = resolve(path);
		return send("PUT", url, request(url).PUT(HttpRequest.BodyPublishers.ofString(jsonBody)).build());
	}

	@Override
	public String patch(String path, String jsonBody) {
		String url = resolve(path);
		return send("PATCH", url,
				request(url).method("PATCH", HttpRequest.BodyPublishers.ofString(jsonBody)).build());
	}

	@Override
	public String delete(String path) {
		String url = resolve(path);
		return send("DELETE", url, request(url).DELETE().build());
	}

	@Override
	public String postGraphQL(String body) {
		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(graphQLEndpoint))
			.header("Authorization", "Bearer " + token)
			.header("Content-Type", "application/json")
			.header("User-Agent", USER_AGENT)
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();
		return send("POST GraphQL", graphQLEndpoint, request);
	}

	private String resolve(String path) {
		return path.startsWith("http") ? path : apiBase + path;
	}

	private HttpRequest.Builder request(String url) {
		return HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github+json")
			.header("X-GitHub-Api-Version", "2022-11-28")
			.header("Content-Type", "application/json")
			.header("User-Agent", USER_AGENT);
	}

	private String send(String method, String url, HttpRequest request) {
		logger.debug("{} {}", method, url);
		long start = System.currentTimeMillis();
		try {
			String response = executeRequest(request);
			logger.debug("{} {} completed in {}ms ({} bytes)", method, url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("{} {} failed after {}ms: {}", method, url, System.currentTimeMillis() - start,
					e.getMessage());
			throw e;
		}
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);

			if (remaining >= 0) {
				RateLimitInfo info = new RateLimitInfo(limit, remaining, reset, used);
				this.lastRateLimitInfo = info;
				if (info.isBelow(100)) {
					logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
				else {
					logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
			}

			int statusCode = response.statusCode();
			String body = response.body() != null ? response.body() : "";
			if (statusCode >= 200 && statusCode < 300) {
				return body;
			}
			else if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: Bad credentials. Check ORCHESTRATOR_GITHUB_TOKEN.",
						statusCode, body, remaining, reset);
			}
			else if (statusCode == 403) {
				if (remaining == 0) {
					throw new GitHubApiException("Rate limit exceeded. Resets at epoch: " + reset, statusCode, body,
							remaining, reset);
				}
				throw new GitHubApiException("Forbidden: " + body, statusCode, body, remaining, reset);
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, body, remaining, reset);
			}
			else if (statusCode == 429) {
				throw new GitHubApiException("Too Many Requests (429). Resets at epoch: " + reset, statusCode, body,
						remaining, reset);
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, body, remaining, reset);
			}
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when GitHub API calls fail. This is the upstream error kind of the
	 * orchestrator: it is never retried by the engine and reaches the caller untouched.
	 *
	 * <p>
	 * Carries the HTTP status and rate limit information when available, enabling
	 * {@link RetryingGitHubClient} to decide whether a read is worth repeating.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		private final int rateLimitRemaining;

		private final long resetEpochSeconds;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			this(message, statusCode, responseBody, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
				int rateLimitRemaining, long resetEpochSeconds) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.rateLimitRemaining = rateLimitRemaining;
			this.resetEpochSeconds = resetEpochSeconds;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
			this.rateLimitRemaining = -1;
			this.resetEpochSeconds = -1;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

		public int getRateLimitRemaining() {
			return rateLimitRemaining;
		}

		public long getResetEpochSeconds() {
			return resetEpochSeconds;
		}

		/**
		 * Returns true if this exception represents a rate limit error (either 403 with
		 * remaining=0 or 429).
		 */
		public boolean isRateLimitError() {
			return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
		}

		/**
		 * Returns true for transport failures and 5xx responses.
		 */
		public boolean isTransient() {
			return statusCode < 0 || statusCode >= 500;
		}

	}

}
