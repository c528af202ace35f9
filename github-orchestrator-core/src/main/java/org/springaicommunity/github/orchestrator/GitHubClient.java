package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub API HTTP operations.
 *
 * <p>
 * Provides abstraction over the GitHub REST and GraphQL APIs, enabling testability and
 * decorator implementations such as {@link RetryingGitHubClient}. Paths are relative to
 * the configured API base URL (e.g. {@code /repos/owner/repo/issues}); absolute URLs are
 * passed through unchanged.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path or full URL
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString Query string (without leading ?), may be null
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String getWithQuery(String path, @Nullable String queryString);

	/**
	 * Execute a POST request with a JSON body.
	 * @param path API path
	 * @param jsonBody request body
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String post(String path, String jsonBody);

	/**
	 * Execute a PUT request with a JSON body.
	 * @param path API path
	 * @param jsonBody request body
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String put(String path, String jsonBody);

	/**
	 * Execute a PATCH request with a JSON body.
	 * @param path API path
	 * @param jsonBody request body
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String patch(String path, String jsonBody);

	/**
	 * Execute a DELETE request.
	 * @param path API path
	 * @return Response body as String (usually empty for 204 responses)
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String delete(String path);

	/**
	 * Execute a POST request to the GitHub GraphQL API.
	 * @param body Request body (JSON)
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String postGraphQL(String body);

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
