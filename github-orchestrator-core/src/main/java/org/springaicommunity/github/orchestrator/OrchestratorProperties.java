package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Configuration properties for the orchestrator loop.
 *
 * <p>
 * Properties can be set directly via setters, loaded from the environment with
 * {@link #fromEnvironment()}, or passed to {@link OrchestratorBuilder}. Command-line
 * flags override whatever the environment provides.
 *
 * <p>
 * Default values are provided for everything except the repository and token.
 */
public class OrchestratorProperties {

	/**
	 * Merge methods accepted by the GitHub merge endpoint.
	 */
	public static final List<String> MERGE_METHODS = List.of("merge", "squash", "rebase");

	/**
	 * Target repository in "owner/repo" format.
	 */
	private @Nullable String repository;

	/**
	 * GitHub token used for every API call.
	 */
	private @Nullable String token;

	/**
	 * REST API base URL. Point at {@code https://host/api/v3} for GitHub Enterprise.
	 */
	private String apiBaseUrl = GitHubHttpClient.DEFAULT_API_BASE;

	/**
	 * Directory holding queue files waiting to become issues.
	 */
	private String pendingDir = "planning/issue_queue/pending";

	/**
	 * Directory queue files are moved to once their issue exists.
	 */
	private String processedDir = "planning/issue_queue/processed";

	/**
	 * Login of the automation actor that new issues are assigned to.
	 */
	private String automationAssignee = "copilot-swe-agent[bot]";

	/**
	 * Merge method: "merge", "squash" or "rebase".
	 */
	private String mergeMethod = "squash";

	/**
	 * Delete the head branch after a successful merge.
	 */
	private boolean deleteBranchAfterMerge = true;

	/**
	 * Flip draft pull requests to ready-for-review when nothing else blocks the merge.
	 */
	private boolean markReadyForReview = true;

	/**
	 * Retries for idempotent GET requests. Zero disables the retrying decorator.
	 */
	private int maxRetries = 0;

	/**
	 * Load properties from {@link EnvironmentSupport}, falling back to defaults.
	 * @return populated properties
	 * @throws IllegalArgumentException if a value cannot be parsed
	 */
	public static OrchestratorProperties fromEnvironment() {
		return fromEnvironment(EnvironmentSupport::get);
	}

	static OrchestratorProperties fromEnvironment(Function<String, @Nullable String> env) {
		OrchestratorProperties properties = new OrchestratorProperties();
		String repository = env.apply("ORCHESTRATOR_REPOSITORY");
		if (repository != null) {
			properties.setRepository(repository);
		}
		String token = env.apply("ORCHESTRATOR_GITHUB_TOKEN");
		if (token == null) {
			token = env.apply("GITHUB_TOKEN");
		}
		if (token != null) {
			properties.setToken(token);
		}
		String baseUrl = env.apply("GITHUB_BASE_URL");
		if (baseUrl != null) {
			properties.setApiBaseUrl(baseUrl);
		}
		String pending = env.apply("ORCHESTRATOR_PENDING_DIR");
		if (pending != null) {
			properties.setPendingDir(pending);
		}
		String processed = env.apply("ORCHESTRATOR_PROCESSED_DIR");
		if (processed != null) {
			properties.setProcessedDir(processed);
		}
		String assignee = env.apply("COPILOT_ASSIGNEE");
		if (assignee != null) {
			properties.setAutomationAssignee(assignee);
		}
		String mergeMethod = env.apply("ORCHESTRATOR_MERGE_METHOD");
		if (mergeMethod != null) {
			properties.setMergeMethod(mergeMethod);
		}
		String deleteBranch = env.apply("ORCHESTRATOR_DELETE_BRANCH");
		if (deleteBranch != null) {
			properties.setDeleteBranchAfterMerge(parseBoolean("ORCHESTRATOR_DELETE_BRANCH", deleteBranch));
		}
		String markReady = env.apply("ORCHESTRATOR_MARK_READY");
		if (markReady != null) {
			properties.setMarkReadyForReview(parseBoolean("ORCHESTRATOR_MARK_READY", markReady));
		}
		String retries = env.apply("ORCHESTRATOR_MAX_RETRIES");
		if (retries != null) {
			try {
				properties.setMaxRetries(Integer.parseInt(retries.trim()));
			}
			catch (NumberFormatException e) {
				throw new IllegalArgumentException(
						"Invalid ORCHESTRATOR_MAX_RETRIES '" + retries + "': must be a non-negative integer");
			}
		}
		return properties;
	}

	private static boolean parseBoolean(String name, String value) {
		switch (value.trim().toLowerCase(Locale.ROOT)) {
			case "true", "1", "yes", "on":
				return true;
			case "false", "0", "no", "off":
				return false;
			default:
				throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be true or false");
		}
	}

	/**
	 * Check that the values needed to talk to GitHub are present and well formed.
	 * @throws IllegalStateException listing every problem found
	 */
	public void validate() {
		StringBuilder errors = new StringBuilder();
		if (repository == null || !repository.matches("[^/\\s]+/[^/\\s]+")) {
			errors.append("\n  - Repository must be set in 'owner/repo' format (ORCHESTRATOR_REPOSITORY or --repo)");
		}
		if (token == null || token.isBlank()) {
			errors.append("\n  - GitHub token is required (ORCHESTRATOR_GITHUB_TOKEN or GITHUB_TOKEN)");
		}
		if (!MERGE_METHODS.contains(mergeMethod)) {
			errors.append("\n  - Merge method must be one of ").append(MERGE_METHODS).append(": ").append(mergeMethod);
		}
		if (maxRetries < 0) {
			errors.append("\n  - Max retries must be non-negative: ").append(maxRetries);
		}
		if (errors.length() > 0) {
			throw new IllegalStateException("Invalid configuration:" + errors);
		}
	}

	public @Nullable String getRepository() {
		return repository;
	}

	public void setRepository(@Nullable String repository) {
		this.repository = repository;
	}

	public @Nullable String getToken() {
		return token;
	}

	public void setToken(@Nullable String token) {
		this.token = token;
	}

	public String getApiBaseUrl() {
		return apiBaseUrl;
	}

	public void setApiBaseUrl(String apiBaseUrl) {
		this.apiBaseUrl = apiBaseUrl;
	}

	public String getPendingDir() {
		return pendingDir;
	}

	public void setPendingDir(String pendingDir) {
		this.pendingDir = pendingDir;
	}

	public String getProcessedDir() {
		return processedDir;
	}

	public void setProcessedDir(String processedDir) {
		this.processedDir = processedDir;
	}

	public String getAutomationAssignee() {
		return automationAssignee;
	}

	public void setAutomationAssignee(String automationAssignee) {
		this.automationAssignee = automationAssignee;
	}

	public String getMergeMethod() {
		return mergeMethod;
	}

	/**
	 * Sets the merge method. The value is lower-cased.
	 * @param mergeMethod "merge", "squash" or "rebase"
	 */
	public void setMergeMethod(String mergeMethod) {
		this.mergeMethod = mergeMethod.trim().toLowerCase(Locale.ROOT);
	}

	public boolean isDeleteBranchAfterMerge() {
		return deleteBranchAfterMerge;
	}

	public void setDeleteBranchAfterMerge(boolean deleteBranchAfterMerge) {
		this.deleteBranchAfterMerge = deleteBranchAfterMerge;
	}

	public boolean isMarkReadyForReview() {
		return markReadyForReview;
	}

	public void setMarkReadyForReview(boolean markReadyForReview) {
		this.markReadyForReview = markReadyForReview;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

}
