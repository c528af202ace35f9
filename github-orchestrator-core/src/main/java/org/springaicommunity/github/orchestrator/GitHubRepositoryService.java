package org.springaicommunity.github.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link RepositoryService} over the GitHub REST and GraphQL APIs.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed records at the service boundary.
 * API failures propagate as {@link GitHubHttpClient.GitHubApiException}.
 */
public class GitHubRepositoryService implements RepositoryService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRepositoryService.class);

	private static final int PAGE_SIZE = 100;

	/**
	 * GitHub closing keywords: close, closes, closed, fix, fixes, fixed, resolve, resolves,
	 * resolved, followed by an issue reference in the same repository.
	 */
	private static final Pattern CLOSING_KEYWORD = Pattern
		.compile("(?i)\\b(?:close[sd]?|fix(?:e[sd])?|resolve[sd]?)\\s*:?\\s+#(\\d+)\\b");

	private static final String READY_FOR_REVIEW_MUTATION = "mutation($id: ID!) { "
			+ "markPullRequestReadyForReview(input: {pullRequestId: $id}) { pullRequest { isDraft } } }";

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	private final String repository;

	public GitHubRepositoryService(GitHubClient httpClient, ObjectMapper objectMapper, String repository) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.repository = repository;
	}

	@Override
	public String repository() {
		return repository;
	}

	@Override
	public List<Issue> listOpenIssues() {
		List<Issue> issues = new ArrayList<>();
		for (JsonNode node : listAllPages("/repos/" + repository + "/issues", "state=open")) {
			if (node.has("pull_request")) {
				continue;
			}
			issues.add(parseIssue(node));
		}
		issues.sort(Comparator.comparingInt(Issue::number));
		logger.debug("Found {} open issues in {}", issues.size(), repository);
		return issues;
	}

	@Override
	public Issue createIssue(String title, String body, List<String> labels) {
		ObjectNode request = objectMapper.createObjectNode();
		request.put("title", title);
		request.put("body", body);
		request.putArray("labels").addAll(labels.stream().map(objectMapper.getNodeFactory()::textNode).toList());
		Issue issue = parseIssue(readTree(httpClient.post("/repos/" + repository + "/issues", write(request))));
		logger.info("Created issue #{} '{}' in {}", issue.number(), issue.title(), repository);
		return issue;
	}

	@Override
	public void updateIssueBody(int issueNumber, String body) {
		ObjectNode request = objectMapper.createObjectNode();
		request.put("body", body);
		httpClient.patch("/repos/" + repository + "/issues/" + issueNumber, write(request));
		logger.info("Updated body of issue #{}", issueNumber);
	}

	@Override
	public List<String> addAssignees(int issueNumber, List<String> logins) {
		ObjectNode request = objectMapper.createObjectNode();
		request.putArray("assignees").addAll(logins.stream().map(objectMapper.getNodeFactory()::textNode).toList());
		JsonNode response = readTree(
				httpClient.post("/repos/" + repository + "/issues/" + issueNumber + "/assignees", write(request)));
		List<String> assignees = new ArrayList<>();
		for (JsonNode user : response.path("assignees")) {
			String login = user.path("login").asText("");
			if (!login.isBlank()) {
				assignees.add(login);
			}
		}
		logger.info("Requested assignees {} on issue #{}, now assigned to {}", logins, issueNumber, assignees);
		return assignees;
	}

	@Override
	public List<PullRequest> listOpenPullRequests() {
		List<PullRequest> prs = new ArrayList<>();
		for (JsonNode node : listAllPages("/repos/" + repository + "/pulls", "state=open")) {
			prs.add(parsePullRequest(node));
		}
		prs.sort(Comparator.comparingInt(PullRequest::number));
		logger.debug("Found {} open pull requests in {}", prs.size(), repository);
		return prs;
	}

	@Override
	public PullRequest getPullRequest(int number) {
		return parsePullRequest(readTree(httpClient.get("/repos/" + repository + "/pulls/" + number)));
	}

	@Override
	public List<Review> getPullRequestReviews(int number) {
		List<Review> reviews = new ArrayList<>();
		for (JsonNode node : listAllPages("/repos/" + repository + "/pulls/" + number + "/reviews", null)) {
			reviews.add(parseReview(node));
		}
		return reviews;
	}

	@Override
	public List<DiscussionItem> getPullRequestDiscussion(int number) {
		List<DiscussionItem> items = new ArrayList<>();
		for (JsonNode node : listAllPages("/repos/" + repository + "/issues/" + number + "/comments", null)) {
			items.add(new DiscussionItem(parseInstant(node.path("created_at").asText(null)),
					DiscussionItem.Kind.ISSUE_COMMENT, login(node.path("user")), node.path("body").asText(""),
					node.path("html_url").asText(null)));
		}
		for (Review review : getPullRequestReviews(number)) {
			if (review.body().isBlank() || review.submittedAt() == null) {
				continue;
			}
			items.add(new DiscussionItem(review.submittedAt(), DiscussionItem.Kind.REVIEW, review.author(),
					review.body(), review.htmlUrl().isEmpty() ? null : review.htmlUrl()));
		}
		for (JsonNode node : listAllPages("/repos/" + repository + "/pulls/" + number + "/comments", null)) {
			items.add(new DiscussionItem(parseInstant(node.path("created_at").asText(null)),
					DiscussionItem.Kind.REVIEW_COMMENT, login(node.path("user")), node.path("body").asText(""),
					node.path("html_url").asText(null)));
		}
		items.sort(Comparator.comparing(DiscussionItem::createdAt));
		return items;
	}

	@Override
	public MergeOutcome mergePullRequest(int number, String mergeMethod) {
		ObjectNode request = objectMapper.createObjectNode();
		request.put("merge_method", mergeMethod);
		JsonNode response = readTree(
				httpClient.put("/repos/" + repository + "/pulls/" + number + "/merge", write(request)));
		MergeOutcome outcome = new MergeOutcome(response.path("merged").asBoolean(false),
				response.path("sha").asText(null), response.path("message").asText(""));
		logger.info("Merge of pull request #{} ({}): merged={} sha={}", number, mergeMethod, outcome.merged(),
				outcome.sha());
		return outcome;
	}

	@Override
	public void setReadyForReview(String nodeId) {
		ObjectNode request = objectMapper.createObjectNode();
		request.put("query", READY_FOR_REVIEW_MUTATION);
		request.putObject("variables").put("id", nodeId);
		String body = httpClient.postGraphQL(write(request));
		JsonNode errors = readTree(body).path("errors");
		if (errors.isArray() && !errors.isEmpty()) {
			throw new GitHubHttpClient.GitHubApiException(
					"GraphQL markPullRequestReadyForReview failed: " + errors.get(0).path("message").asText(), 200,
					body);
		}
		logger.info("Marked pull request {} ready for review", nodeId);
	}

	@Override
	public void deleteBranch(String repository, String ref) {
		httpClient.delete("/repos/" + repository + "/git/refs/heads/" + ref);
		logger.info("Deleted branch {} in {}", ref, repository);
	}

	// ========== Paging ==========

	private List<JsonNode> listAllPages(String path, @Nullable String filter) {
		List<JsonNode> all = new ArrayList<>();
		for (int page = 1;; page++) {
			String query = (filter != null ? filter + "&" : "") + "per_page=" + PAGE_SIZE + "&page=" + page;
			JsonNode nodes = readTree(httpClient.getWithQuery(path, query));
			if (!nodes.isArray()) {
				throw new GitHubHttpClient.GitHubApiException("Expected a JSON array from " + path, 200,
						nodes.toString());
			}
			nodes.forEach(all::add);
			if (nodes.size() < PAGE_SIZE) {
				return all;
			}
		}
	}

	// ========== JSON Parsing Methods ==========

	Issue parseIssue(JsonNode node) {
		String title = node.path("title").asText("");
		List<String> labels = labelNames(node.path("labels"));
		WorkCategory category = WorkCategory.fromLabels(labels)
			.or(() -> WorkCategory.fromTitle(title))
			.orElse(WorkCategory.DEVELOPMENT);
		List<String> assignees = new ArrayList<>();
		for (JsonNode assignee : node.path("assignees")) {
			assignees.add(login(assignee));
		}
		Issue.State state = "closed".equalsIgnoreCase(node.path("state").asText()) ? Issue.State.CLOSED
				: Issue.State.OPEN;
		return new Issue(node.path("number").asInt(), title, node.path("body").asText(""), category, state,
				node.path("html_url").asText(""), labels, assignees,
				parseInstant(node.path("created_at").asText(null)), parseInstant(node.path("updated_at").asText(null)));
	}

	PullRequest parsePullRequest(JsonNode node) {
		String title = node.path("title").asText("");
		String body = node.path("body").asText("");
		List<String> labels = labelNames(node.path("labels"));
		WorkCategory category = WorkCategory.fromLabels(labels)
			.or(() -> WorkCategory.fromTitle(title))
			.orElse(WorkCategory.DEVELOPMENT);

		PullRequest.State state;
		if (node.path("merged").asBoolean(false) || !node.path("merged_at").asText("").isEmpty()) {
			state = PullRequest.State.MERGED;
		}
		else if ("closed".equalsIgnoreCase(node.path("state").asText())) {
			state = PullRequest.State.CLOSED;
		}
		else {
			state = PullRequest.State.OPEN;
		}

		boolean reviewRequested = node.path("requested_reviewers").size() > 0
				|| node.path("requested_teams").size() > 0;
		// mergeable is null while GitHub computes it
		JsonNode mergeable = node.path("mergeable");
		boolean conflicted = (mergeable.isBoolean() && !mergeable.asBoolean())
				|| "dirty".equalsIgnoreCase(node.path("mergeable_state").asText(""));

		JsonNode headRepo = node.path("head").path("repo");
		String headRepository = headRepo.isObject() ? headRepo.path("full_name").asText(null) : null;

		return new PullRequest(node.path("number").asInt(), node.path("node_id").asText(""), title, body, state,
				node.path("draft").asBoolean(false), reviewRequested, conflicted,
				node.path("base").path("ref").asText(""), node.path("head").path("ref").asText(""), headRepository,
				sourceIssueNumber(body), category, labels, node.path("html_url").asText(""),
				parseInstant(node.path("created_at").asText(null)), parseInstant(node.path("updated_at").asText(null)));
	}

	private Review parseReview(JsonNode node) {
		String submitted = node.path("submitted_at").asText(null);
		return new Review(node.path("id").asLong(), node.path("body").asText(""), node.path("state").asText(""),
				submitted != null ? parseInstant(submitted) : null, login(node.path("user")),
				node.path("html_url").asText(""));
	}

	/**
	 * Find the first issue referenced by a GitHub closing keyword.
	 * @param body pull request description
	 * @return the issue number, or {@code null} if none is referenced
	 */
	static @Nullable Integer sourceIssueNumber(String body) {
		Matcher matcher = CLOSING_KEYWORD.matcher(body);
		if (matcher.find()) {
			return Integer.valueOf(matcher.group(1));
		}
		return null;
	}

	private static List<String> labelNames(JsonNode nodes) {
		List<String> labels = new ArrayList<>();
		for (JsonNode label : nodes) {
			String name = label.isTextual() ? label.asText() : label.path("name").asText("");
			if (!name.isEmpty()) {
				labels.add(name);
			}
		}
		return labels;
	}

	private static String login(JsonNode user) {
		return user.path("login").asText("unknown");
	}

	private static Instant parseInstant(@Nullable String value) {
		if (value == null || value.isEmpty()) {
			return Instant.EPOCH;
		}
		try {
			return Instant.parse(value);
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse datetime: {}", value);
			return Instant.EPOCH;
		}
	}

	private JsonNode readTree(String json) {
		try {
			return objectMapper.readTree(json.isEmpty() ? "{}" : json);
		}
		catch (JsonProcessingException e) {
			throw new GitHubHttpClient.GitHubApiException("Malformed GitHub response: " + e.getOriginalMessage(), e);
		}
	}

	private String write(JsonNode node) {
		try {
			return objectMapper.writeValueAsString(node);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize request body", e);
		}
	}

}
