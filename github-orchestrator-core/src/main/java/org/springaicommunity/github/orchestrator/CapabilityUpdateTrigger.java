package org.springaicommunity.github.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Opens a capability update issue after a development pull request is merged, asking the
 * agent to reconcile the declared capabilities with what was delivered.
 *
 * <p>
 * Idempotent: an open issue with the same title is reused.
 */
public class CapabilityUpdateTrigger {

	private static final Logger logger = LoggerFactory.getLogger(CapabilityUpdateTrigger.class);

	static final String NO_DESCRIPTION = "(no PR description)";

	static final String NO_COMMENTS = "(no PR comments)";

	static final String EMPTY_BODY = "(empty)";

	private final RepositoryService repositoryService;

	private final TemplateStore templateStore;

	private final String automationAssignee;

	public CapabilityUpdateTrigger(RepositoryService repositoryService, TemplateStore templateStore,
			String automationAssignee) {
		this.repositoryService = repositoryService;
		this.templateStore = templateStore;
		this.automationAssignee = automationAssignee;
	}

	/**
	 * Title of the capability update issue for a merged pull request.
	 * @param prNumber merged pull request number
	 * @return the issue title
	 */
	public static String titleFor(int prNumber) {
		return "Update system capabilities based on merged PR #" + prNumber;
	}

	/**
	 * Open (or find) the capability update issue for a merged development pull request.
	 * @param mergedPr the merged pull request
	 * @return the issue identity and whether it was created
	 * @throws IllegalArgumentException if the pull request is not development work
	 * @throws TemplateCorruptedException if the bundled template is unusable
	 */
	public CapabilityUpdateResult onMerge(PullRequest mergedPr) {
		if (mergedPr.category() != WorkCategory.DEVELOPMENT) {
			throw new IllegalArgumentException("Capability updates follow development merges only, but #"
					+ mergedPr.number() + " is " + mergedPr.category());
		}
		String title = titleFor(mergedPr.number());
		IssueTemplate template = templateStore.loadCapabilityUpdateTemplate();

		Optional<Issue> existing = repositoryService.listOpenIssues()
			.stream()
			.filter(issue -> issue.title().equals(title))
			.findFirst();
		if (existing.isPresent()) {
			logger.info("Capability update issue #{} for pull request #{} already open", existing.get().number(),
					mergedPr.number());
			return new CapabilityUpdateResult(existing.get().number(), existing.get().htmlUrl(), false, List.of());
		}

		Map<String, String> values = new LinkedHashMap<>();
		values.put("PR_NUMBER", String.valueOf(mergedPr.number()));
		values.put("PR_TITLE", mergedPr.title());
		values.put("PR_URL", mergedPr.htmlUrl());
		values.put("PR_DESCRIPTION", mergedPr.body().isBlank() ? NO_DESCRIPTION : mergedPr.body().strip());
		values.put("PR_COMMENTS", renderDiscussion(repositoryService.getPullRequestDiscussion(mergedPr.number())));
		IssueTemplate rendered = template.render(values);

		List<String> labels = new ArrayList<>(rendered.labels());
		if (!labels.contains(WorkCategory.CAPABILITY_UPDATE.label())) {
			labels.add(WorkCategory.CAPABILITY_UPDATE.label());
		}
		Issue issue = repositoryService.createIssue(title, rendered.body(), labels);
		List<Warning> warnings = new ArrayList<>();
		AssigneeSupport.assign(repositoryService, issue.number(), automationAssignee, warnings);
		logger.info("Opened capability update issue #{} for merged pull request #{}", issue.number(),
				mergedPr.number());
		return new CapabilityUpdateResult(issue.number(), issue.htmlUrl(), true, warnings);
	}

	/**
	 * Render the discussion as a markdown list in the order given. Bodies keep every line,
	 * indented under a header per entry.
	 */
	static String renderDiscussion(List<DiscussionItem> items) {
		if (items.isEmpty()) {
			return NO_COMMENTS;
		}
		StringBuilder out = new StringBuilder();
		for (DiscussionItem item : items) {
			out.append("- **")
				.append(item.createdAt())
				.append("** *(")
				.append(kindLabel(item.kind()))
				.append(" by ")
				.append(item.author())
				.append(")*\n");
			String body = item.body().strip();
			for (String line : (body.isEmpty() ? EMPTY_BODY : body).split("\\R", -1)) {
				out.append(line.isBlank() ? "" : "  " + line.stripTrailing()).append('\n');
			}
			String url = item.url();
			if (url != null && !url.isBlank()) {
				out.append("  URL: ").append(url).append('\n');
			}
		}
		return out.toString().stripTrailing();
	}

	private static String kindLabel(DiscussionItem.Kind kind) {
		return switch (kind) {
			case ISSUE_COMMENT -> "comment";
			case REVIEW -> "review";
			case REVIEW_COMMENT -> "review comment";
		};
	}

}
