package org.springaicommunity.github.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Guarantees exactly one open gap analysis issue.
 *
 * <p>
 * An existing issue is left alone unless its body carries one of the self-referential
 * instructions older templates used, in which case the body is replaced with the bundled
 * template and the automation actor is re-assigned.
 */
public class GapAnalysisEnsurer {

	private static final Logger logger = LoggerFactory.getLogger(GapAnalysisEnsurer.class);

	private static final List<Pattern> UNSAFE_BODY_PATTERNS = List.of(
			Pattern.compile("issue_templates/gap[-_]analysis", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\b(?:open|create|file)\\s+(?:a\\s+new|another|a)\\s+gap[-\\s]analysis\\s+issue",
					Pattern.CASE_INSENSITIVE),
			Pattern.compile("follow\\s+(?:the\\s+)?(?:instructions|steps)\\s+(?:in|of)\\s+this\\s+issue"
					+ "|this\\s+issue'?s\\s+instructions", Pattern.CASE_INSENSITIVE));

	private final RepositoryService repositoryService;

	private final TemplateStore templateStore;

	private final String automationAssignee;

	public GapAnalysisEnsurer(RepositoryService repositoryService, TemplateStore templateStore,
			String automationAssignee) {
		this.repositoryService = repositoryService;
		this.templateStore = templateStore;
		this.automationAssignee = automationAssignee;
	}

	/**
	 * Ensure an open gap analysis issue exists.
	 * @return identity of the gap analysis issue and what was done
	 * @throws TemplateCorruptedException if the bundled template cannot be parsed
	 */
	public GapAnalysisResult ensure() {
		IssueTemplate template = templateStore.loadGapAnalysisTemplate();
		List<Warning> warnings = new ArrayList<>();

		List<Issue> existing = repositoryService.listOpenIssues().stream().filter(Issue::gapAnalysis).toList();
		if (!existing.isEmpty()) {
			Issue issue = existing.get(0);
			if (existing.size() > 1) {
				logger.warn("Found {} open gap analysis issues; using #{}", existing.size(), issue.number());
				warnings.add(new Warning(Warning.Kind.MULTIPLE_GAP_ANALYSIS_ISSUES,
						existing.size() + " open gap analysis issues; using #" + issue.number()));
			}
			if (isUnsafe(issue.body())) {
				logger.info("Gap analysis issue #{} has unsafe instructions; replacing its body", issue.number());
				repositoryService.updateIssueBody(issue.number(), template.body());
				AssigneeSupport.assign(repositoryService, issue.number(), automationAssignee, warnings);
				return new GapAnalysisResult(false, true, issue.number(), issue.htmlUrl(), warnings);
			}
			logger.debug("Gap analysis issue #{} already open", issue.number());
			return new GapAnalysisResult(false, false, issue.number(), issue.htmlUrl(), warnings);
		}

		List<String> labels = new ArrayList<>(template.labels());
		if (!labels.contains(WorkCategory.GAP_ANALYSIS.label())) {
			labels.add(WorkCategory.GAP_ANALYSIS.label());
		}
		Issue created = repositoryService.createIssue(template.title(), template.body(), labels);
		AssigneeSupport.assign(repositoryService, created.number(), automationAssignee, warnings);
		return new GapAnalysisResult(true, false, created.number(), created.htmlUrl(), warnings);
	}

	static boolean isUnsafe(String body) {
		return UNSAFE_BODY_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(body).find());
	}

}
