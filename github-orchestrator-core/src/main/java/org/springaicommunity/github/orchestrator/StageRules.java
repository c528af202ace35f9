package org.springaicommunity.github.orchestrator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The classifier's priority list, evaluated top to bottom; the first match wins.
 *
 * <ol>
 * <li>No open gap analysis issue: {@link Stage#GAP_ISSUE}</li>
 * <li>A ready gap analysis pull request: {@link Stage#GAP_MERGE}</li>
 * <li>An open gap analysis pull request: {@link Stage#GAP_EXECUTION}</li>
 * <li>Capability updates: merge, then execution, then issue creation</li>
 * <li>Development: merge, then execution, then issue creation</li>
 * <li>Otherwise the loop is idle at {@link Stage#DEV_ISSUE_CREATION}</li>
 * </ol>
 *
 * Ties go to the lowest issue number, the lowest pull request number and the oldest
 * queue file.
 */
public final class StageRules {

	/**
	 * Rules for the default configuration, where drafts may be flipped to
	 * ready-for-review.
	 */
	public static final List<StageRule> ORDERED = ordered(true);

	private StageRules() {
	}

	/**
	 * Build the ordered rules.
	 * @param allowDraftFlip whether draft pull requests count as ready when nothing else
	 * blocks them
	 * @return immutable rule list
	 */
	public static List<StageRule> ordered(boolean allowDraftFlip) {
		Predicate<PullRequest> ready = pr -> ReadinessAssessment.evaluate(pr, allowDraftFlip).ready();
		List<StageRule> rules = new ArrayList<>();

		rules.add(new StageRule(Stage.GAP_ISSUE, state -> state.openIssues(WorkCategory.GAP_ANALYSIS).isEmpty()
				? StageRule.Match
					.of(Focus.ofCategory(WorkCategory.GAP_ANALYSIS, WorkCategory.GAP_ANALYSIS.titlePrefix()))
				: Optional.<StageRule.Match>empty()));
		rules.add(new StageRule(Stage.GAP_MERGE, state -> gapPullRequests(state).stream()
			.filter(ready)
			.findFirst()
			.flatMap(pr -> StageRule.Match.of(gapFocus(state, pr)))));
		rules.add(new StageRule(Stage.GAP_EXECUTION, state -> gapPullRequests(state).stream()
			.findFirst()
			.flatMap(pr -> StageRule.Match.of(gapFocus(state, pr)))));

		addCategoryRules(rules, WorkCategory.CAPABILITY_UPDATE, QueueCategory.CAPABILITY, Stage.CAP_MERGE,
				Stage.CAP_EXECUTION, Stage.CAP_ISSUE, ready);
		addCategoryRules(rules, WorkCategory.DEVELOPMENT, QueueCategory.DEVELOPMENT, Stage.DEV_MERGE,
				Stage.DEV_EXECUTION, Stage.DEV_ISSUE_CREATION, ready);

		rules.add(new StageRule(Stage.DEV_ISSUE_CREATION, state -> StageRule.Match.idle()));
		return List.copyOf(rules);
	}

	private static void addCategoryRules(List<StageRule> rules, WorkCategory category, QueueCategory queueCategory,
			Stage merge, Stage execution, Stage issueCreation, Predicate<PullRequest> ready) {
		rules.add(new StageRule(merge, state -> state.openPullRequests(category)
			.stream()
			.filter(ready)
			.findFirst()
			.flatMap(pr -> StageRule.Match.of(focusFor(state, pr)))));
		rules.add(new StageRule(execution, state -> {
			List<Issue> issues = state.openIssues(category);
			if (!issues.isEmpty()) {
				Issue issue = issues.get(0);
				List<PullRequest> linked = state.pullRequestsFor(issue);
				return StageRule.Match.of(Focus.ofIssue(issue, linked.isEmpty() ? null : linked.get(0)));
			}
			return state.openPullRequests(category)
				.stream()
				.findFirst()
				.flatMap(pr -> StageRule.Match.of(Focus.ofPullRequest(pr)));
		}));
		rules.add(new StageRule(issueCreation, state -> state.pendingItems(queueCategory)
			.stream()
			.findFirst()
			.flatMap(item -> StageRule.Match.of(Focus.ofQueueItem(item, category)))));
	}

	private static Focus focusFor(PipelineState state, PullRequest pr) {
		Integer source = pr.sourceIssueNumber();
		if (source != null) {
			for (Issue issue : state.openIssues()) {
				if (issue.number() == source) {
					return Focus.ofIssue(issue, pr);
				}
			}
		}
		return Focus.ofPullRequest(pr);
	}

	// an unlinked gap analysis pull request is attributed to the primary issue
	private static Focus gapFocus(PipelineState state, PullRequest pr) {
		Focus focus = focusFor(state, pr);
		return focus.issueNumber() != null ? focus
				: Focus.ofIssue(state.openIssues(WorkCategory.GAP_ANALYSIS).get(0), pr);
	}

	/**
	 * Pull requests linked to the primary (lowest numbered) gap analysis issue, or every
	 * open gap analysis pull request when none is linked to it.
	 */
	static List<PullRequest> gapPullRequests(PipelineState state) {
		List<Issue> gapIssues = state.openIssues(WorkCategory.GAP_ANALYSIS);
		if (!gapIssues.isEmpty()) {
			List<PullRequest> linked = state.pullRequestsFor(gapIssues.get(0));
			if (!linked.isEmpty()) {
				return linked;
			}
		}
		return state.openPullRequests(WorkCategory.GAP_ANALYSIS);
	}

}
