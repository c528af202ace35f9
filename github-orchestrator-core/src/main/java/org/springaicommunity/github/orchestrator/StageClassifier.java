package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Infers the current pipeline stage from a {@link PipelineState}.
 *
 * <p>
 * Pure and side-effect free: safe to call as often as needed.
 *
 * @see StageRules
 */
public class StageClassifier {

	private final List<StageRule> rules;

	private final boolean allowDraftFlip;

	public StageClassifier() {
		this(true);
	}

	/**
	 * @param allowDraftFlip whether drafts count as ready when nothing else blocks them
	 */
	public StageClassifier(boolean allowDraftFlip) {
		this.rules = allowDraftFlip ? StageRules.ORDERED : StageRules.ordered(false);
		this.allowDraftFlip = allowDraftFlip;
	}

	/**
	 * Classify a snapshot.
	 * @param state pipeline state
	 * @return the stage snapshot
	 */
	public StageSnapshot classify(PipelineState state) {
		for (StageRule rule : rules) {
			Optional<StageRule.Match> match = rule.apply(state);
			if (match.isPresent()) {
				Stage stage = rule.stage();
				return new StageSnapshot(stage, stage.label(), stage.step(), match.get().focus(), counts(state),
						lastAction(state), warnings(state), state.readAt());
			}
		}
		// the last rule always matches
		throw new IllegalStateException("No stage rule matched");
	}

	private StageCounts counts(PipelineState state) {
		int ready = (int) state.openPullRequests()
			.stream()
			.filter(pr -> ReadinessAssessment.evaluate(pr, allowDraftFlip).ready())
			.count();
		return new StageCounts(state.pendingItems().size(), state.processedCount(), state.excludedCount(),
				state.pendingItems(QueueCategory.DEVELOPMENT).size(),
				state.pendingItems(QueueCategory.CAPABILITY).size(), state.openIssues().size(),
				state.openIssues(WorkCategory.DEVELOPMENT).size(),
				state.openIssues(WorkCategory.CAPABILITY_UPDATE).size(),
				state.openIssues(WorkCategory.GAP_ANALYSIS).size(), state.openPullRequests().size(), ready);
	}

	private List<Warning> warnings(PipelineState state) {
		List<Warning> warnings = new ArrayList<>();
		List<Issue> gapIssues = state.openIssues(WorkCategory.GAP_ANALYSIS);
		if (gapIssues.size() > 1) {
			String numbers = gapIssues.stream().map(issue -> "#" + issue.number()).collect(Collectors.joining(", "));
			warnings.add(new Warning(Warning.Kind.MULTIPLE_GAP_ANALYSIS_ISSUES, "Found " + gapIssues.size()
					+ " open gap analysis issues (" + numbers + "); using #" + gapIssues.get(0).number()));
		}
		return warnings;
	}

	private @Nullable LastAction lastAction(PipelineState state) {
		Stream<LastAction> issueActivity = state.openIssues()
			.stream()
			.map(issue -> new LastAction(issue.updatedAt(), "Issue #" + issue.number() + " updated: " + issue.title()));
		Stream<LastAction> prActivity = state.openPullRequests()
			.stream()
			.map(pr -> new LastAction(pr.updatedAt(), "Pull request #" + pr.number() + " updated: " + pr.title()));
		return Stream.concat(issueActivity, prActivity)
			.max(Comparator.comparing(LastAction::timestamp))
			.orElse(null);
	}

}
