package org.springaicommunity.github.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The four operations callers invoke. Each performs at most one state-changing step and
 * reports expected conditions through {@link ActionResult} instead of exceptions.
 *
 * <p>
 * {@link GitHubHttpClient.GitHubApiException} is not caught here and reaches the caller
 * unchanged.
 */
public class LoopController {

	private static final Logger logger = LoggerFactory.getLogger(LoopController.class);

	private final ArtifactReader artifactReader;

	private final StageClassifier stageClassifier;

	private final GapAnalysisEnsurer gapAnalysisEnsurer;

	private final QueuePromoter queuePromoter;

	private final MergeGate mergeGate;

	private final CapabilityUpdateTrigger capabilityUpdateTrigger;

	public LoopController(ArtifactReader artifactReader, StageClassifier stageClassifier,
			GapAnalysisEnsurer gapAnalysisEnsurer, QueuePromoter queuePromoter, MergeGate mergeGate,
			CapabilityUpdateTrigger capabilityUpdateTrigger) {
		this.artifactReader = artifactReader;
		this.stageClassifier = stageClassifier;
		this.gapAnalysisEnsurer = gapAnalysisEnsurer;
		this.queuePromoter = queuePromoter;
		this.mergeGate = mergeGate;
		this.capabilityUpdateTrigger = capabilityUpdateTrigger;
	}

	/**
	 * Read the current state and classify it.
	 * @return the stage snapshot
	 */
	public StageSnapshot getStageSnapshot() {
		StageSnapshot snapshot = stageClassifier.classify(artifactReader.read());
		logger.debug("Current stage: {} ({})", snapshot.stage(), snapshot.stageLabel());
		return snapshot;
	}

	public ActionResult<GapAnalysisResult> ensureGapAnalysisIssue() {
		try {
			GapAnalysisResult result = gapAnalysisEnsurer.ensure();
			return ActionResult.completed(result, result.warnings());
		}
		catch (TemplateCorruptedException e) {
			logger.error("Gap analysis template is unusable: {}", e.getMessage());
			return ActionResult.failed(List.of(ErrorKind.TEMPLATE_CORRUPTED.name()));
		}
	}

	public ActionResult<PromotionResult> promoteNextQueueItem() {
		try {
			PromotionResult result = queuePromoter.promoteNext();
			return ActionResult.completed(result, result.warnings());
		}
		catch (EmptyQueueException e) {
			logger.info("Nothing to promote: {}", e.getMessage());
			return ActionResult.nothingToDo(List.of(ErrorKind.EMPTY_QUEUE.name()));
		}
		catch (QueueException e) {
			logger.error("Queue promotion failed: {}", e.getMessage());
			return ActionResult.failed(List.of(ErrorKind.QUEUE_IO.name()));
		}
	}

	/**
	 * Merge the highest-priority ready pull request, then open a capability update issue
	 * if it was development work. A failure of the follow-up never undoes the merge.
	 * @return the action result
	 */
	public ActionResult<MergeResult> mergeNextReadyPullRequest() {
		List<PullRequest> prs = artifactReader.read().openPullRequests();
		MergeResult result;
		try {
			result = mergeGate.mergeNext(prs);
		}
		catch (NoReadyPullRequestException e) {
			List<String> reasons = new ArrayList<>();
			reasons.add(ErrorKind.NO_READY_PULL_REQUEST.name());
			for (Map.Entry<Integer, Set<RefusalReason>> entry : e.getRefusals().entrySet()) {
				reasons.add("#" + entry.getKey() + ": " + describe(entry.getValue()));
			}
			logger.info("No pull request ready to merge ({} open)", prs.size());
			return ActionResult.nothingToDo(reasons);
		}
		catch (MergeRefusedException e) {
			List<String> reasons = e.getReasons().stream().map(Enum::name).sorted().collect(Collectors.toList());
			return ActionResult.refused(reasons, e.getWarnings());
		}

		if (result.category() == WorkCategory.DEVELOPMENT) {
			int mergedNumber = result.pullRequestNumber();
			PullRequest merged = prs.stream()
				.filter(pr -> pr.number() == mergedNumber)
				.findFirst()
				.orElseThrow();
			try {
				CapabilityUpdateResult update = capabilityUpdateTrigger.onMerge(merged);
				result = result.withCapabilityUpdate(update, update.warnings());
			}
			catch (OrchestratorException | GitHubHttpClient.GitHubApiException e) {
				logger.warn("Pull request #{} merged but the capability update issue failed: {}", merged.number(),
						e.getMessage());
				result = result.withCapabilityUpdate(null, List.of(new Warning(Warning.Kind.CAPABILITY_UPDATE_FAILED,
						"Capability update issue for #" + merged.number() + " was not created: " + e.getMessage())));
			}
		}
		return ActionResult.completed(result, result.warnings());
	}

	private static String describe(Set<RefusalReason> reasons) {
		return reasons.stream().map(Enum::name).sorted().collect(Collectors.joining(", "));
	}

}
