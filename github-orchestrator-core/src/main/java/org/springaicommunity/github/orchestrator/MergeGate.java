package org.springaicommunity.github.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a pull request may be merged and merges at most one per call.
 *
 * <p>
 * Among ready pull requests, capability updates go first, then gap analysis, then
 * development; ties go to the lowest number.
 */
public class MergeGate {

	private static final Logger logger = LoggerFactory.getLogger(MergeGate.class);

	private static final Set<Integer> REJECTED_STATUSES = Set.of(405, 409, 422);

	private static final Set<String> PROTECTED_BRANCHES = Set.of("main", "master");

	private final RepositoryService repositoryService;

	private final String mergeMethod;

	private final boolean deleteBranchAfterMerge;

	private final boolean markReadyForReview;

	public MergeGate(RepositoryService repositoryService, String mergeMethod, boolean deleteBranchAfterMerge,
			boolean markReadyForReview) {
		this.repositoryService = repositoryService;
		this.mergeMethod = mergeMethod;
		this.deleteBranchAfterMerge = deleteBranchAfterMerge;
		this.markReadyForReview = markReadyForReview;
	}

	/**
	 * Evaluate readiness without calling GitHub.
	 * @param pr the pull request
	 * @return the assessment
	 */
	public ReadinessAssessment evaluateReadiness(PullRequest pr) {
		return ReadinessAssessment.evaluate(pr, markReadyForReview);
	}

	/**
	 * Pick the next pull request to merge.
	 * @param prs candidate pull requests
	 * @return the highest-priority ready pull request, if any
	 */
	public Optional<PullRequest> selectNext(List<PullRequest> prs) {
		return prs.stream()
			.filter(pr -> evaluateReadiness(pr).ready())
			.min(Comparator.comparingInt((PullRequest pr) -> mergePriority(pr.category()))
				.thenComparingInt(PullRequest::number));
	}

	/**
	 * Select and merge the next ready pull request.
	 * @param prs candidate pull requests
	 * @return the merge result
	 * @throws NoReadyPullRequestException if none is ready, with per-pull-request reasons
	 * @throws MergeRefusedException if the selected pull request could not be merged
	 */
	public MergeResult mergeNext(List<PullRequest> prs) {
		Optional<PullRequest> next = selectNext(prs);
		if (next.isEmpty()) {
			Map<Integer, Set<RefusalReason>> refusals = new LinkedHashMap<>();
			for (PullRequest pr : prs) {
				refusals.put(pr.number(), evaluateReadiness(pr).reasons());
			}
			throw new NoReadyPullRequestException("No open pull request is ready to merge", refusals);
		}
		return mergeIfReady(next.get());
	}

	/**
	 * Merge one pull request if it passes the gate.
	 * @param pr the pull request
	 * @return the merge result
	 * @throws MergeRefusedException if the pull request is not ready or GitHub rejects the
	 * merge
	 */
	public MergeResult mergeIfReady(PullRequest pr) {
		ReadinessAssessment assessment = evaluateReadiness(pr);
		if (!assessment.ready()) {
			logger.info("Refusing to merge pull request #{}: {}", pr.number(), assessment.reasons());
			throw new MergeRefusedException(pr.number(), assessment.reasons(), List.of());
		}

		List<Warning> warnings = new ArrayList<>();
		if (assessment.needsReadyForReview()) {
			try {
				repositoryService.setReadyForReview(pr.nodeId());
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				logger.warn("Could not mark draft pull request #{} ready for review: {}", pr.number(), e.getMessage());
				warnings.add(new Warning(Warning.Kind.READY_FOR_REVIEW_FAILED,
						"Pull request #" + pr.number() + " is still a draft: " + e.getMessage()));
				throw new MergeRefusedException(pr.number(), EnumSet.of(RefusalReason.IS_DRAFT), warnings);
			}
		}

		MergeOutcome outcome;
		try {
			outcome = repositoryService.mergePullRequest(pr.number(), mergeMethod);
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (REJECTED_STATUSES.contains(e.getStatusCode())) {
				logger.warn("GitHub rejected merge of pull request #{} ({}): {}", pr.number(), e.getStatusCode(),
						e.getMessage());
				throw new MergeRefusedException(pr.number(), EnumSet.of(RefusalReason.MERGE_REJECTED), warnings);
			}
			throw e;
		}
		if (!outcome.merged()) {
			logger.warn("GitHub did not merge pull request #{}: {}", pr.number(), outcome.message());
			throw new MergeRefusedException(pr.number(), EnumSet.of(RefusalReason.MERGE_REJECTED), warnings);
		}
		logger.info("Merged pull request #{} ({}) as {}", pr.number(), pr.category(), outcome.sha());

		boolean branchDeleted = deleteBranchAfterMerge && deleteHeadBranch(pr, warnings);
		return new MergeResult(pr.number(), pr.category(), outcome.sha(), branchDeleted, warnings);
	}

	private boolean deleteHeadBranch(PullRequest pr, List<Warning> warnings) {
		String repository = repositoryService.repository();
		if (pr.isFromFork(repository)) {
			logger.debug("Not deleting branch of pull request #{}: head is in {}", pr.number(), pr.headRepository());
			return false;
		}
		if (pr.headRef().isEmpty() || PROTECTED_BRANCHES.contains(pr.headRef())
				|| pr.headRef().equals(pr.baseRef())) {
			logger.debug("Not deleting protected branch {}", pr.headRef());
			return false;
		}
		try {
			repositoryService.deleteBranch(repository, pr.headRef());
			return true;
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			logger.warn("Could not delete branch {} of pull request #{}: {}", pr.headRef(), pr.number(),
					e.getMessage());
			warnings.add(new Warning(Warning.Kind.BRANCH_DELETION_FAILED,
					"Branch " + pr.headRef() + " was not deleted: " + e.getMessage()));
			return false;
		}
	}

	static int mergePriority(WorkCategory category) {
		return switch (category) {
			case CAPABILITY_UPDATE -> 0;
			case GAP_ANALYSIS -> 1;
			case DEVELOPMENT -> 2;
		};
	}

}
