package org.springaicommunity.github.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the queue directories and the repository's open issues and pull requests into a
 * {@link PipelineState}.
 *
 * <p>
 * Each open pull request is re-read through the single pull request endpoint, because
 * only that endpoint reports mergeability, and its reviews are consulted so that a
 * reviewer who already reviewed still counts as a requested review. Nothing is cached or
 * retried.
 */
public class ArtifactReader {

	private static final Logger logger = LoggerFactory.getLogger(ArtifactReader.class);

	private final QueueRepository queueRepository;

	private final RepositoryService repositoryService;

	private final Clock clock;

	public ArtifactReader(QueueRepository queueRepository, RepositoryService repositoryService, Clock clock) {
		this.queueRepository = queueRepository;
		this.repositoryService = repositoryService;
		this.clock = clock;
	}

	/**
	 * Take a fresh snapshot.
	 * @return the current pipeline state
	 */
	public PipelineState read() {
		List<QueueItem> items = queueRepository.listPending();
		int processed = queueRepository.countProcessed();
		List<Issue> issues = repositoryService.listOpenIssues();

		Map<Integer, Issue> issuesByNumber = new HashMap<>();
		for (Issue issue : issues) {
			issuesByNumber.put(issue.number(), issue);
		}

		List<PullRequest> prs = new ArrayList<>();
		for (PullRequest listed : repositoryService.listOpenPullRequests()) {
			PullRequest pr = repositoryService.getPullRequest(listed.number());
			if (!pr.reviewRequested()) {
				boolean reviewed = repositoryService.getPullRequestReviews(pr.number())
					.stream()
					.anyMatch(Review::isSubmitted);
				pr = pr.withReviewRequested(reviewed);
			}
			Integer source = pr.sourceIssueNumber();
			if (source != null && issuesByNumber.containsKey(source)) {
				pr = pr.withCategory(issuesByNumber.get(source).category());
			}
			prs.add(pr);
		}

		logger.debug("Read pipeline state: {} queue files, {} processed, {} open issues, {} open pull requests",
				items.size(), processed, issues.size(), prs.size());
		return new PipelineState(items, processed, issues, prs, clock.instant());
	}

}
