package org.springaicommunity.github.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the oldest pending queue file into a GitHub issue, one per call.
 *
 * <p>
 * The file is moved to the processed directory only after the issue exists, so a crash
 * leaves the file pending. The next call then finds the open issue through the queue-id
 * marker in its body and only finishes the move.
 */
public class QueuePromoter {

	private static final Logger logger = LoggerFactory.getLogger(QueuePromoter.class);

	private final QueueRepository queueRepository;

	private final RepositoryService repositoryService;

	private final String automationAssignee;

	public QueuePromoter(QueueRepository queueRepository, RepositoryService repositoryService,
			String automationAssignee) {
		this.queueRepository = queueRepository;
		this.repositoryService = repositoryService;
		this.automationAssignee = automationAssignee;
	}

	/**
	 * Promote the oldest pending item.
	 * @return the promotion result
	 * @throws EmptyQueueException if nothing is pending
	 * @throws QueueException if the item is malformed or cannot be moved
	 */
	public PromotionResult promoteNext() {
		QueueItem item = queueRepository.listPending()
			.stream()
			.filter(candidate -> !candidate.isExcluded())
			.findFirst()
			.orElseThrow(() -> new EmptyQueueException("No pending queue items"));

		QueueDocument document = queueRepository.read(item);
		WorkCategory category = item.category().toWorkCategory();
		List<Warning> warnings = new ArrayList<>();

		Optional<Issue> existing = findExisting(item, document);
		Issue issue;
		boolean created;
		if (existing.isPresent()) {
			issue = existing.get();
			created = false;
			logger.info("Queue item {} already has open issue #{}", item.fileName(), issue.number());
		}
		else {
			issue = repositoryService.createIssue(document.title(), document.body(), List.of(category.label()));
			created = true;
			AssigneeSupport.assign(repositoryService, issue.number(), automationAssignee, warnings);
		}

		Path processed;
		try {
			processed = queueRepository.movePendingToProcessed(item);
		}
		catch (QueueException e) {
			logger.error("Issue #{} exists but {} stayed pending; a later run may create a duplicate", issue.number(),
					item.fileName());
			throw e;
		}
		logger.info("Promoted {} to issue #{} ({})", item.fileName(), issue.number(), category);
		return new PromotionResult(issue.number(), issue.htmlUrl(), item.path().toString(), processed.toString(),
				created, warnings);
	}

	private Optional<Issue> findExisting(QueueItem item, QueueDocument document) {
		String marker = QueueDocument.markerFor(item.fileName());
		return repositoryService.listOpenIssues()
			.stream()
			.filter(issue -> issue.body().contains(marker))
			.findFirst();
	}

}
