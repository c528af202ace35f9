package org.springaicommunity.github.orchestrator;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Whether a pull request may be merged, and why not.
 *
 * @param ready true when nothing blocks the merge
 * @param reasons blocking reasons, empty when ready
 * @param needsReadyForReview the pull request is a draft that must be flipped to
 * ready-for-review before merging
 */
public record ReadinessAssessment(boolean ready, Set<RefusalReason> reasons, boolean needsReadyForReview) {

	private static final String[] WORK_IN_PROGRESS_MARKERS = { "[wip]", "wip:", "work in progress" };

	private static final Pattern LINE_PREFIX = Pattern.compile("^[\\s#>*+-]*(\\[[ x]\\]\\s*)?");

	public ReadinessAssessment {
		reasons = reasons.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(reasons));
	}

	/**
	 * Evaluate a pull request. Pure: no API calls.
	 * @param pr the pull request
	 * @param allowDraftFlip whether drafts may be flipped to ready-for-review
	 * @return the assessment
	 */
	public static ReadinessAssessment evaluate(PullRequest pr, boolean allowDraftFlip) {
		Set<RefusalReason> reasons = EnumSet.noneOf(RefusalReason.class);
		if (!pr.isOpen()) {
			reasons.add(RefusalReason.NOT_OPEN);
		}
		if (isWorkInProgress(pr)) {
			reasons.add(RefusalReason.WORK_IN_PROGRESS);
		}
		if (!pr.reviewRequested()) {
			reasons.add(RefusalReason.REVIEW_NOT_REQUESTED);
		}
		if (pr.conflicted()) {
			reasons.add(RefusalReason.MERGE_CONFLICT);
		}
		boolean needsFlip = false;
		if (pr.draft()) {
			if (allowDraftFlip && reasons.isEmpty()) {
				needsFlip = true;
			}
			else {
				reasons.add(RefusalReason.IS_DRAFT);
			}
		}
		return new ReadinessAssessment(reasons.isEmpty(), reasons, needsFlip);
	}

	/**
	 * A marker anywhere in the title, or at the start of a body line (after list, heading
	 * or quote prefixes), flags work in progress. Prose mentions in the body do not.
	 */
	static boolean isWorkInProgress(PullRequest pr) {
		String title = pr.title().toLowerCase(Locale.ROOT);
		for (String marker : WORK_IN_PROGRESS_MARKERS) {
			if (title.contains(marker)) {
				return true;
			}
		}
		for (String line : pr.body().toLowerCase(Locale.ROOT).split("\\R")) {
			String text = LINE_PREFIX.matcher(line).replaceFirst("");
			for (String marker : WORK_IN_PROGRESS_MARKERS) {
				if (text.startsWith(marker)) {
					return true;
				}
			}
		}
		return false;
	}

}
