package org.springaicommunity.github.orchestrator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.github.orchestrator.TestData.*;

/**
 * Tests for {@link StageClassifier}. Pure: every test builds a {@link PipelineState}
 * directly.
 */
@DisplayName("StageClassifier Tests")
class StageClassifierTest {

	private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

	private final StageClassifier classifier = new StageClassifier();

	private static PipelineState state(List<QueueItem> items, List<Issue> issues, List<PullRequest> prs) {
		return new PipelineState(items, 2, issues, prs, NOW);
	}

	private static QueueItem queueItem(String fileName) {
		return new QueueItem(Path.of("planning/issue_queue/pending", fileName), QueueCategory.fromFileName(fileName),
				BASE_TIME, fileName);
	}

	@Nested
	@DisplayName("Gap Analysis Stage Tests")
	class GapAnalysisStageTest {

		@Test
		@DisplayName("Should ask for a gap analysis issue when none is open")
		void shouldRequireGapIssue() {
			StageSnapshot snapshot = classifier.classify(state(List.of(), List.of(), List.of()));

			assertThat(snapshot.stage()).isEqualTo(Stage.GAP_ISSUE);
			assertThat(snapshot.activeStep()).isZero();
			assertThat(snapshot.stageLabel()).isEqualTo("Create gap analysis issue");
			assertThat(snapshot.focus()).isNotNull();
			assertThat(snapshot.focus().title()).isEqualTo(WorkCategory.GAP_ANALYSIS.titlePrefix());
			assertThat(snapshot.generatedAt()).isEqualTo(NOW);
		}

		@Test
		@DisplayName("Should report gap issue creation even when development work is ready")
		void shouldPrioritizeGapIssueOverEverything() {
			Issue dev = issue(123, "Add retry logic", WorkCategory.DEVELOPMENT);
			PullRequest ready = pr(5).fixes(123).build();

			StageSnapshot snapshot = classifier
				.classify(state(List.of(queueItem("20250101-a.md")), List.of(dev), List.of(ready)));

			assertThat(snapshot.stage()).isEqualTo(Stage.GAP_ISSUE);
		}

		@Test
		@DisplayName("Should merge a ready gap analysis pull request first")
		void shouldMergeGapAnalysis() {
			PullRequest gapPr = pr(7).category(WorkCategory.GAP_ANALYSIS).fixes(1).build();
			PullRequest devPr = pr(5).fixes(123).build();

			StageSnapshot snapshot = classifier.classify(state(List.of(),
					List.of(gapIssue(1), issue(123, "Add retry logic", WorkCategory.DEVELOPMENT)),
					List.of(devPr, gapPr)));

			assertThat(snapshot.stage()).isEqualTo(Stage.GAP_MERGE);
			assertThat(snapshot.focus().issueNumber()).isEqualTo(1);
			assertThat(snapshot.focus().pullRequestNumber()).isEqualTo(7);
		}

		@Test
		@DisplayName("Should report gap analysis execution while its pull request is not ready")
		void shouldReportGapExecution() {
			PullRequest gapPr = pr(7).category(WorkCategory.GAP_ANALYSIS).noReviewRequested().build();

			StageSnapshot snapshot = classifier.classify(state(List.of(), List.of(gapIssue(1)), List.of(gapPr)));

			assertThat(snapshot.stage()).isEqualTo(Stage.GAP_EXECUTION);
			assertThat(snapshot.activeStep()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should warn about several gap analysis issues and focus the lowest")
		void shouldWarnOnMultipleGapIssues() {
			PullRequest gapPr = pr(7).category(WorkCategory.GAP_ANALYSIS).noReviewRequested().build();

			StageSnapshot snapshot = classifier
				.classify(state(List.of(), List.of(gapIssue(9), gapIssue(3)), List.of(gapPr)));

			assertThat(snapshot.focus().issueNumber()).isEqualTo(3);
			assertThat(snapshot.warnings()).singleElement()
				.satisfies(w -> assertThat(w.kind()).isEqualTo(Warning.Kind.MULTIPLE_GAP_ANALYSIS_ISSUES));
			assertThat(snapshot.counts().openGapAnalysisIssues()).isEqualTo(2);
		}

		@Test
		@DisplayName("Should follow the pull request linked to the lowest gap analysis issue")
		void shouldPairGapIssueWithItsOwnPullRequest() {
			PullRequest otherIssuePr = pr(4).category(WorkCategory.GAP_ANALYSIS).fixes(9).build();
			PullRequest primaryPr = pr(8).category(WorkCategory.GAP_ANALYSIS).fixes(3).noReviewRequested().build();

			StageSnapshot snapshot = classifier.classify(
					state(List.of(), List.of(gapIssue(9), gapIssue(3)), List.of(otherIssuePr, primaryPr)));

			assertThat(snapshot.stage()).isEqualTo(Stage.GAP_EXECUTION);
			assertThat(snapshot.focus().issueNumber()).isEqualTo(3);
			assertThat(snapshot.focus().pullRequestNumber()).isEqualTo(8);
		}

		@Test
		@DisplayName("Should fall back to other gap analysis pull requests and name their own issue")
		void shouldFallBackToCategoryPullRequests() {
			PullRequest otherIssuePr = pr(4).category(WorkCategory.GAP_ANALYSIS).fixes(9).build();

			StageSnapshot snapshot = classifier
				.classify(state(List.of(), List.of(gapIssue(9), gapIssue(3)), List.of(otherIssuePr)));

			assertThat(snapshot.stage()).isEqualTo(Stage.GAP_MERGE);
			assertThat(snapshot.focus().issueNumber()).isEqualTo(9);
			assertThat(snapshot.focus().pullRequestNumber()).isEqualTo(4);
		}

	}

	@Nested
	@DisplayName("Development Stage Tests")
	class DevelopmentStageTest {

		@Test
		@DisplayName("Should report development in progress for an issue with a pending pull request")
		void shouldReportDevelopmentExecution() {
			Issue dev = issue(123, "Add retry logic", WorkCategory.DEVELOPMENT);
			PullRequest wip = pr(5).title("[WIP] Add retry logic").fixes(123).build();

			StageSnapshot snapshot = classifier.classify(state(List.of(), List.of(gapIssue(1), dev), List.of(wip)));

			assertThat(snapshot.stage()).isEqualTo(Stage.DEV_EXECUTION);
			assertThat(snapshot.focus().issueNumber()).isEqualTo(123);
			assertThat(snapshot.focus().pullRequestNumber()).isEqualTo(5);
			assertThat(snapshot.focus().issueUrl()).endsWith("/issues/123");
		}

		@Test
		@DisplayName("Should report development in progress for an issue without a pull request")
		void shouldReportExecutionWithoutPullRequest() {
			Issue dev = issue(123, "Add retry logic", WorkCategory.DEVELOPMENT);

			StageSnapshot snapshot = classifier.classify(state(List.of(), List.of(gapIssue(1), dev), List.of()));

			assertThat(snapshot.stage()).isEqualTo(Stage.DEV_EXECUTION);
			assertThat(snapshot.focus().pullRequestNumber()).isNull();
		}

		@Test
		@DisplayName("Should merge a ready development pull request")
		void shouldMergeDevelopment() {
			Issue dev = issue(123, "Add retry logic", WorkCategory.DEVELOPMENT);
			PullRequest ready = pr(5).fixes(123).build();

			StageSnapshot snapshot = classifier.classify(state(List.of(), List.of(gapIssue(1), dev), List.of(ready)));

			assertThat(snapshot.stage()).isEqualTo(Stage.DEV_MERGE);
			assertThat(snapshot.activeStep()).isEqualTo(5);
			assertThat(snapshot.focus().issueNumber()).isEqualTo(123);
			assertThat(snapshot.counts().readyPullRequests()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should focus the lowest issue number")
		void shouldBreakTiesByIssueNumber() {
			StageSnapshot snapshot = classifier.classify(state(List.of(),
					List.of(gapIssue(1), issue(9, "Later", WorkCategory.DEVELOPMENT),
							issue(4, "Earlier", WorkCategory.DEVELOPMENT)),
					List.of()));

			assertThat(snapshot.focus().issueNumber()).isEqualTo(4);
		}

		@Test
		@DisplayName("Should ask for a development issue when a queue file is pending")
		void shouldPromoteQueueFile() {
			StageSnapshot snapshot = classifier.classify(state(
					List.of(queueItem("20250102-b.md"), queueItem("20250101-a.md"), queueItem(".gitkeep")),
					List.of(gapIssue(1)), List.of()));

			assertThat(snapshot.stage()).isEqualTo(Stage.DEV_ISSUE_CREATION);
			assertThat(snapshot.focus().title()).isEqualTo("20250101-a.md");
			assertThat(snapshot.focus().queuePath()).endsWith("20250101-a.md");
			assertThat(snapshot.counts().pending()).isEqualTo(2);
			assertThat(snapshot.counts().excluded()).isEqualTo(1);
			assertThat(snapshot.counts().processed()).isEqualTo(2);
		}

		@Test
		@DisplayName("Should be idle at development issue creation when nothing is left")
		void shouldBeIdle() {
			StageSnapshot snapshot = classifier.classify(state(List.of(), List.of(gapIssue(1)), List.of()));

			assertThat(snapshot.stage()).isEqualTo(Stage.DEV_ISSUE_CREATION);
			assertThat(snapshot.focus()).isNull();
		}

		@Test
		@DisplayName("Should only count drafts as ready when they may be flipped")
		void shouldRespectDraftFlipSetting() {
			Issue dev = issue(123, "Add retry logic", WorkCategory.DEVELOPMENT);
			PullRequest draft = pr(5).draft().fixes(123).build();
			PipelineState state = state(List.of(), List.of(gapIssue(1), dev), List.of(draft));

			assertThat(new StageClassifier(true).classify(state).stage()).isEqualTo(Stage.DEV_MERGE);
			assertThat(new StageClassifier(false).classify(state).stage()).isEqualTo(Stage.DEV_EXECUTION);
		}

	}

	@Nested
	@DisplayName("Capability Update Stage Tests")
	class CapabilityUpdateStageTest {

		@Test
		@DisplayName("Should handle capability updates before development work")
		void shouldPrioritizeCapabilityUpdates() {
			Issue cap = issue(50, "Update system capabilities based on merged PR #5", WorkCategory.CAPABILITY_UPDATE);
			Issue dev = issue(123, "Add retry logic", WorkCategory.DEVELOPMENT);
			PullRequest devPr = pr(5).fixes(123).build();

			StageSnapshot snapshot = classifier
				.classify(state(List.of(), List.of(gapIssue(1), cap, dev), List.of(devPr)));

			assertThat(snapshot.stage()).isEqualTo(Stage.CAP_EXECUTION);
			assertThat(snapshot.focus().category()).isEqualTo(WorkCategory.CAPABILITY_UPDATE);
		}

		@Test
		@DisplayName("Should merge a ready capability update pull request")
		void shouldMergeCapabilityUpdate() {
			Issue cap = issue(50, "Update system capabilities based on merged PR #5", WorkCategory.CAPABILITY_UPDATE);
			PullRequest capPr = pr(60).category(WorkCategory.CAPABILITY_UPDATE).fixes(50).build();

			StageSnapshot snapshot = classifier.classify(state(List.of(), List.of(gapIssue(1), cap), List.of(capPr)));

			assertThat(snapshot.stage()).isEqualTo(Stage.CAP_MERGE);
			assertThat(snapshot.activeStep()).isEqualTo(8);
		}

		@Test
		@DisplayName("Should promote capability queue files before development ones")
		void shouldPromoteCapabilityQueueFile() {
			StageSnapshot snapshot = classifier.classify(state(
					List.of(queueItem("20250101-a.md"), queueItem("capability-refresh.md")), List.of(gapIssue(1)),
					List.of()));

			assertThat(snapshot.stage()).isEqualTo(Stage.CAP_ISSUE);
			assertThat(snapshot.focus().title()).isEqualTo("capability-refresh.md");
			assertThat(snapshot.counts().pendingCapabilityUpdates()).isEqualTo(1);
			assertThat(snapshot.counts().pendingDevelopment()).isEqualTo(1);
		}

	}

	@Test
	@DisplayName("Should report the most recently updated artifact as the last action")
	void shouldReportLastAction() {
		Issue dev = issue(123, "Add retry logic", WorkCategory.DEVELOPMENT);
		PullRequest pr = pr(5).title("Retry failed calls").updatedAt(NOW.minusSeconds(60)).fixes(123).build();

		StageSnapshot snapshot = classifier.classify(state(List.of(), List.of(gapIssue(1), dev), List.of(pr)));

		assertThat(snapshot.lastAction()).isNotNull();
		assertThat(snapshot.lastAction().summary()).isEqualTo("Pull request #5 updated: Retry failed calls");
		assertThat(snapshot.lastAction().timestamp()).isEqualTo(NOW.minusSeconds(60));
	}

}
