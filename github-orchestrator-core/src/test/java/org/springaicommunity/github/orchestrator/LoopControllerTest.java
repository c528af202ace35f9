package org.springaicommunity.github.orchestrator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;
import static org.springaicommunity.github.orchestrator.TestData.*;

/**
 * Tests for {@link LoopController}: outcome mapping with mocked components, and full
 * scenarios wired by {@link OrchestratorBuilder} over an in-memory repository and a
 * temporary queue.
 */
@DisplayName("LoopController Tests")
class LoopControllerTest {

	@Nested
	@DisplayName("Scenario Tests")
	class ScenarioTest {

		@TempDir
		Path tempDir;

		private Path pending;

		private InMemoryRepositoryService github;

		private LoopController loop;

		@BeforeEach
		void setUp() throws IOException {
			pending = Files.createDirectories(tempDir.resolve("pending"));
			github = new InMemoryRepositoryService();
			loop = OrchestratorBuilder.create()
				.repository(REPOSITORY)
				.repositoryService(github)
				.queueRepository(new FileSystemQueueRepository(pending, tempDir.resolve("processed")))
				.clock(Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC))
				.buildLoopController();
		}

		@Test
		@DisplayName("Should start with gap analysis and leave that stage once the issue exists")
		void shouldCreateGapAnalysisIssue() {
			assertThat(loop.getStageSnapshot().stage()).isEqualTo(Stage.GAP_ISSUE);

			ActionResult<GapAnalysisResult> result = loop.ensureGapAnalysisIssue();

			assertThat(result.status()).isEqualTo(ActionStatus.COMPLETED);
			assertThat(result.value().created()).isTrue();
			assertThat(loop.getStageSnapshot().stage()).isEqualTo(Stage.DEV_ISSUE_CREATION);
		}

		@Test
		@DisplayName("Should move to development in progress after promoting a queue file")
		void shouldPromoteThenReportExecution() throws IOException {
			github.issues.add(gapIssue(1));
			Files.writeString(pending.resolve("20250101-0900-add-retry-logic.md"),
					"# Add retry logic\n\nRetry transient failures.\n");
			assertThat(loop.getStageSnapshot().stage()).isEqualTo(Stage.DEV_ISSUE_CREATION);

			ActionResult<PromotionResult> promotion = loop.promoteNextQueueItem();
			StageSnapshot snapshot = loop.getStageSnapshot();

			assertThat(promotion.status()).isEqualTo(ActionStatus.COMPLETED);
			assertThat(snapshot.stage()).isEqualTo(Stage.DEV_EXECUTION);
			assertThat(snapshot.focus().issueNumber()).isEqualTo(promotion.value().issueNumber());
			assertThat(snapshot.focus().title()).isEqualTo("Add retry logic");
			assertThat(snapshot.counts().pending()).isZero();
			assertThat(snapshot.counts().processed()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should report NOTHING_TO_DO for an empty queue")
		void shouldReportEmptyQueue() {
			ActionResult<PromotionResult> result = loop.promoteNextQueueItem();

			assertThat(result.status()).isEqualTo(ActionStatus.NOTHING_TO_DO);
			assertThat(result.reasons()).containsExactly("EMPTY_QUEUE");
			assertThat(github.createdIssues).isEmpty();
		}

		@Test
		@DisplayName("Should merge a development pull request and open one capability update issue")
		void shouldMergeAndTriggerCapabilityUpdate() {
			github.issues.add(gapIssue(1));
			github.issues.add(issue(123, "Add retry logic", WorkCategory.DEVELOPMENT));
			github.pullRequests.add(pr(5).title("Add retry logic").body("Adds retry logic to the client.").fixes(123)
				.headRef("copilot/add-retry-logic").build());

			ActionResult<MergeResult> result = loop.mergeNextReadyPullRequest();

			assertThat(result.status()).isEqualTo(ActionStatus.COMPLETED);
			assertThat(result.warnings()).isEmpty();
			MergeResult merge = result.value();
			assertThat(merge.pullRequestNumber()).isEqualTo(5);
			assertThat(merge.sha()).isEqualTo("sha-5");
			assertThat(merge.branchDeleted()).isTrue();
			assertThat(merge.capabilityUpdate()).isNotNull();
			assertThat(github.mergedPullRequests).containsExactly(5);
			assertThat(github.deletedBranches).containsExactly("copilot/add-retry-logic");
			assertThat(github.createdIssues).singleElement().satisfies(issue -> {
				assertThat(issue.title()).isEqualTo("Update system capabilities based on merged PR #5");
				assertThat(issue.body()).contains("Adds retry logic to the client.");
			});
		}

		@Test
		@DisplayName("Should not open a capability update issue after a gap analysis merge")
		void shouldNotTriggerForGapAnalysis() {
			github.issues.add(gapIssue(1));
			github.pullRequests.add(pr(7).fixes(1).build());

			ActionResult<MergeResult> result = loop.mergeNextReadyPullRequest();

			assertThat(result.value().category()).isEqualTo(WorkCategory.GAP_ANALYSIS);
			assertThat(result.value().capabilityUpdate()).isNull();
			assertThat(github.createdIssues).isEmpty();
		}

		@Test
		@DisplayName("Should list why nothing can be merged")
		void shouldReportNoReadyPullRequest() {
			github.pullRequests.add(pr(5).noReviewRequested().build());
			github.pullRequests.add(pr(6).title("[WIP] Retry").conflicted().build());

			ActionResult<MergeResult> result = loop.mergeNextReadyPullRequest();

			assertThat(result.status()).isEqualTo(ActionStatus.NOTHING_TO_DO);
			assertThat(result.reasons()).containsExactly("NO_READY_PULL_REQUEST", "#5: REVIEW_NOT_REQUESTED",
					"#6: MERGE_CONFLICT, WORK_IN_PROGRESS");
			assertThat(github.mergedPullRequests).isEmpty();
		}

		@Test
		@DisplayName("Should keep the merge when the capability update issue cannot be created")
		void shouldWarnWhenCapabilityUpdateFails() throws IOException {
			LoopController brokenTemplates = OrchestratorBuilder.create()
				.repositoryService(github)
				.queueRepository(new FileSystemQueueRepository(pending, tempDir.resolve("processed")))
				.templateStore(new ClasspathTemplateStore(getClass().getClassLoader(),
						ClasspathTemplateStore.GAP_ANALYSIS_TEMPLATE, "templates/missing.md"))
				.buildLoopController();
			github.issues.add(issue(123, "Add retry logic", WorkCategory.DEVELOPMENT));
			github.pullRequests.add(pr(5).fixes(123).build());

			ActionResult<MergeResult> result = brokenTemplates.mergeNextReadyPullRequest();

			assertThat(result.status()).isEqualTo(ActionStatus.COMPLETED);
			assertThat(result.warnings()).extracting(Warning::kind)
				.containsExactly(Warning.Kind.CAPABILITY_UPDATE_FAILED);
			assertThat(github.mergedPullRequests).containsExactly(5);
		}

	}

	@Nested
	@DisplayName("Outcome Mapping Tests")
	@ExtendWith(MockitoExtension.class)
	class OutcomeMappingTest {

		@Mock
		private ArtifactReader artifactReader;

		@Mock
		private GapAnalysisEnsurer gapAnalysisEnsurer;

		@Mock
		private QueuePromoter queuePromoter;

		@Mock
		private MergeGate mergeGate;

		@Mock
		private CapabilityUpdateTrigger capabilityUpdateTrigger;

		private LoopController loop;

		@BeforeEach
		void setUp() {
			loop = new LoopController(artifactReader, new StageClassifier(), gapAnalysisEnsurer, queuePromoter,
					mergeGate, capabilityUpdateTrigger);
		}

		@Test
		@DisplayName("Should map a corrupted template to FAILED")
		void shouldMapTemplateCorrupted() {
			when(gapAnalysisEnsurer.ensure()).thenThrow(new TemplateCorruptedException("broken"));

			ActionResult<GapAnalysisResult> result = loop.ensureGapAnalysisIssue();

			assertThat(result.status()).isEqualTo(ActionStatus.FAILED);
			assertThat(result.reasons()).containsExactly("TEMPLATE_CORRUPTED");
		}

		@Test
		@DisplayName("Should map a queue failure to FAILED")
		void shouldMapQueueFailure() {
			when(queuePromoter.promoteNext()).thenThrow(new QueueException("Processed item already exists: x"));

			ActionResult<PromotionResult> result = loop.promoteNextQueueItem();

			assertThat(result.status()).isEqualTo(ActionStatus.FAILED);
			assertThat(result.reasons()).containsExactly("QUEUE_IO");
		}

		@Test
		@DisplayName("Should map a refused merge to REFUSED with its warnings")
		void shouldMapRefusal() {
			PullRequest pr = pr(5).build();
			when(artifactReader.read()).thenReturn(new PipelineState(List.of(), 0, List.of(), List.of(pr), BASE_TIME));
			Warning warning = new Warning(Warning.Kind.READY_FOR_REVIEW_FAILED, "still a draft");
			when(mergeGate.mergeNext(List.of(pr))).thenThrow(new MergeRefusedException(5,
					EnumSet.of(RefusalReason.MERGE_REJECTED, RefusalReason.IS_DRAFT), List.of(warning)));

			ActionResult<MergeResult> result = loop.mergeNextReadyPullRequest();

			assertThat(result.status()).isEqualTo(ActionStatus.REFUSED);
			assertThat(result.reasons()).containsExactly("IS_DRAFT", "MERGE_REJECTED");
			assertThat(result.warnings()).containsExactly(warning);
			verifyNoInteractions(capabilityUpdateTrigger);
		}

		@Test
		@DisplayName("Should let upstream API errors reach the caller")
		void shouldPropagateApiErrors() {
			when(artifactReader.read()).thenThrow(new GitHubHttpClient.GitHubApiException("Server Error", 502, ""));

			assertThatThrownBy(loop::getStageSnapshot).isInstanceOf(GitHubHttpClient.GitHubApiException.class);
		}

	}

}
