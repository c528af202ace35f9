package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Result of classifying a {@link PipelineState}. Never persisted.
 *
 * @param stage the current stage
 * @param stageLabel human-readable stage name
 * @param activeStep zero-based index of the stage
 * @param focus the work the stage is about, {@code null} when the loop is idle
 * @param counts queue, issue and pull request counters
 * @param lastAction most recent activity, if any
 * @param warnings anomalies noticed while classifying
 * @param generatedAt when the underlying state was read
 */
public record StageSnapshot(Stage stage, String stageLabel, int activeStep, @Nullable Focus focus,
		StageCounts counts, @Nullable LastAction lastAction, List<Warning> warnings, Instant generatedAt) {

	public StageSnapshot {
		warnings = List.copyOf(warnings);
	}

}
