package org.springaicommunity.github.orchestrator;

/**
 * Counters shown alongside a stage.
 */
public record StageCounts(int pending, int processed, int excluded, int pendingDevelopment,
		int pendingCapabilityUpdates, int openIssues, int openDevelopmentIssues, int openCapabilityUpdateIssues,
		int openGapAnalysisIssues, int openPullRequests, int readyPullRequests) {
}
