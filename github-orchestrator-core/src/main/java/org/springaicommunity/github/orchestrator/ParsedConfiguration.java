package org.springaicommunity.github.orchestrator;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Which loop operation to run
	public String command;

	// Repository and queue settings
	public String repository;

	public String pendingDir;

	public String processedDir;

	public String assignee;

	// Merge settings
	public String mergeMethod;

	public boolean deleteBranch;

	public boolean markReady;

	public int retries;

	// Output flags
	public boolean json = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(OrchestratorProperties defaultProperties) {
		this.command = "";
		this.repository = defaultProperties.getRepository() != null ? defaultProperties.getRepository() : "";
		this.pendingDir = defaultProperties.getPendingDir();
		this.processedDir = defaultProperties.getProcessedDir();
		this.assignee = defaultProperties.getAutomationAssignee();
		this.mergeMethod = defaultProperties.getMergeMethod();
		this.deleteBranch = defaultProperties.isDeleteBranchAfterMerge();
		this.markReady = defaultProperties.isMarkReadyForReview();
		this.retries = defaultProperties.getMaxRetries();
	}

	/**
	 * Copy the parsed values onto properties, so that flags win over the environment.
	 * @param properties properties to update
	 */
	public void applyTo(OrchestratorProperties properties) {
		if (!repository.isEmpty()) {
			properties.setRepository(repository);
		}
		properties.setPendingDir(pendingDir);
		properties.setProcessedDir(processedDir);
		properties.setAutomationAssignee(assignee);
		properties.setMergeMethod(mergeMethod);
		properties.setDeleteBranchAfterMerge(deleteBranch);
		properties.setMarkReadyForReview(markReady);
		properties.setMaxRetries(retries);
	}

}
