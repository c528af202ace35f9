package org.springaicommunity.github.orchestrator;

/**
 * Source of the issue templates that ship with the orchestrator.
 */
public interface TemplateStore {

	/**
	 * @return the gap-analysis issue template
	 * @throws TemplateCorruptedException if the template is missing or malformed
	 */
	IssueTemplate loadGapAnalysisTemplate();

	/**
	 * @return the capability-update issue template
	 * @throws TemplateCorruptedException if the template is missing or malformed
	 */
	IssueTemplate loadCapabilityUpdateTemplate();

}
