package org.springaicommunity.github.orchestrator;

/**
 * The nine pipeline stages, in display order.
 */
public enum Stage {

	GAP_ISSUE("Create gap analysis issue"),

	GAP_EXECUTION("Gap analysis in progress"),

	GAP_MERGE("Merge gap analysis"),

	DEV_ISSUE_CREATION("Create development issue"),

	DEV_EXECUTION("Development in progress"),

	DEV_MERGE("Merge development"),

	CAP_ISSUE("Create capability update issue"),

	CAP_EXECUTION("Capability update in progress"),

	CAP_MERGE("Merge capability update");

	private final String label;

	Stage(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}

	/**
	 * @return zero-based position of this stage in the pipeline
	 */
	public int step() {
		return ordinal();
	}

}
