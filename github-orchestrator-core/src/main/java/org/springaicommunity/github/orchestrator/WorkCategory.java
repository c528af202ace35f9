package org.springaicommunity.github.orchestrator;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * The three kinds of work the loop moves through GitHub.
 *
 * <p>
 * Each category carries the GitHub label applied to its issues and the canonical title
 * prefix that identifies it when labels are missing.
 */
public enum WorkCategory {

	GAP_ANALYSIS("Gap Analysis", "Identify the next most important development gap"),

	CAPABILITY_UPDATE("Update Capability", "Update system capabilities"),

	DEVELOPMENT("Development", "");

	private final String label;

	private final String titlePrefix;

	WorkCategory(String label, String titlePrefix) {
		this.label = label;
		this.titlePrefix = titlePrefix;
	}

	public String label() {
		return label;
	}

	public String titlePrefix() {
		return titlePrefix;
	}

	/**
	 * Find the category whose label appears in the given label names (case-insensitive).
	 * Gap analysis wins over capability update, which wins over development.
	 * @param labels label names
	 * @return the matching category, if any
	 */
	public static Optional<WorkCategory> fromLabels(Collection<String> labels) {
		for (WorkCategory category : values()) {
			for (String label : labels) {
				if (category.label.equalsIgnoreCase(label.trim())) {
					return Optional.of(category);
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * Find the category whose canonical title prefix starts the given title.
	 * @param title issue or pull request title
	 * @return the matching category, if any
	 */
	public static Optional<WorkCategory> fromTitle(String title) {
		String normalized = stripDraftMarkers(title).toLowerCase(Locale.ROOT);
		for (WorkCategory category : values()) {
			if (!category.titlePrefix.isEmpty()
					&& normalized.startsWith(category.titlePrefix.toLowerCase(Locale.ROOT))) {
				return Optional.of(category);
			}
		}
		return Optional.empty();
	}

	// Copilot prefixes PR titles with "[WIP] " while it works
	private static String stripDraftMarkers(String title) {
		String trimmed = title.trim();
		if (trimmed.regionMatches(true, 0, "[WIP]", 0, 5)) {
			trimmed = trimmed.substring(5).trim();
		}
		return trimmed;
	}

}
