package org.springaicommunity.github.orchestrator;

import java.util.Locale;

/**
 * Category of a file in the pending queue directory, derived from its file name alone.
 */
public enum QueueCategory {

	DEVELOPMENT,

	CAPABILITY,

	/**
	 * Hidden and non-markdown files. Never promoted, never counted as pending work.
	 */
	EXCLUDED;

	/**
	 * Classify a queue file by name.
	 * @param fileName file name without directories
	 * @return the category
	 */
	public static QueueCategory fromFileName(String fileName) {
		String name = fileName.toLowerCase(Locale.ROOT);
		if (name.startsWith(".") || !name.endsWith(".md")) {
			return EXCLUDED;
		}
		if (name.startsWith("capability-") || name.startsWith("capabilities-")
				|| name.startsWith("system-capabilities-")) {
			return CAPABILITY;
		}
		return DEVELOPMENT;
	}

	/**
	 * The issue category a promoted item of this kind belongs to.
	 * @return the work category
	 * @throws IllegalStateException for {@link #EXCLUDED}
	 */
	public WorkCategory toWorkCategory() {
		return switch (this) {
			case CAPABILITY -> WorkCategory.CAPABILITY_UPDATE;
			case DEVELOPMENT -> WorkCategory.DEVELOPMENT;
			case EXCLUDED -> throw new IllegalStateException("Excluded queue files have no work category");
		};
	}

}
