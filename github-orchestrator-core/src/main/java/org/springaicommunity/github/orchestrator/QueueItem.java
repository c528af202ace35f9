package org.springaicommunity.github.orchestrator;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A file in the pending queue directory.
 *
 * @param path location of the file
 * @param category category derived from the file name
 * @param createdAt last-modified time of the file
 * @param fileName the file name; also the ordering key, since names embed timestamps
 */
public record QueueItem(Path path, QueueCategory category, Instant createdAt, String fileName) {

	public boolean isExcluded() {
		return category == QueueCategory.EXCLUDED;
	}

}
