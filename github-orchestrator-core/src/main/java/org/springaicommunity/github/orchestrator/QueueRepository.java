package org.springaicommunity.github.orchestrator;

import java.nio.file.Path;
import java.util.List;

/**
 * Storage of the issue queue: an append-only pending directory and a processed directory
 * that promoted items are moved into.
 */
public interface QueueRepository {

	/**
	 * List every file in the pending directory, excluded ones included.
	 * @return items ordered by file name
	 * @throws QueueException if the directory cannot be read
	 */
	List<QueueItem> listPending();

	/**
	 * Count the files in the processed directory.
	 * @return number of processed items, zero if the directory does not exist
	 */
	int countProcessed();

	/**
	 * Read and parse a pending item.
	 * @param item the item
	 * @return the parsed document
	 * @throws QueueException if the file cannot be read or is malformed
	 */
	QueueDocument read(QueueItem item);

	/**
	 * Move a pending item into the processed directory.
	 * @param item the item
	 * @return the new location
	 * @throws QueueException if the destination already exists or the move fails
	 */
	Path movePendingToProcessed(QueueItem item);

}
