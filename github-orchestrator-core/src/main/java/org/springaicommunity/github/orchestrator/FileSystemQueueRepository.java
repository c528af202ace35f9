package org.springaicommunity.github.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File system implementation of {@link QueueRepository}.
 *
 * <p>
 * Only regular files directly inside the pending directory are considered. A missing
 * pending directory is an empty queue.
 */
public class FileSystemQueueRepository implements QueueRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemQueueRepository.class);

	private final Path pendingDir;

	private final Path processedDir;

	public FileSystemQueueRepository(Path pendingDir, Path processedDir) {
		this.pendingDir = pendingDir;
		this.processedDir = processedDir;
	}

	@Override
	public List<QueueItem> listPending() {
		if (!Files.isDirectory(pendingDir)) {
			logger.debug("Pending directory {} does not exist", pendingDir);
			return List.of();
		}
		try (Stream<Path> files = Files.list(pendingDir)) {
			return files.filter(Files::isRegularFile)
				.map(this::toItem)
				.sorted(Comparator.comparing(QueueItem::fileName))
				.collect(Collectors.toList());
		}
		catch (IOException e) {
			throw new QueueException("Failed to list pending directory " + pendingDir, e);
		}
	}

	@Override
	public int countProcessed() {
		if (!Files.isDirectory(processedDir)) {
			return 0;
		}
		try (Stream<Path> files = Files.list(processedDir)) {
			return (int) files.filter(Files::isRegularFile).count();
		}
		catch (IOException e) {
			throw new QueueException("Failed to list processed directory " + processedDir, e);
		}
	}

	@Override
	public QueueDocument read(QueueItem item) {
		try {
			return QueueDocument.parse(item.fileName(), Files.readString(item.path(), StandardCharsets.UTF_8));
		}
		catch (IOException e) {
			throw new QueueException("Failed to read queue item " + item.path(), e);
		}
	}

	@Override
	public Path movePendingToProcessed(QueueItem item) {
		Path destination = processedDir.resolve(item.fileName());
		if (Files.exists(destination)) {
			throw new QueueException("Processed item already exists: " + destination);
		}
		try {
			Files.createDirectories(processedDir);
			try {
				Files.move(item.path(), destination, StandardCopyOption.ATOMIC_MOVE);
			}
			catch (AtomicMoveNotSupportedException e) {
				logger.debug("Atomic move not supported for {}, falling back to plain move", item.path());
				Files.move(item.path(), destination);
			}
			logger.info("Moved queue item {} to {}", item.fileName(), destination);
			return destination;
		}
		catch (FileAlreadyExistsException e) {
			throw new QueueException("Processed item already exists: " + destination, e);
		}
		catch (IOException e) {
			throw new QueueException("Failed to move " + item.path() + " to " + destination, e);
		}
	}

	private QueueItem toItem(Path path) {
		String fileName = path.getFileName().toString();
		try {
			return new QueueItem(path, QueueCategory.fromFileName(fileName),
					Files.getLastModifiedTime(path).toInstant(), fileName);
		}
		catch (IOException e) {
			throw new QueueException("Failed to read attributes of " + path, e);
		}
	}

}
