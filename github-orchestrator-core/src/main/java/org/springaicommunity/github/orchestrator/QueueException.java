package org.springaicommunity.github.orchestrator;

/**
 * Thrown for unreadable or malformed queue files and failed queue moves.
 */
public class QueueException extends OrchestratorException {

	public QueueException(String message) {
		super(ErrorKind.QUEUE_IO, message);
	}

	public QueueException(String message, Throwable cause) {
		super(ErrorKind.QUEUE_IO, message, cause);
	}

}
