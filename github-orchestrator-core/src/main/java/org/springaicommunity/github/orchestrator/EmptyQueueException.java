package org.springaicommunity.github.orchestrator;

/**
 * Thrown when the pending queue holds no promotable item.
 */
public class EmptyQueueException extends OrchestratorException {

	public EmptyQueueException(String message) {
		super(ErrorKind.EMPTY_QUEUE, message);
	}

}
