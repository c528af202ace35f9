package org.springaicommunity.github.orchestrator;

/**
 * Thrown when a bundled issue template is missing or cannot be parsed.
 */
public class TemplateCorruptedException extends OrchestratorException {

	public TemplateCorruptedException(String message) {
		super(ErrorKind.TEMPLATE_CORRUPTED, message);
	}

	public TemplateCorruptedException(String message, Throwable cause) {
		super(ErrorKind.TEMPLATE_CORRUPTED, message, cause);
	}

}
