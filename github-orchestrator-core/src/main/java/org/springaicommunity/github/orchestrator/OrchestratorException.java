package org.springaicommunity.github.orchestrator;

/**
 * Base class of the orchestrator's own failures. Upstream API errors use
 * {@link GitHubHttpClient.GitHubApiException} instead.
 */
public class OrchestratorException extends RuntimeException {

	private final ErrorKind kind;

	public OrchestratorException(ErrorKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public OrchestratorException(ErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public ErrorKind getKind() {
		return kind;
	}

}
