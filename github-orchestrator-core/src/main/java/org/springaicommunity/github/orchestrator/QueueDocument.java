package org.springaicommunity.github.orchestrator;

/**
 * Parsed content of a queue file, ready to become an issue.
 *
 * @param title first line of the file with leading markdown heading markers removed
 * @param body full file content followed by the queue-id marker
 */
public record QueueDocument(String title, String body) {

	static final String MARKER_PREFIX = "<!-- orchestrator-issue-queue-id: ";

	/**
	 * Parse raw queue file content.
	 * @param fileName name of the queue file, embedded in the traceability marker
	 * @param content raw file content
	 * @return the parsed document
	 * @throws QueueException if the file is empty or its first line is blank
	 */
	public static QueueDocument parse(String fileName, String content) {
		String normalized = content.replace("\r\n", "\n");
		if (normalized.isBlank()) {
			throw new QueueException("Queue item " + fileName + " is empty");
		}
		int newline = normalized.indexOf('\n');
		String firstLine = newline >= 0 ? normalized.substring(0, newline) : normalized;
		String title = firstLine.strip().replaceFirst("^#+", "").strip();
		if (title.isEmpty()) {
			throw new QueueException("Queue item " + fileName + " has no title on its first line");
		}
		String marker = markerFor(fileName);
		String body = normalized.strip();
		if (!body.contains(marker)) {
			body = body + "\n\n" + marker;
		}
		return new QueueDocument(title, body);
	}

	static String markerFor(String fileName) {
		return MARKER_PREFIX + fileName + " -->";
	}

}
