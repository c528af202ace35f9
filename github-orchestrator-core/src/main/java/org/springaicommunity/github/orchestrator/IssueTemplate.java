package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An issue template: front matter with a title and optional labels, then a markdown body.
 *
 * <pre>
 * ---
 * title: Identify the next most important development gap
 * labels: Gap Analysis
 * ---
 * Body text...
 * </pre>
 *
 * @param name resource name, used in error messages
 * @param title issue title, may contain {@code {{PLACEHOLDER}}} tokens
 * @param labels labels from the front matter
 * @param body markdown body, may contain {@code {{PLACEHOLDER}}} tokens
 */
public record IssueTemplate(String name, String title, List<String> labels, String body) {

	private static final String DELIMITER = "---";

	private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)\\}\\}");

	public IssueTemplate {
		labels = List.copyOf(labels);
	}

	/**
	 * Parse template text.
	 * @param name resource name
	 * @param content raw template text
	 * @return the parsed template
	 * @throws TemplateCorruptedException if the front matter or body is missing
	 */
	public static IssueTemplate parse(String name, String content) {
		List<String> lines = Arrays.asList(content.replace("\r\n", "\n").split("\n", -1));
		if (lines.isEmpty() || !DELIMITER.equals(lines.get(0).strip())) {
			throw new TemplateCorruptedException("Template " + name + " does not start with front matter");
		}
		int end = -1;
		for (int i = 1; i < lines.size(); i++) {
			if (DELIMITER.equals(lines.get(i).strip())) {
				end = i;
				break;
			}
		}
		if (end < 0) {
			throw new TemplateCorruptedException("Template " + name + " has unterminated front matter");
		}

		@Nullable
		String title = null;
		List<String> labels = new ArrayList<>();
		for (String line : lines.subList(1, end)) {
			int colon = line.indexOf(':');
			if (line.isBlank() || line.strip().startsWith("#")) {
				continue;
			}
			if (colon < 0) {
				throw new TemplateCorruptedException("Template " + name + " has malformed front matter: " + line);
			}
			String key = line.substring(0, colon).strip();
			String value = line.substring(colon + 1).strip();
			if ("title".equals(key)) {
				title = value;
			}
			else if ("labels".equals(key)) {
				for (String label : value.split(",")) {
					if (!label.isBlank()) {
						labels.add(label.strip());
					}
				}
			}
		}
		if (title == null || title.isEmpty()) {
			throw new TemplateCorruptedException("Template " + name + " has no title");
		}

		String body = String.join("\n", lines.subList(end + 1, lines.size())).strip();
		if (body.isEmpty()) {
			throw new TemplateCorruptedException("Template " + name + " has an empty body");
		}
		return new IssueTemplate(name, title, labels, body);
	}

	/**
	 * Replace {@code {{KEY}}} placeholders in the title and body.
	 * @param values replacement values keyed by placeholder name
	 * @return a rendered copy
	 * @throws TemplateCorruptedException if a placeholder is missing from the template
	 */
	public IssueTemplate render(Map<String, String> values) {
		for (String key : values.keySet()) {
			String token = "{{" + key + "}}";
			if (!title.contains(token) && !body.contains(token)) {
				throw new TemplateCorruptedException("Template " + name + " is missing placeholder " + token);
			}
		}
		return new IssueTemplate(name, substitute(title, values), labels, substitute(body, values));
	}

	// Single pass: placeholder text inside substituted values stays literal.
	private static String substitute(String text, Map<String, String> values) {
		Matcher matcher = PLACEHOLDER.matcher(text);
		StringBuilder out = new StringBuilder();
		while (matcher.find()) {
			String value = values.get(matcher.group(1));
			matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
		}
		matcher.appendTail(out);
		return out.toString();
	}

}
