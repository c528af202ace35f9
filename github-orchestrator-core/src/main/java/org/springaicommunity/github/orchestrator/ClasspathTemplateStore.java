package org.springaicommunity.github.orchestrator;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * {@link TemplateStore} reading templates bundled on the classpath. Templates are never
 * fetched from the target repository.
 */
public class ClasspathTemplateStore implements TemplateStore {

	public static final String GAP_ANALYSIS_TEMPLATE = "templates/gap-analysis.md";

	public static final String CAPABILITY_UPDATE_TEMPLATE = "templates/capability-update.md";

	private final ClassLoader classLoader;

	private final String gapAnalysisResource;

	private final String capabilityUpdateResource;

	public ClasspathTemplateStore() {
		this(ClasspathTemplateStore.class.getClassLoader(), GAP_ANALYSIS_TEMPLATE, CAPABILITY_UPDATE_TEMPLATE);
	}

	public ClasspathTemplateStore(ClassLoader classLoader, String gapAnalysisResource,
			String capabilityUpdateResource) {
		this.classLoader = classLoader;
		this.gapAnalysisResource = gapAnalysisResource;
		this.capabilityUpdateResource = capabilityUpdateResource;
	}

	@Override
	public IssueTemplate loadGapAnalysisTemplate() {
		return load(gapAnalysisResource);
	}

	@Override
	public IssueTemplate loadCapabilityUpdateTemplate() {
		return load(capabilityUpdateResource);
	}

	private IssueTemplate load(String resource) {
		try (InputStream in = classLoader.getResourceAsStream(resource)) {
			if (in == null) {
				throw new TemplateCorruptedException("Template " + resource + " not found on classpath");
			}
			return IssueTemplate.parse(resource, new String(in.readAllBytes(), StandardCharsets.UTF_8));
		}
		catch (IOException e) {
			throw new TemplateCorruptedException("Failed to read template " + resource, e);
		}
	}

}
