package org.springaicommunity.github.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Builder for the orchestrator loop. The only place where implementations are chosen.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Everything from the environment (.env, ORCHESTRATOR_REPOSITORY, ORCHESTRATOR_GITHUB_TOKEN)
 * LoopController loop = OrchestratorBuilder.create()
 *     .properties(OrchestratorProperties.fromEnvironment())
 *     .buildLoopController();
 *
 * StageSnapshot snapshot = loop.getStageSnapshot();
 *
 * // For testing with a mock HTTP client and a temporary queue
 * GitHubClient mockClient = mock(GitHubClient.class);
 * LoopController testLoop = OrchestratorBuilder.create()
 *     .repository("owner/repo")
 *     .httpClient(mockClient)
 *     .queueRepository(new FileSystemQueueRepository(pending, processed))
 *     .buildLoopController();
 * }
 * </pre>
 */
public class OrchestratorBuilder {

	private static final Logger logger = LoggerFactory.getLogger(OrchestratorBuilder.class);

	private OrchestratorProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private @Nullable RepositoryService repositoryService;

	private @Nullable QueueRepository queueRepository;

	private @Nullable TemplateStore templateStore;

	private Clock clock = Clock.systemUTC();

	private OrchestratorBuilder() {
		this.properties = new OrchestratorProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new OrchestratorBuilder
	 */
	public static OrchestratorBuilder create() {
		return new OrchestratorBuilder();
	}

	/**
	 * Set orchestrator properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public OrchestratorBuilder properties(@Nullable OrchestratorProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub token
	 * @return this builder
	 */
	public OrchestratorBuilder token(String token) {
		this.properties.setToken(token);
		return this;
	}

	/**
	 * Set the target repository.
	 * @param repository repository in "owner/repo" format
	 * @return this builder
	 */
	public OrchestratorBuilder repository(String repository) {
		this.properties.setRepository(repository);
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public OrchestratorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks or for
	 * adding decorators.
	 *
	 * <p>
	 * When a custom client is provided, the token is not required and no retrying
	 * decorator is added.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public OrchestratorBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom RepositoryService. When provided, no GitHubClient is built.
	 * @param repositoryService custom implementation (null to use default)
	 * @return this builder
	 */
	public OrchestratorBuilder repositoryService(@Nullable RepositoryService repositoryService) {
		this.repositoryService = repositoryService;
		return this;
	}

	/**
	 * Set a custom QueueRepository.
	 * @param queueRepository custom implementation (null to use the directories from the
	 * properties)
	 * @return this builder
	 */
	public OrchestratorBuilder queueRepository(@Nullable QueueRepository queueRepository) {
		this.queueRepository = queueRepository;
		return this;
	}

	/**
	 * Set a custom TemplateStore.
	 * @param templateStore custom implementation (null to use the bundled templates)
	 * @return this builder
	 */
	public OrchestratorBuilder templateStore(@Nullable TemplateStore templateStore) {
		this.templateStore = templateStore;
		return this;
	}

	/**
	 * Set the clock used to timestamp snapshots.
	 * @param clock the clock
	 * @return this builder
	 */
	public OrchestratorBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build the LoopController with all of its components.
	 * @return configured LoopController
	 * @throws IllegalStateException if required configuration is missing
	 */
	public LoopController buildLoopController() {
		RepositoryService repository = buildRepositoryService();
		QueueRepository queue = queueRepository != null ? queueRepository
				: new FileSystemQueueRepository(Paths.get(properties.getPendingDir()),
						Paths.get(properties.getProcessedDir()));
		TemplateStore templates = templateStore != null ? templateStore : new ClasspathTemplateStore();
		String assignee = properties.getAutomationAssignee();

		return new LoopController(new ArtifactReader(queue, repository, clock),
				new StageClassifier(properties.isMarkReadyForReview()),
				new GapAnalysisEnsurer(repository, templates, assignee), new QueuePromoter(queue, repository, assignee),
				new MergeGate(repository, properties.getMergeMethod(), properties.isDeleteBranchAfterMerge(),
						properties.isMarkReadyForReview()),
				new CapabilityUpdateTrigger(repository, templates, assignee));
	}

	/**
	 * Build the RepositoryService directly (for advanced usage).
	 * @return configured RepositoryService
	 */
	public RepositoryService buildRepositoryService() {
		if (repositoryService != null) {
			return repositoryService;
		}
		String repository = properties.getRepository();
		if (repository == null || repository.isBlank()) {
			throw new IllegalStateException(
					"Repository is required. Set ORCHESTRATOR_REPOSITORY or call repository(\"owner/repo\").");
		}
		ObjectMapper mapper = objectMapper != null ? objectMapper : ObjectMapperFactory.create();
		return new GitHubRepositoryService(buildHttpClient(), mapper, repository);
	}

	private GitHubClient buildHttpClient() {
		if (httpClient != null) {
			return httpClient;
		}
		String token = properties.getToken();
		if (token == null || token.isBlank()) {
			throw new IllegalStateException(
					"GitHub token is required. Set ORCHESTRATOR_GITHUB_TOKEN (or GITHUB_TOKEN) or call token().");
		}
		GitHubClient client = new GitHubHttpClient(token, properties.getApiBaseUrl());
		if (properties.getMaxRetries() > 0) {
			logger.debug("Retrying GET requests up to {} times", properties.getMaxRetries());
			client = RetryingGitHubClient.builder().wrapping(client).maxRetries(properties.getMaxRetries()).build();
		}
		return client;
	}

}
