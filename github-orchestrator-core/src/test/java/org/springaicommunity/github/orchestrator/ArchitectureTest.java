package org.springaicommunity.github.orchestrator;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link GitHubClient} - HTTP operations for GitHub API</li>
 * <li>{@link RepositoryService} - Issues, pull requests, merges and branches</li>
 * <li>{@link QueueRepository} - Pending and processed queue files</li>
 * <li>{@link TemplateStore} - Bundled issue templates</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Loop components → Interfaces (NOT concrete implementations)
 *   OrchestratorBuilder → the only place implementations are chosen
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.github.orchestrator",
		importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule loop_components_should_depend_on_client_interface = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.or()
		.haveSimpleNameEndingWith("Gate")
		.or()
		.haveSimpleNameEndingWith("Promoter")
		.or()
		.haveSimpleNameEndingWith("Ensurer")
		.or()
		.haveSimpleNameEndingWith("Trigger")
		.or()
		.haveSimpleNameEndingWith("Reader")
		.or()
		.haveSimpleName("LoopController")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Loop components should depend on GitHubClient or RepositoryService, not the concrete client");

	@ArchTest
	static final ArchRule only_builder_should_choose_repository_implementation = noClasses().that()
		.doNotHaveSimpleName("OrchestratorBuilder")
		.and()
		.doNotHaveSimpleName("GitHubRepositoryService")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubRepositoryService")
		.because("Components should depend on the RepositoryService interface");

	@ArchTest
	static final ArchRule only_builder_should_choose_queue_implementation = noClasses().that()
		.doNotHaveSimpleName("OrchestratorBuilder")
		.and()
		.doNotHaveSimpleName("FileSystemQueueRepository")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("FileSystemQueueRepository")
		.because("Components should depend on the QueueRepository interface");

	@ArchTest
	static final ArchRule only_builder_should_choose_template_implementation = noClasses().that()
		.doNotHaveSimpleName("OrchestratorBuilder")
		.and()
		.doNotHaveSimpleName("ClasspathTemplateStore")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("ClasspathTemplateStore")
		.because("Components should depend on the TemplateStore interface");

	@ArchTest
	static final ArchRule classifier_should_not_perform_io = noClasses().that()
		.haveSimpleNameStartingWith("Stage")
		.or()
		.haveSimpleName("ReadinessAssessment")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Repository")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.orShould()
		.accessClassesThat()
		.resideInAPackage("java.nio.file")
		.because("Classification is pure and works on a PipelineState snapshot");

	// ========== Decorator Rules ==========

	@ArchTest
	static final ArchRule github_client_decorators_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("GitHubClient")
		.and()
		.doNotHaveSimpleName("GitHubClient")
		.should()
		.implement(GitHubClient.class)
		.because("All *GitHubClient classes should implement the GitHubClient interface");

	@ArchTest
	static final ArchRule decorators_should_not_depend_on_concrete_http_client = noClasses().that()
		.haveSimpleName("RetryingGitHubClient")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Decorators should depend on the GitHubClient interface, not concrete implementation");

	// ========== Implementation Rules ==========

	@ArchTest
	static final ArchRule queue_repositories_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("QueueRepository")
		.and()
		.doNotHaveSimpleName("QueueRepository")
		.should()
		.implement(QueueRepository.class)
		.because("All *QueueRepository classes should implement the QueueRepository interface");

	@ArchTest
	static final ArchRule template_stores_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("TemplateStore")
		.and()
		.doNotHaveSimpleName("TemplateStore")
		.should()
		.implement(TemplateStore.class)
		.because("All *TemplateStore classes should implement the TemplateStore interface");

	// ========== Model Independence ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Result")
		.or()
		.haveSimpleNameEndingWith("Snapshot")
		.or()
		.haveSimpleNameEndingWith("State")
		.or()
		.haveSimpleName("Issue")
		.or()
		.haveSimpleName("PullRequest")
		.or()
		.haveSimpleName("Review")
		.or()
		.haveSimpleName("QueueItem")
		.or()
		.haveSimpleName("Focus")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Repository")
		.because("Model classes should be pure data without service dependencies");

}
