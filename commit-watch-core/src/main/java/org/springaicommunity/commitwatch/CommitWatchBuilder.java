package org.springaicommunity.commitwatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;

/**
 * Builder wiring a {@link ScanPipeline} from a {@link WatchConfiguration}.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * ScanPipeline pipeline = CommitWatchBuilder.create()
 *     .configuration(WatchConfiguration.fromEnvironment())
 *     .buildPipeline();
 * ScanReport report = pipeline.run();
 *
 * // For testing with mock collaborators
 * ScanPipeline testPipeline = CommitWatchBuilder.create()
 *     .configuration(configuration)
 *     .mirror(mockMirror)
 *     .analysisClient(mockClient)
 *     .notifier(mockNotifier)
 *     .buildPipeline();
 * }
 * </pre>
 */
public class CommitWatchBuilder {

	private WatchConfiguration configuration;

	private WatchProperties properties;

	private ObjectMapper objectMapper;

	private Clock clock;

	private RepositoryMirror mirror;

	private CheckpointStore checkpointStore;

	private ChangeHarvester harvester;

	private AnalysisClient analysisClient;

	private Notifier notifier;

	private CommitWatchBuilder() {
		this.properties = new WatchProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new CommitWatchBuilder
	 */
	public static CommitWatchBuilder create() {
		return new CommitWatchBuilder();
	}

	/**
	 * Set the deployment configuration. Required.
	 * @param configuration watch configuration
	 * @return this builder
	 */
	public CommitWatchBuilder configuration(WatchConfiguration configuration) {
		this.configuration = configuration;
		return this;
	}

	/**
	 * Set tunable properties.
	 * @param properties properties (null to use defaults)
	 * @return this builder
	 */
	public CommitWatchBuilder properties(@Nullable WatchProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public CommitWatchBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set the clock used for checkpoints and the lookback window.
	 * @param clock clock (null to use the system clock in the default zone)
	 * @return this builder
	 */
	public CommitWatchBuilder clock(@Nullable Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Set a custom RepositoryMirror implementation.
	 * @param mirror mirror (null to use JGit)
	 * @return this builder
	 */
	public CommitWatchBuilder mirror(@Nullable RepositoryMirror mirror) {
		this.mirror = mirror;
		return this;
	}

	/**
	 * Set a custom CheckpointStore implementation.
	 * @param checkpointStore store (null to use SQLite at the configured database file)
	 * @return this builder
	 */
	public CommitWatchBuilder checkpointStore(@Nullable CheckpointStore checkpointStore) {
		this.checkpointStore = checkpointStore;
		return this;
	}

	/**
	 * Set a custom ChangeHarvester implementation.
	 * @param harvester harvester (null to use JGit)
	 * @return this builder
	 */
	public CommitWatchBuilder harvester(@Nullable ChangeHarvester harvester) {
		this.harvester = harvester;
		return this;
	}

	/**
	 * Set a custom AnalysisClient implementation.
	 * @param analysisClient client (null to use the JDK HTTP client)
	 * @return this builder
	 */
	public CommitWatchBuilder analysisClient(@Nullable AnalysisClient analysisClient) {
		this.analysisClient = analysisClient;
		return this;
	}

	/**
	 * Set a custom Notifier implementation.
	 * @param notifier notifier (null to send email through the configured SMTP server)
	 * @return this builder
	 */
	public CommitWatchBuilder notifier(@Nullable Notifier notifier) {
		this.notifier = notifier;
		return this;
	}

	/**
	 * Build the checkpoint store alone, for inspecting the checkpoint log.
	 * @return configured CheckpointStore
	 */
	public CheckpointStore buildCheckpointStore() {
		validateConfiguration();
		return checkpointStore != null ? checkpointStore
				: new SqliteCheckpointStore(configuration.databaseFile(), resolveClock(),
						Duration.ofDays(properties.getLookbackDays()));
	}

	/**
	 * Build the scan pipeline.
	 * @return configured ScanPipeline
	 */
	public ScanPipeline buildPipeline() {
		validateConfiguration();
		Clock resolvedClock = resolveClock();
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();

		RepositoryMirror resolvedMirror = this.mirror != null ? this.mirror
				: new JGitRepositoryMirror(properties.getGitTimeoutSeconds());
		ChangeHarvester resolvedHarvester = this.harvester != null ? this.harvester : new JGitChangeHarvester();
		AnalysisClient client = this.analysisClient != null ? this.analysisClient
				: new HttpAnalysisClient(configuration.analysisBaseUrl(), configuration.analysisEndpoint(),
						configuration.analysisApiKey(),
						Duration.ofSeconds(properties.getAnalysisConnectTimeoutSeconds()),
						Duration.ofSeconds(properties.getAnalysisRequestTimeoutSeconds()));
		Notifier resolvedNotifier = this.notifier != null ? this.notifier
				: new EmailNotifier(MailSenderFactory.create(configuration, properties.getSmtpTimeoutSeconds()),
						new MarkdownRenderer(), configuration.fromAddress());

		PromptBuilder promptBuilder = new PromptBuilder(new DelimiterGenerator(properties.getDelimiterLength()),
				configuration.projectDescription());
		AnalysisDispatcher dispatcher = new AnalysisDispatcher(client, mapper, configuration.analysisModel());

		return new ScanPipeline(configuration, resolvedMirror, buildCheckpointStore(), resolvedHarvester,
				promptBuilder, dispatcher, resolvedNotifier, resolvedClock);
	}

	private void validateConfiguration() {
		if (configuration == null) {
			throw new IllegalStateException("Configuration is required. Call configuration() first.");
		}
	}

	private Clock resolveClock() {
		return clock != null ? clock : Clock.systemDefaultZone();
	}

}
