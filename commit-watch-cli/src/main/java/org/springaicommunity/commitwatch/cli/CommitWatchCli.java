package org.springaicommunity.commitwatch.cli;

import ch.qos.logback.classic.Level;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.commitwatch.*;

import java.util.List;
import java.util.function.Function;

/**
 * Commit Watch CLI Application
 *
 * Plain Java command-line application that performs one scan of the configured
 * repository: new commits since the last checkpoint are sent to the analysis service and
 * the assessment is emailed. Meant to be invoked periodically by an external scheduler
 * (cron, systemd timer, CI schedule); runs for the same repository and branch must not
 * overlap.
 *
 * Usage: java -jar commit-watch-cli.jar [OPTIONS]
 *
 * Configuration is read from a .env file or the environment; see --help.
 */
public class CommitWatchCli {

	private static final Logger logger = LoggerFactory.getLogger(CommitWatchCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_SCAN_FAILED = 1;

	static final int EXIT_USAGE = 2;

	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != EXIT_OK) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args) {
		return run(args, EnvironmentSupport::get);
	}

	/**
	 * Run with an explicit variable lookup in place of the process environment.
	 * @param args command-line arguments
	 * @param lookup resolves a configuration variable name to its value
	 * @return process exit code
	 */
	static int run(String[] args, Function<String, @Nullable String> lookup) {
		WatchProperties properties = new WatchProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		ParsedArguments arguments;
		WatchConfiguration configuration;
		try {
			arguments = argumentParser.parse(args);
			if (arguments.helpRequested) {
				System.out.println(argumentParser.generateHelpText());
				return EXIT_OK;
			}
			argumentParser.applyTo(arguments, properties);
			configuration = WatchConfiguration.load(lookup);
		}
		catch (IllegalArgumentException | ConfigurationException e) {
			logger.error(e.getMessage());
			return EXIT_USAGE;
		}

		if (arguments.verbose) {
			enableDebugLogging();
		}
		logConfiguration(configuration, properties, arguments);

		CommitWatchBuilder builder = CommitWatchBuilder.create().configuration(configuration).properties(properties);

		if (arguments.history) {
			return printHistory(builder.buildCheckpointStore(), configuration.identity());
		}

		try {
			ScanReport report = builder.buildPipeline().run(arguments.dryRun);
			logReport(report);
			return EXIT_OK;
		}
		catch (ScanFailedException e) {
			logger.error("Scan failed during {}: {}", e.getFailedState(), e.getCause().getMessage());
			if (e.getCause() instanceof AnalysisServiceException analysisError && analysisError.getStatusCode() > 0) {
				logger.error("Analysis service returned HTTP {}", analysisError.getStatusCode());
			}
			if (arguments.verbose) {
				logger.error("Stack trace:", e);
			}
			logger.error("No checkpoint recorded; the same commits will be scanned on the next run");
			return EXIT_SCAN_FAILED;
		}
		catch (RuntimeException e) {
			logger.error("Scan could not start: {}", e.getMessage());
			return EXIT_SCAN_FAILED;
		}
	}

	private static int printHistory(CheckpointStore store, ScanIdentity identity) {
		try {
			List<ScanCheckpoint> history = store.history(identity);
			logger.info("Checkpoints for {}: {}", identity, history.size());
			for (ScanCheckpoint checkpoint : history) {
				logger.info("  #{} {}", checkpoint.id(), checkpoint.scanTimestamp());
			}
			return EXIT_OK;
		}
		catch (CheckpointStoreException e) {
			logger.error("Failed to read checkpoints: {}", e.getMessage());
			return EXIT_SCAN_FAILED;
		}
	}

	private static void enableDebugLogging() {
		Logger packageLogger = LoggerFactory.getLogger("org.springaicommunity.commitwatch");
		if (packageLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(WatchConfiguration configuration, WatchProperties properties,
			ParsedArguments arguments) {
		logger.info("Configuration:");
		logger.info("  Repository: {}", configuration.repositoryUrl());
		logger.info("  Branch: {}", configuration.branch());
		logger.info("  Mirror directory: {}", configuration.mirrorDirectory());
		logger.info("  Checkpoint database: {}", configuration.databaseFile());
		logger.info("  Analysis endpoint: {}{}", configuration.analysisBaseUrl(), configuration.analysisEndpoint());
		logger.info("  Model: {}", configuration.analysisModel());
		logger.info("  SMTP server: {}:{}", configuration.smtpHost(), configuration.smtpPort());
		logger.info("  Recipient: {}", configuration.recipient());
		logger.info("  Access token: {}", configuration.accessToken() != null ? "(set)" : "(not set)");
		logger.info("  Lookback days: {}", properties.getLookbackDays());
		logger.info("  Dry run: {}", arguments.dryRun);
	}

	private static void logReport(ScanReport report) {
		logger.info("Scan completed successfully!");
		logger.info("  Outcome: {}", report.outcome());
		logger.info("  Since: {}", report.since());
		logger.info("  Commits: {}", report.commitCount());
		logger.info("  Files: {}", report.fileCount());
		logger.info("  Checkpoint: {}", report.checkpoint() != null ? report.checkpoint() : "(not recorded)");
	}

}
