package org.springaicommunity.commitwatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Runs one scan: mirror, read checkpoint, harvest, build prompt, dispatch, notify, and
 * advance the checkpoint.
 *
 * <p>
 * The checkpoint is written only in {@link PipelineState#CHECKPOINT_ADVANCE}, after a
 * delivered result or an empty range. Its value is the wall-clock instant captured when
 * harvesting started, so a commit landing during the run is picked up by the next one.
 * Any failure ends the run in {@link PipelineState#FAILED} without a write.
 */
public class ScanPipeline {

	private static final Logger logger = LoggerFactory.getLogger(ScanPipeline.class);

	private final WatchConfiguration configuration;

	private final RepositoryMirror mirror;

	private final CheckpointStore checkpointStore;

	private final ChangeHarvester harvester;

	private final PromptBuilder promptBuilder;

	private final AnalysisDispatcher dispatcher;

	private final Notifier notifier;

	private final Clock clock;

	private PipelineState state = PipelineState.DONE;

	public ScanPipeline(WatchConfiguration configuration, RepositoryMirror mirror, CheckpointStore checkpointStore,
			ChangeHarvester harvester, PromptBuilder promptBuilder, AnalysisDispatcher dispatcher, Notifier notifier,
			Clock clock) {
		this.configuration = configuration;
		this.mirror = mirror;
		this.checkpointStore = checkpointStore;
		this.harvester = harvester;
		this.promptBuilder = promptBuilder;
		this.dispatcher = dispatcher;
		this.notifier = notifier;
		this.clock = clock;
	}

	/**
	 * Run a scan and deliver the result.
	 * @return summary of the run
	 * @throws ScanFailedException if any step fails
	 */
	public ScanReport run() {
		return run(false);
	}

	/**
	 * Run a scan.
	 * @param dryRun if true, stop after building the prompt: nothing is sent and no
	 * checkpoint is written
	 * @return summary of the run
	 * @throws ScanFailedException if any step fails
	 */
	public ScanReport run(boolean dryRun) {
		ScanIdentity identity = configuration.identity();
		logger.info("Starting scan of {}{}", identity, dryRun ? " (dry run)" : "");
		try {
			transition(PipelineState.MIRRORING);
			boolean freshMirror = mirror.ensureMirror(MirrorRequest.from(configuration));

			transition(PipelineState.CHECKPOINT_READ);
			Instant since = checkpointStore.getLastScan(identity, freshMirror);

			transition(PipelineState.HARVESTING);
			Instant harvestStart = clock.instant();
			ChangeDigest digest = harvester.harvest(configuration.mirrorDirectory(), configuration.branch(), since);
			logger.info("Found {} commits touching {} files since {}", digest.commitCount(), digest.fileCount(),
					since);

			ScanOutcome outcome;
			if (digest.isEmpty()) {
				transition(PipelineState.NO_CHANGE);
				outcome = ScanOutcome.NO_CHANGES;
			}
			else {
				transition(PipelineState.PROMPTING);
				Optional<AnalysisPrompt> prompt = promptBuilder.build(digest);
				if (prompt.isEmpty()) {
					throw new IllegalStateException("No prompt built for a digest of " + digest.commitCount()
							+ " commits");
				}
				logger.debug("PROMPT: {}", prompt.get().text());

				if (dryRun) {
					logger.info("Dry run, prompt not sent:\n{}", prompt.get().text());
					transition(PipelineState.DONE);
					return new ScanReport(identity, since, null, digest.commitCount(), digest.fileCount(),
							ScanOutcome.DRY_RUN);
				}

				transition(PipelineState.DISPATCHING);
				String result = dispatcher.analyze(prompt.get());

				transition(PipelineState.NOTIFYING);
				notifier.notify(configuration.recipient(), configuration.notificationSubject(), result);
				outcome = ScanOutcome.NOTIFIED;
			}

			if (dryRun) {
				transition(PipelineState.DONE);
				return new ScanReport(identity, since, null, 0, 0, outcome);
			}

			transition(PipelineState.CHECKPOINT_ADVANCE);
			checkpointStore.recordScan(identity, harvestStart);

			transition(PipelineState.DONE);
			logger.info("Scan of {} completed: {}", identity, outcome);
			return new ScanReport(identity, since, harvestStart, digest.commitCount(), digest.fileCount(), outcome);
		}
		catch (RuntimeException e) {
			PipelineState failedState = state;
			transition(PipelineState.FAILED);
			logger.error("Scan of {} failed during {}: {}", identity, failedState, e.getMessage());
			throw new ScanFailedException(failedState, e);
		}
	}

	/**
	 * State reached by the most recent run.
	 * @return current state
	 */
	public PipelineState getState() {
		return state;
	}

	private void transition(PipelineState next) {
		logger.debug("{} -> {}", state, next);
		state = next;
	}

}
