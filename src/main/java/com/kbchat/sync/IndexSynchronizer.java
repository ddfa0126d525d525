package com.kbchat.sync;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbchat.error.KbChatException;
import com.kbchat.error.RebuildException;
import com.kbchat.error.SourceUnavailableException;
import com.kbchat.index.IndexHolder;
import com.kbchat.index.IndexPaths;
import com.kbchat.knowledge.KnowledgeSource;

/**
 * Keeps the persisted and published index in step with the knowledge source by polling it.
 *
 * <p>Polls and forced rebuilds run as tasks on one single-threaded executor, so they never
 * overlap and the poll and rebuild fields of the sync state are only written from that thread.
 * The {@code active} flag is written by {@link #start()} and {@link #stop()} on the caller's
 * thread. Readers see the state through {@link #status()}.
 */
public class IndexSynchronizer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IndexSynchronizer.class);
    private static final long STOP_TIMEOUT_SECONDS = 5;

    private final KnowledgeSource source;
    private final IndexRebuilder rebuilder;
    private final IndexPaths paths;
    private final IndexHolder holder;
    private final SyncSettings settings;
    private final Clock clock;
    private final ScheduledExecutorService executor;
    private final AtomicReference<SyncState> state = new AtomicReference<>(SyncState.INITIAL);

    private ScheduledFuture<?> schedule;

    public IndexSynchronizer(
            KnowledgeSource source,
            IndexRebuilder rebuilder,
            IndexPaths paths,
            IndexHolder holder,
            SyncSettings settings,
            Clock clock) {
        this.source = source;
        this.rebuilder = rebuilder;
        this.paths = paths;
        this.holder = holder;
        this.settings = settings;
        this.clock = clock;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "index-sync");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (schedule != null) {
            log.warn("sync.start.ignored reason=already-running");
            return;
        }
        if (executor.isShutdown()) {
            throw new IllegalStateException("Synchronizer has been stopped");
        }
        schedule = executor.scheduleWithFixedDelay(
                this::poll,
                settings.initialDelay().toMillis(),
                settings.pollInterval().toMillis(),
                TimeUnit.MILLISECONDS);
        update(current -> current.withActive(true));
        log.info("sync.started pollIntervalSeconds={} uptimeThresholdSeconds={} minRebuildIntervalSeconds={}",
                settings.pollInterval().toSeconds(),
                settings.sourceUptimeThreshold().toSeconds(),
                settings.minRebuildInterval().toSeconds());
    }

    public synchronized void stop() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("sync.stop.timeout seconds={}", STOP_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        update(current -> current.withActive(false));
        log.info("sync.stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Runs one poll on the synchronizer thread and waits for its outcome.
     */
    public PollOutcome pollOnce() {
        return runOnExecutor(this::poll);
    }

    /**
     * Rebuilds immediately, ignoring the minimum rebuild interval. Still serialized with polls.
     *
     * @throws RebuildException when the rebuild fails; the previous index stays published
     */
    public RebuildStats forceRebuild() {
        log.info("sync.rebuild.forced");
        return runOnExecutor(() -> runRebuild(SyncTrigger.MANUAL));
    }

    public SyncStatus status() {
        SyncState current = state.get();
        Long secondsSinceLastRebuild = current.lastRebuildTime() == null
                ? null
                : Duration.between(current.lastRebuildTime(), clock.instant()).toSeconds();
        return new SyncStatus(
                current.active(),
                current.rebuildInProgress(),
                current.lastObservedModification(),
                current.lastRebuildTime(),
                holder.current().size(),
                paths.bothExist(),
                settings.pollInterval(),
                settings.sourceUptimeThreshold(),
                settings.minRebuildInterval(),
                secondsSinceLastRebuild);
    }

    private PollOutcome poll() {
        try {
            if (!paths.bothExist()) {
                log.info("sync.trigger trigger={} path={}", SyncTrigger.INDEX_ABSENT, paths.structure());
                return rebuildUnlessThrottled(SyncTrigger.INDEX_ABSENT);
            }

            long uptimeSeconds = source.sourceUptimeSeconds();
            if (uptimeSeconds < settings.sourceUptimeThreshold().toSeconds()) {
                log.info("sync.trigger trigger={} uptimeSeconds={} thresholdSeconds={}",
                        SyncTrigger.SOURCE_RESTARTED, uptimeSeconds, settings.sourceUptimeThreshold().toSeconds());
                return rebuildUnlessThrottled(SyncTrigger.SOURCE_RESTARTED);
            }

            Optional<Instant> observed = source.maxModificationOfActiveEntries();
            if (observed.isEmpty()) {
                log.debug("sync.poll.no-active-entries");
                return PollOutcome.UNCHANGED;
            }
            Instant previous = state.get().lastObservedModification();
            Instant latest = observed.get();
            if (previous == null) {
                update(current -> current.withLastObservedModification(latest));
                log.info("sync.baseline lastModification={}", latest);
                return PollOutcome.BASELINE_RECORDED;
            }
            if (!latest.isAfter(previous)) {
                log.debug("sync.poll.unchanged lastModification={}", latest);
                return PollOutcome.UNCHANGED;
            }

            // The baseline moves on even if the rebuild below is throttled or fails.
            update(current -> current.withLastObservedModification(latest));
            log.info("sync.trigger trigger={} previous={} latest={}", SyncTrigger.SOURCE_MODIFIED, previous, latest);
            return rebuildUnlessThrottled(SyncTrigger.SOURCE_MODIFIED);
        } catch (SourceUnavailableException e) {
            log.warn("sync.poll.source-unavailable error={}", e.getMessage());
            return PollOutcome.SOURCE_UNAVAILABLE;
        } catch (RuntimeException e) {
            log.error("sync.poll.failed error={}", e.getMessage(), e);
            return PollOutcome.POLL_FAILED;
        }
    }

    private PollOutcome rebuildUnlessThrottled(SyncTrigger trigger) {
        Instant lastRebuild = state.get().lastRebuildTime();
        if (lastRebuild != null) {
            Duration elapsed = Duration.between(lastRebuild, clock.instant());
            if (elapsed.compareTo(settings.minRebuildInterval()) < 0) {
                log.warn("sync.rebuild.throttled trigger={} secondsSinceLast={} minimumSeconds={}",
                        trigger, elapsed.toSeconds(), settings.minRebuildInterval().toSeconds());
                return PollOutcome.THROTTLED;
            }
        }
        try {
            runRebuild(trigger);
            return PollOutcome.REBUILT;
        } catch (RebuildException e) {
            log.error("sync.rebuild.failed trigger={} error={}", trigger, e.getMessage());
            return PollOutcome.REBUILD_FAILED;
        }
    }

    private RebuildStats runRebuild(SyncTrigger trigger) {
        update(current -> current.withRebuildInProgress(true));
        try {
            RebuildStats stats = rebuilder.rebuild();
            log.info("sync.rebuild.completed trigger={} entries={} durationMs={}",
                    trigger, stats.count(), stats.duration().toMillis());
            return stats;
        } finally {
            Instant finished = clock.instant();
            update(current -> current.withRebuildInProgress(false).withLastRebuildTime(finished));
        }
    }

    private <T> T runOnExecutor(Callable<T> task) {
        try {
            return executor.submit(task).get();
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Synchronizer has been stopped", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RebuildException("Interrupted while waiting for the synchronizer", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof KbChatException kbChatException) {
                throw kbChatException;
            }
            throw new RebuildException("Synchronizer task failed: " + cause.getMessage(), cause);
        }
    }

    private void update(UnaryOperator<SyncState> change) {
        state.updateAndGet(change);
    }

    private record SyncState(
            boolean active,
            boolean rebuildInProgress,
            Instant lastObservedModification,
            Instant lastRebuildTime) {

        static final SyncState INITIAL = new SyncState(false, false, null, null);

        SyncState withActive(boolean value) {
            return new SyncState(value, rebuildInProgress, lastObservedModification, lastRebuildTime);
        }

        SyncState withRebuildInProgress(boolean value) {
            return new SyncState(active, value, lastObservedModification, lastRebuildTime);
        }

        SyncState withLastObservedModification(Instant value) {
            return new SyncState(active, rebuildInProgress, value, lastRebuildTime);
        }

        SyncState withLastRebuildTime(Instant value) {
            return new SyncState(active, rebuildInProgress, lastObservedModification, value);
        }
    }
}
