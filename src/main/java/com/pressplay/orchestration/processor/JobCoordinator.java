package com.pressplay.orchestration.processor;

import com.pressplay.orchestration.bridge.BridgePort;
import com.pressplay.orchestration.bridge.ErrorMessages;
import com.pressplay.orchestration.model.CompressionAlgorithm;
import com.pressplay.orchestration.model.CompressionJob;
import com.pressplay.orchestration.model.CompressionProgress;
import com.pressplay.orchestration.model.CompressionState;
import com.pressplay.orchestration.model.JobKind;
import com.pressplay.orchestration.model.JobStatus;
import com.pressplay.orchestration.model.SettingsSnapshot;
import com.pressplay.orchestration.service.CompletionReconciler;
import com.pressplay.orchestration.settings.SettingsStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Owns the single active job slot and the bounded history of finished jobs.
 * <p>
 * Requests, backend callbacks and timers are all re-scheduled onto the orchestration loop,
 * so every mutation of {@link CompressionState} happens on one thread in arrival order.
 * Only one job may run at a time; a start request while a job is running is ignored.
 * </p>
 * <p>
 * Failed and cancelled jobs stay visible in the slot for a short delay before they are
 * demoted into history. Completed jobs are demoted immediately, after the game list
 * refresh has been dispatched.
 * </p>
 */
@Slf4j
@Component
public class JobCoordinator {

    static final long DEFAULT_DEMOTION_DELAY_MS = 3000L;

    private final BridgePort bridge;
    private final SettingsStore settingsStore;
    private final CompletionReconciler reconciler;
    private final Scheduler loop;

    private final Sinks.Many<CompressionState> sink = Sinks.many().replay().latest();
    private volatile CompressionState state = CompressionState.EMPTY;

    /** Progress stream of a running compression, or the pending decompression call. */
    private volatile Disposable jobSubscription;
    /** Delayed demotion of a failed or cancelled job. */
    private volatile Disposable demotionTimer;
    /** Latest game list refresh dispatched after a completion. */
    private final Disposable.Swap reconciliation = Disposables.swap();
    /** Bumped whenever a job takes the slot; callbacks carrying an older value are dropped. */
    private long generation;
    /** One-way gate: once set, no asynchronous completion may touch the state. */
    private volatile boolean disposed;

    @Value("${coordinator.demotion.delay.ms:3000}")
    private long demotionDelayMs;

    @Autowired
    public JobCoordinator(BridgePort bridge,
                          SettingsStore settingsStore,
                          CompletionReconciler reconciler,
                          @Qualifier("orchestrationLoop") Scheduler loop) {
        this.bridge = bridge;
        this.settingsStore = settingsStore;
        this.reconciler = reconciler;
        this.loop = loop;
        sink.tryEmitNext(state);
    }

    /** @return the latest state snapshot */
    public CompressionState current() {
        return state;
    }

    /** @return the current state followed by every later snapshot */
    public Flux<CompressionState> states() {
        return sink.asFlux();
    }

    /** Progress of the job in the slot, empty when there is none or it has not reported yet. */
    public Flux<Optional<CompressionProgress>> activeProgress() {
        return states()
                .map(s -> Optional.ofNullable(s.getActiveJob()).map(CompressionJob::getProgress))
                .distinctUntilChanged();
    }

    /** Name of the game whose job occupies the slot, for headers and tray tooltips. */
    public Flux<Optional<String>> compressingGameName() {
        return states()
                .map(s -> Optional.ofNullable(s.getActiveJob()).map(CompressionJob::getGameName))
                .distinctUntilChanged();
    }

    public Flux<Boolean> isCompressing(String gamePath) {
        Objects.requireNonNull(gamePath, "gamePath");
        return states()
                .map(s -> {
                    CompressionJob job = s.getActiveJob();
                    return job != null && job.isActive() && job.getGamePath().equals(gamePath);
                })
                .distinctUntilChanged();
    }

    /**
     * Start compressing a game. Ignored while another job is running.
     *
     * @param algorithm the algorithm to use, or null for the configured default
     */
    public void startCompression(String gamePath, String gameName, CompressionAlgorithm algorithm) {
        Objects.requireNonNull(gamePath, "gamePath");
        Objects.requireNonNull(gameName, "gameName");
        loop.schedule(() -> doStartCompression(gamePath, gameName, algorithm));
    }

    /** Cancel the running job. Ignored when nothing is running. */
    public void cancelCompression() {
        loop.schedule(this::doCancel);
    }

    /** Start decompressing a game. Ignored while another job is running. */
    public void startDecompression(String gamePath, String gameName) {
        Objects.requireNonNull(gamePath, "gamePath");
        Objects.requireNonNull(gameName, "gameName");
        loop.schedule(() -> doStartDecompression(gamePath, gameName));
    }

    /**
     * Tear the coordinator down. Pending timers and subscriptions are cancelled and any
     * backend answer still in flight is discarded.
     */
    @PreDestroy
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        disposeDemotionTimer();
        disposeJobSubscription();
        reconciliation.dispose();
        log.info("Job coordinator disposed");
    }

    public boolean isDisposed() {
        return disposed;
    }

    private void doStartCompression(String gamePath, String gameName, CompressionAlgorithm requested) {
        if (disposed) {
            return;
        }
        if (state.hasActiveJob()) {
            if (log.isDebugEnabled()) {
                log.debug("Ignoring compression of {}: {} is still running", gameName, state.getActiveJob().getGameName());
            }
            return;
        }
        CompressionAlgorithm algorithm = requested != null ? requested : defaultAlgorithm();
        long token = occupySlot(CompressionJob.running(gamePath, gameName, JobKind.COMPRESSION, algorithm));
        log.info("Compressing {} with {}", gameName, algorithm);

        Flux<CompressionProgress> progress;
        try {
            progress = bridge.compressGame(gamePath, gameName, algorithm);
        } catch (RuntimeException e) {
            failJob("Failed to start: " + ErrorMessages.describe(e));
            return;
        }

        disposeJobSubscription();
        jobSubscription = progress
                .onBackpressureLatest()
                .publishOn(loop, 1)
                .subscribe(
                        tick -> onProgress(token, tick),
                        error -> onStreamError(token, error),
                        () -> onStreamComplete(token));
        releaseIfDisposed();
    }

    private void doStartDecompression(String gamePath, String gameName) {
        if (disposed) {
            return;
        }
        if (state.hasActiveJob()) {
            if (log.isDebugEnabled()) {
                log.debug("Ignoring decompression of {}: {} is still running", gameName, state.getActiveJob().getGameName());
            }
            return;
        }
        long token = occupySlot(CompressionJob.running(gamePath, gameName, JobKind.DECOMPRESSION, CompressionAlgorithm.XPRESS_4K));
        log.info("Decompressing {}", gameName);

        Mono<Void> call;
        try {
            call = bridge.decompressGame(gamePath);
        } catch (RuntimeException e) {
            failJob("Decompression failed: " + ErrorMessages.describe(e));
            return;
        }

        disposeJobSubscription();
        jobSubscription = call
                .publishOn(loop)
                .subscribe(
                        null,
                        error -> {
                            if (isCurrent(token)) {
                                failJob("Decompression failed: " + ErrorMessages.describe(error));
                            }
                        },
                        () -> {
                            if (isCurrent(token)) {
                                completeJob();
                            }
                        });
        releaseIfDisposed();
    }

    private void doCancel() {
        if (disposed) {
            return;
        }
        CompressionJob job = state.getActiveJob();
        if (job == null || !job.isActive()) {
            log.debug("Cancel requested with no running job");
            return;
        }
        // Unsubscribe before notifying the backend so a late tick cannot revive the job.
        disposeJobSubscription();
        notifyBackendOfCancel(job);
        setState(state.withActiveJob(job.withStatus(JobStatus.CANCELLED)));
        log.info("Cancelled {} of {}", job.getKind(), job.getGameName());
        scheduleDemotion();
    }

    private void notifyBackendOfCancel(CompressionJob job) {
        Mono.defer(bridge::cancelCompression)
                .subscribe(
                        null,
                        error -> log.warn("Backend did not acknowledge cancel of {}: {}",
                                job.getGameName(), ErrorMessages.describe(error)));
    }

    private void onProgress(long token, CompressionProgress tick) {
        if (!isCurrent(token)) {
            return;
        }
        CompressionJob job = state.getActiveJob();
        if (job == null || !job.isActive()) {
            return;
        }
        if (log.isTraceEnabled()) {
            log.trace("Progress for {}: {}%", job.getGameName(), tick.percent());
        }
        setState(state.withActiveJob(job.withProgress(tick)));
    }

    private void onStreamError(long token, Throwable error) {
        if (!isCurrent(token)) {
            return;
        }
        failJob(ErrorMessages.describe(error));
    }

    private void onStreamComplete(long token) {
        if (!isCurrent(token)) {
            return;
        }
        CompressionJob job = state.getActiveJob();
        if (job == null || !job.isActive()) {
            return;
        }
        completeJob();
    }

    private void completeJob() {
        disposeJobSubscription();
        CompressionJob job = state.getActiveJob();
        if (disposed || job == null || !job.isActive()) {
            return;
        }
        CompressionJob completed = job.withStatus(JobStatus.COMPLETED);
        reconciliation.replace(reconciler.reconcile(completed)
                .subscribe(
                        outcome -> log.debug("Library reconciled after {}: {}", completed.getGameName(), outcome),
                        error -> log.warn("Library reconciliation after {} failed: {}",
                                completed.getGameName(), ErrorMessages.describe(error))));
        setState(state.demote(completed));
        log.info("Completed {} of {}", completed.getKind(), completed.getGameName());
    }

    private void failJob(String message) {
        disposeJobSubscription();
        CompressionJob job = state.getActiveJob();
        if (job == null || !job.isActive()) {
            return;
        }
        setState(state.withActiveJob(job.withStatus(JobStatus.FAILED).withError(message)));
        log.warn("{} of {} failed: {}", job.getKind(), job.getGameName(), message);
        scheduleDemotion();
    }

    /**
     * Put a new job in the slot. A terminal job still waiting for its delayed demotion is
     * demoted right away.
     */
    private long occupySlot(CompressionJob job) {
        disposeDemotionTimer();
        CompressionState base = state;
        CompressionJob previous = base.getActiveJob();
        if (previous != null && previous.getStatus().isTerminal()) {
            base = base.demote(previous);
        }
        generation++;
        setState(base.withActiveJob(job));
        return generation;
    }

    private void scheduleDemotion() {
        disposeDemotionTimer();
        if (disposed) {
            return;
        }
        demotionTimer = loop.schedule(this::demoteTerminalJob, effectiveDemotionDelay(), TimeUnit.MILLISECONDS);
    }

    private void demoteTerminalJob() {
        if (disposed) {
            return;
        }
        CompressionJob job = state.getActiveJob();
        if (job == null || job.isActive()) {
            return;
        }
        setState(state.demote(job));
        if (log.isDebugEnabled()) {
            log.debug("Moved {} job for {} to history", job.getStatus(), job.getGameName());
        }
    }

    private long effectiveDemotionDelay() {
        if (demotionDelayMs <= 0) {
            if (log.isDebugEnabled()) {
                log.debug("Invalid coordinator.demotion.delay.ms={}, falling back to {}", demotionDelayMs, DEFAULT_DEMOTION_DELAY_MS);
            }
            return DEFAULT_DEMOTION_DELAY_MS;
        }
        return demotionDelayMs;
    }

    private CompressionAlgorithm defaultAlgorithm() {
        SettingsSnapshot snapshot = settingsStore.current();
        if (snapshot.loaded() && snapshot.settings() != null && snapshot.settings().getAlgorithm() != null) {
            return snapshot.settings().getAlgorithm();
        }
        return CompressionAlgorithm.BASELINE;
    }

    private boolean isCurrent(long token) {
        return !disposed && token == generation;
    }

    /** No write once disposed, including from a loop task that was already running when dispose was called. */
    private void setState(CompressionState next) {
        if (disposed) {
            return;
        }
        state = next;
        sink.tryEmitNext(next);
    }

    private void disposeJobSubscription() {
        Disposable subscription = jobSubscription;
        jobSubscription = null;
        if (subscription != null) {
            subscription.dispose();
        }
    }

    /** A subscription opened while dispose ran on another thread is released here. */
    private void releaseIfDisposed() {
        if (disposed) {
            disposeJobSubscription();
        }
    }

    private void disposeDemotionTimer() {
        Disposable timer = demotionTimer;
        demotionTimer = null;
        if (timer != null) {
            timer.dispose();
        }
    }
}
