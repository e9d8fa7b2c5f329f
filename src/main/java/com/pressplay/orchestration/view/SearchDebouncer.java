package com.pressplay.orchestration.view;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Turns raw search keystrokes into committed queries.
 * <p>
 * Input is normalised and committed after a quiet period with no further input. Clearing
 * the search commits immediately. A pending commit is always cancelled before a new one is
 * armed, and a commit equal to the current query is skipped.
 * </p>
 */
@Slf4j
public class SearchDebouncer {

    public static final Duration DEFAULT_QUIET_PERIOD = Duration.ofMillis(220);

    private final Scheduler scheduler;
    private final long quietPeriodMs;
    private final Sinks.Many<String> commits = Sinks.many().replay().latest();

    private volatile String committed = "";
    private Disposable pending;
    /** Incremented on every input; a timer only commits if no input arrived after it was armed. */
    private long inputSequence;
    private boolean disposed;

    public SearchDebouncer(Scheduler scheduler, Duration quietPeriod) {
        this.scheduler = scheduler;
        this.quietPeriodMs = quietPeriod == null || quietPeriod.isNegative() || quietPeriod.isZero()
                ? DEFAULT_QUIET_PERIOD.toMillis()
                : quietPeriod.toMillis();
        commits.tryEmitNext(committed);
    }

    /** Feed the raw text of the search box. */
    public synchronized void onInput(String raw) {
        if (disposed) {
            return;
        }
        String normalized = InventoryProjection.normalize(raw);
        long sequence = ++inputSequence;
        cancelPending();
        if (normalized.isEmpty()) {
            commit(normalized);
            return;
        }
        pending = scheduler.schedule(() -> commitIfLatest(sequence, normalized), quietPeriodMs, TimeUnit.MILLISECONDS);
    }

    /** @return the query currently in effect */
    public String committedQuery() {
        return committed;
    }

    /** @return the current query followed by every committed change */
    public Flux<String> commits() {
        return commits.asFlux();
    }

    public synchronized void dispose() {
        disposed = true;
        cancelPending();
    }

    private synchronized void commitIfLatest(long sequence, String query) {
        if (sequence != inputSequence) {
            return;
        }
        commit(query);
    }

    private synchronized void commit(String query) {
        if (disposed || query.equals(committed)) {
            return;
        }
        committed = query;
        commits.tryEmitNext(query);
        log.debug("Search query committed: '{}'", query);
    }

    private void cancelPending() {
        if (pending != null) {
            pending.dispose();
            pending = null;
        }
    }
}
