package com.pressplay.orchestration.relay;

import com.pressplay.orchestration.bridge.ErrorMessages;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Re-exposes one backend subscription as core state.
 * <p>
 * The backend stream is subscribed lazily on {@link #connect()} and delivered on the
 * orchestration loop. The latest value is cached and replayed to late subscribers. When the
 * backend stream errors, the error is logged and the last value stays available; a later
 * {@code connect()} resubscribes.
 * </p>
 *
 * @param <T> value type of the stream
 */
@Slf4j
public abstract class StreamRelay<T> {

    private final String name;
    private final Supplier<Flux<T>> source;
    private final Scheduler loop;
    private final Sinks.Many<T> sink = Sinks.many().replay().latest();

    private volatile T latest;
    private Disposable subscription;

    protected StreamRelay(String name, Supplier<Flux<T>> source, Scheduler loop) {
        this.name = name;
        this.source = source;
        this.loop = loop;
    }

    /** Subscribe to the backend stream unless already connected. */
    public synchronized void connect() {
        if (subscription != null && !subscription.isDisposed()) {
            return;
        }
        Flux<T> stream;
        try {
            stream = source.get();
        } catch (RuntimeException e) {
            log.warn("Could not subscribe to {}: {}", name, ErrorMessages.describe(e));
            return;
        }
        subscription = stream
                .publishOn(loop)
                .subscribe(this::accept,
                        error -> log.warn("{} stream failed, keeping last value: {}", name, ErrorMessages.describe(error)),
                        () -> log.debug("{} stream completed", name));
        log.debug("Connected {} relay", name);
    }

    public synchronized void disconnect() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
        }
    }

    public synchronized boolean isConnected() {
        return subscription != null && !subscription.isDisposed();
    }

    /** @return the most recent value, if any arrived */
    public Optional<T> latest() {
        return Optional.ofNullable(latest);
    }

    /** @return the latest value (if any) followed by every later one */
    public Flux<T> updates() {
        return sink.asFlux();
    }

    private void accept(T value) {
        latest = value;
        sink.tryEmitNext(value);
    }
}
