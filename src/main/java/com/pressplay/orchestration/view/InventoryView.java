package com.pressplay.orchestration.view;

import com.pressplay.orchestration.model.GameInfo;
import com.pressplay.orchestration.service.GameLibrary;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;

/**
 * Inventory screen model: debounced search over the library, sorted by one key.
 * Defaults to the largest savings first.
 */
@Slf4j
@Component
public class InventoryView {

    /** Sort key plus direction, published as one value. */
    public record SortSpec(InventorySortField field, boolean descending) {
    }

    private final GameLibrary library;
    private final Scheduler loop;
    private final InventoryProjection projection = new InventoryProjection();
    private final Sinks.Many<SortSpec> sortSink = Sinks.many().replay().latest();

    private volatile SortSpec sort = new SortSpec(InventorySortField.SAVINGS_PERCENT, true);
    private SearchDebouncer debouncer;

    @Value("${view.search.debounce.ms:220}")
    private long debounceMs;

    @Autowired
    public InventoryView(GameLibrary library, @Qualifier("orchestrationLoop") Scheduler loop) {
        this.library = library;
        this.loop = loop;
        sortSink.tryEmitNext(sort);
    }

    @PostConstruct
    public void init() {
        if (debounceMs <= 0 && log.isDebugEnabled()) {
            log.debug("Invalid view.search.debounce.ms={}, falling back to {}", debounceMs, SearchDebouncer.DEFAULT_QUIET_PERIOD);
        }
        debouncer = new SearchDebouncer(loop, Duration.ofMillis(Math.max(0, debounceMs)));
    }

    @PreDestroy
    public void dispose() {
        if (debouncer != null) {
            debouncer.dispose();
        }
    }

    public void onSearchInput(String raw) {
        debouncer().onInput(raw);
    }

    public synchronized void setSortField(InventorySortField field) {
        publishSort(new SortSpec(field, sort.descending()));
    }

    public synchronized void toggleSortDirection() {
        publishSort(new SortSpec(sort.field(), !sort.descending()));
    }

    public SortSpec sort() {
        return sort;
    }

    /** @return the visible games for the current inputs; the same instance while nothing changed */
    public synchronized List<GameInfo> visibleGames() {
        SortSpec current = sort;
        return projection.project(library.games().orElse(List.of()), debouncer().committedQuery(),
                current.field(), current.descending());
    }

    /** @return the visible games, re-emitted only when the projection produced a new list */
    public Flux<List<GameInfo>> visibleGamesUpdates() {
        return Flux.combineLatest(
                        library.updates().startWith(List.<GameInfo>of()),
                        debouncer().commits(),
                        sortSink.asFlux(),
                        inputs -> inputs)
                .publishOn(loop)
                .map(inputs -> visibleGames())
                .distinctUntilChanged(list -> list, (a, b) -> a == b);
    }

    private SearchDebouncer debouncer() {
        if (debouncer == null) {
            init();
        }
        return debouncer;
    }

    private void publishSort(SortSpec next) {
        sort = next;
        sortSink.tryEmitNext(next);
    }
}
