package com.pressplay.orchestration.view;

import com.pressplay.orchestration.model.GameInfo;
import com.pressplay.orchestration.model.Platform;
import com.pressplay.orchestration.service.GameLibrary;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Library grid model: filters, per-platform counts and total savings over the game list.
 */
@Component
public class LibraryView {

    private final GameLibrary library;
    private final Scheduler loop;
    private final LibraryProjection projection = new LibraryProjection();
    private final Sinks.Many<LibraryFilter> filterSink = Sinks.many().replay().latest();

    private volatile LibraryFilter filter = LibraryFilter.DEFAULT;

    @Autowired
    public LibraryView(GameLibrary library, @Qualifier("orchestrationLoop") Scheduler loop) {
        this.library = library;
        this.loop = loop;
        filterSink.tryEmitNext(filter);
    }

    public LibraryFilter filter() {
        return filter;
    }

    public synchronized void updateFilter(UnaryOperator<LibraryFilter> edit) {
        filter = edit.apply(filter);
        filterSink.tryEmitNext(filter);
    }

    public synchronized List<GameInfo> visibleGames() {
        return projection.apply(library.games().orElse(List.of()), filter);
    }

    public Flux<List<GameInfo>> visibleGamesUpdates() {
        return Flux.combineLatest(library.updates(), filterSink.asFlux(), (games, f) -> f)
                .publishOn(loop)
                .map(f -> visibleGames())
                .distinctUntilChanged();
    }

    public Flux<Map<Platform, Integer>> platformCounts() {
        return library.updates().map(LibraryProjection::platformCounts).distinctUntilChanged();
    }

    public Flux<LibraryTotals> totals() {
        return library.updates().map(LibraryProjection::totals).distinctUntilChanged();
    }
}
