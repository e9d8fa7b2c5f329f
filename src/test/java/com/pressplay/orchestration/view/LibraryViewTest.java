package com.pressplay.orchestration.view;

import com.pressplay.orchestration.bridge.BridgePort;
import com.pressplay.orchestration.model.GameInfo;
import com.pressplay.orchestration.model.Platform;
import com.pressplay.orchestration.service.GameLibrary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.Mockito.when;

class LibraryViewTest {

    private static final GameInfo ALAN = GameInfo.builder()
            .name("Alan Wake").path("C:/g/Alan Wake").platform(Platform.EPIC_GAMES)
            .sizeBytes(800).compressedSize(500L).compressed(true).build();
    private static final GameInfo HADES = GameInfo.builder()
            .name("Hades").path("C:/g/Hades").platform(Platform.STEAM).sizeBytes(200).build();

    private VirtualTimeScheduler loop;
    private GameLibrary library;
    private LibraryView view;

    @BeforeEach
    void setUp() {
        BridgePort bridge = Mockito.mock(BridgePort.class);
        when(bridge.listGames()).thenReturn(Mono.just(List.of(HADES, ALAN)));
        loop = VirtualTimeScheduler.create();
        library = new GameLibrary(bridge, loop);
        view = new LibraryView(library, loop);
    }

    @AfterEach
    void tearDown() {
        loop.dispose();
    }

    @Test
    void testEmptyBeforeLibraryLoads() {
        assertThat(view.visibleGames()).isEmpty();
        assertThat(view.filter()).isEqualTo(LibraryFilter.DEFAULT);
    }

    @Test
    void testFilterEditsApply() {
        library.refresh();
        assertThat(view.visibleGames()).containsExactly(ALAN, HADES);

        view.updateFilter(f -> new LibraryFilter(f.searchQuery(), Set.of(Platform.STEAM), f.compression(), f.sortField(), f.descending()));

        assertThat(view.visibleGames()).containsExactly(HADES);
    }

    @Test
    void testAggregatesFollowLibrary() {
        List<LibraryTotals> totals = new ArrayList<>();
        view.totals().subscribe(totals::add);

        library.refresh();
        library.update(HADES.toBuilder().compressed(true).compressedSize(150L).build());

        assertThat(totals).containsExactly(new LibraryTotals(1_000, 300), new LibraryTotals(1_000, 350));
        assertThat(view.platformCounts().blockFirst())
                .containsOnly(entry(Platform.STEAM, 1), entry(Platform.EPIC_GAMES, 1));
    }

    @Test
    void testVisibleUpdatesSkipEqualResults() {
        List<List<GameInfo>> seen = new ArrayList<>();
        view.visibleGamesUpdates().subscribe(seen::add);
        library.refresh();

        view.updateFilter(f -> new LibraryFilter("ha", f.platforms(), f.compression(), f.sortField(), f.descending()));
        view.updateFilter(f -> new LibraryFilter("HA", f.platforms(), f.compression(), f.sortField(), f.descending()));

        assertThat(seen).hasSize(2);
        assertThat(seen.get(1)).containsExactly(HADES);
    }
}
