package com.pressplay.orchestration.view;

import com.pressplay.orchestration.bridge.BridgePort;
import com.pressplay.orchestration.model.GameInfo;
import com.pressplay.orchestration.model.Platform;
import com.pressplay.orchestration.service.GameLibrary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class InventoryViewTest {

    private static final GameInfo SMALL_WIN = GameInfo.builder()
            .name("Puzzle Box").path("C:/g/Puzzle Box").platform(Platform.STEAM)
            .sizeBytes(100).compressedSize(90L).compressed(true).build();
    private static final GameInfo BIG_WIN = GameInfo.builder()
            .name("Open World").path("C:/g/Open World").platform(Platform.EA_APP)
            .sizeBytes(1_000).compressedSize(400L).compressed(true).build();
    private static final GameInfo UNTOUCHED = GameInfo.builder()
            .name("Pixel Farm").path("C:/g/Pixel Farm").platform(Platform.GOG_GALAXY)
            .sizeBytes(50).build();

    private VirtualTimeScheduler loop;
    private GameLibrary library;
    private InventoryView view;

    @BeforeEach
    void setUp() {
        BridgePort bridge = Mockito.mock(BridgePort.class);
        when(bridge.listGames()).thenReturn(Mono.just(List.of(SMALL_WIN, UNTOUCHED, BIG_WIN)));
        loop = VirtualTimeScheduler.create();
        library = new GameLibrary(bridge, loop);
        view = new InventoryView(library, loop);
        ReflectionTestUtils.setField(view, "debounceMs", 220L);
        view.init();
        library.refresh();
    }

    @AfterEach
    void tearDown() {
        view.dispose();
        loop.dispose();
    }

    @Test
    void testDefaultsToLargestSavingsFirst() {
        assertThat(view.sort()).isEqualTo(new InventoryView.SortSpec(InventorySortField.SAVINGS_PERCENT, true));
        assertThat(view.visibleGames()).containsExactly(BIG_WIN, SMALL_WIN, UNTOUCHED);
    }

    @Test
    void testSearchAppliesAfterQuietPeriod() {
        view.onSearchInput("x");
        assertThat(view.visibleGames()).hasSize(3);

        loop.advanceTimeBy(Duration.ofMillis(220));

        assertThat(view.visibleGames()).containsExactly(SMALL_WIN, UNTOUCHED);
    }

    @Test
    void testSortChanges() {
        view.setSortField(InventorySortField.ORIGINAL_SIZE);
        assertThat(view.visibleGames()).containsExactly(BIG_WIN, SMALL_WIN, UNTOUCHED);

        view.toggleSortDirection();
        assertThat(view.visibleGames()).containsExactly(UNTOUCHED, SMALL_WIN, BIG_WIN);
        assertThat(view.sort().descending()).isFalse();
    }

    @Test
    void testUnchangedInputsKeepListInstance() {
        List<GameInfo> first = view.visibleGames();
        view.onSearchInput("");

        assertThat(view.visibleGames()).isSameAs(first);
    }

    @Test
    void testUpdatesEmitOnlyNewProjections() {
        List<List<GameInfo>> seen = new ArrayList<>();
        view.visibleGamesUpdates().subscribe(seen::add);
        assertThat(seen).hasSize(1);

        view.onSearchInput("");
        view.setSortField(InventorySortField.SAVINGS_PERCENT);
        assertThat(seen).hasSize(1);

        view.onSearchInput("open");
        loop.advanceTimeBy(Duration.ofMillis(220));

        assertThat(seen).hasSize(2);
        assertThat(seen.get(1)).containsExactly(BIG_WIN);
    }
}
