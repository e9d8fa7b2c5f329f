package com.pressplay.orchestration.service;

import com.pressplay.orchestration.bridge.BridgeException;
import com.pressplay.orchestration.bridge.BridgePort;
import com.pressplay.orchestration.model.CompressionAlgorithm;
import com.pressplay.orchestration.model.CompressionJob;
import com.pressplay.orchestration.model.GameInfo;
import com.pressplay.orchestration.model.JobKind;
import com.pressplay.orchestration.model.JobStatus;
import com.pressplay.orchestration.model.Platform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CompletionReconcilerTest {

    private static final GameInfo FOO = GameInfo.builder()
            .name("Foo").path("C:/g/Foo").platform(Platform.EPIC_GAMES).sizeBytes(500).build();
    private static final CompressionJob DONE = CompressionJob
            .running("C:/g/Foo", "Foo", JobKind.COMPRESSION, CompressionAlgorithm.LZX)
            .withStatus(JobStatus.COMPLETED);

    private BridgePort bridge;
    private GameListing listing;
    private CompletionReconciler reconciler;

    @BeforeEach
    void setUp() {
        bridge = Mockito.mock(BridgePort.class);
        listing = Mockito.mock(GameListing.class);
        reconciler = new CompletionReconciler(bridge, listing);
        when(listing.findByPath("C:/g/Foo")).thenReturn(Optional.of(FOO));
    }

    @Test
    void hydratedGameReplacesListedEntry() {
        GameInfo hydrated = FOO.toBuilder().compressed(true).compressedSize(300L).build();
        when(bridge.hydrateGame("C:/g/Foo", "Foo", Platform.EPIC_GAMES)).thenReturn(Mono.just(hydrated));

        StepVerifier.create(reconciler.reconcile(DONE))
                .expectNext(ReconcileOutcome.HYDRATED)
                .verifyComplete();

        verify(listing).update(hydrated);
        verify(listing, never()).refresh();
    }

    @Test
    void emptyHydrationFallsBackToRefresh() {
        when(bridge.hydrateGame(anyString(), anyString(), any())).thenReturn(Mono.empty());

        StepVerifier.create(reconciler.reconcile(DONE))
                .expectNext(ReconcileOutcome.REFRESHED)
                .verifyComplete();

        verify(listing).refresh();
        verify(listing, never()).update(any());
    }

    @Test
    void failedHydrationFallsBackToRefresh() {
        when(bridge.hydrateGame(anyString(), anyString(), any()))
                .thenReturn(Mono.error(new BridgeException("probe timed out")));

        StepVerifier.create(reconciler.reconcile(DONE))
                .expectNext(ReconcileOutcome.REFRESHED)
                .verifyComplete();

        verify(listing).refresh();
    }

    @Test
    void unlistedGameRefreshesWithoutHydrating() {
        when(listing.findByPath("C:/g/Foo")).thenReturn(Optional.empty());

        StepVerifier.create(reconciler.reconcile(DONE))
                .expectNext(ReconcileOutcome.REFRESHED)
                .verifyComplete();

        verify(bridge, never()).hydrateGame(anyString(), anyString(), any());
        verify(listing).refresh();
    }

    @Test
    void nothingHappensUntilSubscribed() {
        when(bridge.hydrateGame(anyString(), anyString(), any())).thenReturn(Mono.empty());

        reconciler.reconcile(DONE);

        verify(bridge, never()).hydrateGame(anyString(), anyString(), any());
        verify(listing, never()).refresh();
    }
}
