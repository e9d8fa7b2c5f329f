package com.pressplay.orchestration.view;

import com.pressplay.orchestration.model.AutomationJob;
import com.pressplay.orchestration.model.AutomationJobStatus;
import com.pressplay.orchestration.relay.AutomationQueueRelay;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Optional;

/**
 * Projections over the automation queue: the job being compressed and the number waiting.
 * An unknown or empty queue reads as "nothing active, nothing pending".
 */
@Component
@RequiredArgsConstructor
public class AutomationQueueView {

    private final AutomationQueueRelay queueRelay;

    public Optional<AutomationJob> activeJob() {
        return activeJob(queueRelay.latest().orElse(null));
    }

    public int pendingCount() {
        return pendingCount(queueRelay.latest().orElse(null));
    }

    public Flux<Optional<AutomationJob>> activeJobUpdates() {
        return queueRelay.updates().map(AutomationQueueView::activeJob).distinctUntilChanged();
    }

    public Flux<Integer> pendingCountUpdates() {
        return queueRelay.updates().map(AutomationQueueView::pendingCount).distinctUntilChanged();
    }

    /** First entry whose status is COMPRESSING. */
    public static Optional<AutomationJob> activeJob(List<AutomationJob> queue) {
        if (queue == null || queue.isEmpty()) {
            return Optional.empty();
        }
        return queue.stream()
                .filter(job -> job.status() == AutomationJobStatus.COMPRESSING)
                .findFirst();
    }

    /** Entries that are queued but not started: pending, waiting for settle or for idle. */
    public static int pendingCount(List<AutomationJob> queue) {
        if (queue == null) {
            return 0;
        }
        return (int) queue.stream()
                .filter(job -> job.status() != null && job.status().isWaiting())
                .count();
    }
}
