package com.wavesmith.workers;

import com.wavesmith.core.events.EventBus;
import com.wavesmith.core.events.EventType;
import com.wavesmith.core.events.WavesmithEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Follows coordinator events on the {@link EventBus} and keeps a summary of the
 * latest run: worker failures, merge conflicts and the most recent events.
 * The summary is reset when a new run starts.
 */
@Component
public class CoordinatorActivity {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorActivity.class);

    static final int RECENT_LIMIT = 20;

    private final EventBus eventBus;
    private EventBus.Subscription subscription;

    private final Deque<String> recent = new ArrayDeque<>();
    private Instant runStarted;
    private Instant runFinished;
    private int workersStarted;
    private int workerFailures;
    private int mergesCompleted;
    private int mergeConflicts;

    public CoordinatorActivity(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @PostConstruct
    public void start() {
        subscription = eventBus.subscribe(EventType.Scope.COORDINATOR, this::onEvent);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    synchronized void onEvent(WavesmithEvent event) {
        switch (event.type()) {
            case COORDINATOR_STARTED -> {
                recent.clear();
                runStarted = event.timestamp();
                runFinished = null;
                workersStarted = 0;
                workerFailures = 0;
                mergesCompleted = 0;
                mergeConflicts = 0;
            }
            case COORDINATOR_COMPLETED -> runFinished = event.timestamp();
            case WORKER_STARTED -> workersStarted++;
            case WORKER_FAILED -> workerFailures++;
            case MERGE_COMPLETED -> mergesCompleted++;
            case MERGE_CONFLICT -> {
                mergeConflicts++;
                log.debug("Recorded merge conflict on {}", event.payload().get("branch"));
            }
            default -> {
                return;
            }
        }
        recent.addLast(event.timestamp() + " " + event.eventType() + " " + event.payload());
        while (recent.size() > RECENT_LIMIT) {
            recent.removeFirst();
        }
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(runStarted, runFinished, workersStarted, workerFailures,
                mergesCompleted, mergeConflicts, List.copyOf(recent));
    }

    /**
     * Point-in-time view of the latest coordinator run.
     *
     * @param runStarted  when the latest run started (null if none has)
     * @param runFinished when it finished (null while running)
     * @param recent      newest-last event lines, at most {@link #RECENT_LIMIT}
     */
    public record Snapshot(Instant runStarted, Instant runFinished, int workersStarted, int workerFailures,
                           int mergesCompleted, int mergeConflicts, List<String> recent) {

        public boolean hasRun() {
            return runStarted != null;
        }
    }
}
