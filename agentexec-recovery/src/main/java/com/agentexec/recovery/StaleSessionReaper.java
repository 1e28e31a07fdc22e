package com.agentexec.recovery;

import com.agentexec.core.model.ExecutionSession;
import com.agentexec.core.model.SessionStatus;
import com.agentexec.core.model.StepCheckpointSummary;
import com.agentexec.recovery.decision.ResumeDecisionEngine;
import com.agentexec.recovery.session.RestorePreview;
import com.agentexec.recovery.session.StepExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background loop that detects sessions which stopped making progress.
 *
 * Responsibilities:
 * - Mark ACTIVE sessions with no update within the threshold as ABANDONED
 * - Log the resume recommendation for each abandoned session's latest valid checkpoint
 */
public class StaleSessionReaper {

    private static final Logger log = LoggerFactory.getLogger(StaleSessionReaper.class);

    private final StepExecutor stepExecutor;
    private final ResumeDecisionEngine decisionEngine;
    private final Duration staleThreshold;
    private final Duration scanInterval;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public StaleSessionReaper(StepExecutor stepExecutor, ResumeDecisionEngine decisionEngine,
                              Duration staleThreshold, Duration scanInterval, Clock clock) {
        if (staleThreshold.isNegative() || staleThreshold.isZero()) {
            throw new IllegalArgumentException("staleThreshold must be positive");
        }
        this.stepExecutor = stepExecutor;
        this.decisionEngine = decisionEngine;
        this.staleThreshold = staleThreshold;
        this.scanInterval = scanInterval;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stale-session-reaper");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start periodic scanning.
     */
    public void start() {
        if (running) {
            log.warn("Stale session reaper already running");
            return;
        }
        running = true;
        long periodMs = Math.max(scanInterval.toMillis(), 1);
        scheduler.scheduleWithFixedDelay(this::scanSafely, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Stale session reaper started (threshold {}, interval {})", staleThreshold, scanInterval);
    }

    /**
     * Stop the reaper.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Stale session reaper stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void scanSafely() {
        if (!running) return;

        try {
            scan();
        } catch (Exception e) {
            log.error("Error in stale session scan", e);
        }
    }

    /**
     * One pass over all sessions.
     *
     * @return ids of the sessions marked abandoned
     */
    List<String> scan() {
        Instant cutoff = clock.instant().minus(staleThreshold);
        List<String> abandoned = new ArrayList<>();

        for (ExecutionSession session : stepExecutor.listSessions()) {
            if (session.status() != SessionStatus.ACTIVE || !session.updatedAt().isBefore(cutoff)) {
                continue;
            }
            try {
                reap(session);
                abandoned.add(session.id());
            } catch (Exception e) {
                log.error("Failed to abandon session: {}", session.id(), e);
            }
        }

        if (!abandoned.isEmpty()) {
            log.info("Marked {} stale sessions abandoned", abandoned.size());
        }
        return abandoned;
    }

    private void reap(ExecutionSession session) {
        log.warn("Session {} has not progressed since {}, marking abandoned", session.id(), session.updatedAt());
        stepExecutor.abandonSession(session.id(), "No progress since " + session.updatedAt());

        List<StepCheckpointSummary> valid = stepExecutor.listStepCheckpoints(session.id()).stream()
            .filter(StepCheckpointSummary::valid)
            .toList();
        if (valid.isEmpty()) {
            log.info("Session {} has no valid checkpoint to resume from", session.id());
            return;
        }

        RestorePreview preview = stepExecutor.restoreCheckpoint(valid.get(valid.size() - 1).id());
        log.info("Session {} can resume from checkpoint {}:\n{}", session.id(), preview.checkpointId(),
            decisionEngine.explainDecision(preview.decision()));
    }
}
