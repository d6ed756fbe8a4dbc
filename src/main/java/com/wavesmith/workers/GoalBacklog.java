package com.wavesmith.workers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared, ordered list of goals and who is working on them. Claims here are
 * bookkeeping only; mutual exclusion between workers comes from the goal
 * locks taken before claiming.
 */
public class GoalBacklog {

    private static final Logger log = LoggerFactory.getLogger(GoalBacklog.class);

    public enum GoalState { PENDING, CLAIMED, COMPLETED, FAILED, SKIPPED }

    private static final class Entry {
        final Goal goal;
        GoalState state = GoalState.PENDING;
        String claimedBy;
        int attempts;
        String error;

        Entry(Goal goal) {
            this.goal = goal;
        }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final int maxRetries;

    /**
     * @param goals      goals in priority order
     * @param maxRetries how many times a goal abandoned by a dead worker is put back
     */
    public GoalBacklog(Collection<Goal> goals, int maxRetries) {
        for (Goal goal : goals) {
            if (entries.putIfAbsent(goal.id(), new Entry(goal)) != null) {
                throw new IllegalArgumentException("Duplicate goal id: " + goal.id());
            }
        }
        this.maxRetries = maxRetries;
    }

    public synchronized List<Goal> pending() {
        var pending = new ArrayList<Goal>();
        for (Entry entry : entries.values()) {
            if (entry.state == GoalState.PENDING) {
                pending.add(entry.goal);
            }
        }
        return pending;
    }

    public synchronized boolean tryClaim(String goalId, String workerId) {
        Entry entry = require(goalId);
        if (entry.state != GoalState.PENDING) {
            return false;
        }
        entry.state = GoalState.CLAIMED;
        entry.claimedBy = workerId;
        entry.attempts++;
        return true;
    }

    /** @return false if the worker no longer holds the claim */
    public synchronized boolean complete(String goalId, String workerId) {
        Entry entry = require(goalId);
        if (!isClaimedBy(entry, workerId)) {
            return false;
        }
        entry.state = GoalState.COMPLETED;
        entry.claimedBy = null;
        return true;
    }

    /** @return false if the worker no longer holds the claim */
    public synchronized boolean fail(String goalId, String workerId, String error) {
        Entry entry = require(goalId);
        if (!isClaimedBy(entry, workerId)) {
            return false;
        }
        entry.state = GoalState.FAILED;
        entry.claimedBy = null;
        entry.error = error;
        return true;
    }

    /**
     * Puts back the goal held by a worker that died. Once the goal has used
     * up its retries it is failed instead.
     *
     * @return the goal released, if the worker held one
     */
    public synchronized Optional<Goal> releaseClaimOf(String workerId, String reason) {
        for (Entry entry : entries.values()) {
            if (isClaimedBy(entry, workerId)) {
                entry.claimedBy = null;
                if (entry.attempts > maxRetries) {
                    entry.state = GoalState.FAILED;
                    entry.error = "Gave up after %d attempt(s): %s".formatted(entry.attempts, reason);
                    log.warn("Goal {} failed permanently: {}", entry.goal.id(), entry.error);
                } else {
                    entry.state = GoalState.PENDING;
                    log.info("Goal {} released from {} for retry ({} attempt(s) so far)",
                            entry.goal.id(), workerId, entry.attempts);
                }
                return Optional.of(entry.goal);
            }
        }
        return Optional.empty();
    }

    /** Marks every goal nobody finished as skipped. */
    public synchronized int skipUnfinished() {
        int skipped = 0;
        for (Entry entry : entries.values()) {
            if (entry.state == GoalState.PENDING || entry.state == GoalState.CLAIMED) {
                entry.state = GoalState.SKIPPED;
                entry.claimedBy = null;
                skipped++;
            }
        }
        return skipped;
    }

    /** True when no goal is waiting or in progress. */
    public synchronized boolean isDrained() {
        return entries.values().stream()
                .noneMatch(e -> e.state == GoalState.PENDING || e.state == GoalState.CLAIMED);
    }

    public synchronized GoalState stateOf(String goalId) {
        return require(goalId).state;
    }

    public synchronized Optional<String> errorOf(String goalId) {
        return Optional.ofNullable(require(goalId).error);
    }

    public synchronized int attemptsOf(String goalId) {
        return require(goalId).attempts;
    }

    public synchronized int count(GoalState state) {
        return (int) entries.values().stream().filter(e -> e.state == state).count();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized Map<String, String> errors() {
        var errors = new LinkedHashMap<String, String>();
        entries.values().stream()
                .filter(e -> e.error != null)
                .forEach(e -> errors.put(e.goal.id(), e.error));
        return errors;
    }

    private static boolean isClaimedBy(Entry entry, String workerId) {
        return entry.state == GoalState.CLAIMED && workerId.equals(entry.claimedBy);
    }

    private Entry require(String goalId) {
        Entry entry = entries.get(goalId);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown goal: " + goalId);
        }
        return entry;
    }
}
