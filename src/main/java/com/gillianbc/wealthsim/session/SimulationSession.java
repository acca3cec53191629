package com.gillianbc.wealthsim.session;

import com.gillianbc.wealthsim.aggregate.AggregatedResult;
import com.gillianbc.wealthsim.engine.DrawTable;
import com.gillianbc.wealthsim.engine.RawResults;
import com.gillianbc.wealthsim.model.PolicyParams;
import com.gillianbc.wealthsim.model.Scenario;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One cached Monte Carlo run: the scenario snapshot, its draw table, and the results of the
 * last committed policy. Mutable fields are only written while {@link #getLock()} is held.
 */
public class SimulationSession {

    @Getter private final String id;
    @Getter private final Scenario scenario;
    @Getter private final DrawTable draws;
    /** Fair, so queued recalculations commit in arrival order. */
    @Getter private final ReentrantLock lock = new ReentrantLock(true);

    @Getter private volatile PolicyParams lastPolicy;
    /** Per-path records of the last committed run. */
    @Getter private volatile RawResults rawResults;
    @Getter private volatile AggregatedResult lastResult;
    @Getter private volatile Instant lastAccess;

    SimulationSession(String id, Scenario scenario, DrawTable draws, Instant createdAt) {
        this.id = id;
        this.scenario = scenario;
        this.draws = draws;
        this.lastAccess = createdAt;
    }

    void commit(PolicyParams policy, RawResults raw, AggregatedResult result) {
        this.lastPolicy = policy;
        this.rawResults = raw;
        this.lastResult = result;
    }

    void touch(Instant now) {
        this.lastAccess = now;
    }

    boolean isExpired(Instant now, Duration idleTimeout) {
        return lastAccess.plus(idleTimeout).isBefore(now);
    }
}
