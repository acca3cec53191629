package com.gillianbc.wealthsim.session;

import com.gillianbc.wealthsim.aggregate.AggregatedResult;
import com.gillianbc.wealthsim.aggregate.Aggregator;
import com.gillianbc.wealthsim.engine.DrawTable;
import com.gillianbc.wealthsim.engine.MonteCarloOrchestrator;
import com.gillianbc.wealthsim.engine.RawResults;
import com.gillianbc.wealthsim.engine.ReturnsGenerator;
import com.gillianbc.wealthsim.engine.SimulationPlan;
import com.gillianbc.wealthsim.model.PartialPolicyParams;
import com.gillianbc.wealthsim.model.PolicyParams;
import com.gillianbc.wealthsim.model.Scenario;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.UUID;

/**
 * Entry point for callers. A session samples returns once; recalculations re-run every path
 * against the cached draws with new policy parameters and never sample again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationService {

    private final ScenarioValidator validator;
    private final ReturnsGenerator returnsGenerator;
    private final MonteCarloOrchestrator orchestrator;
    private final Aggregator aggregator;
    private final SessionStore store;

    public SessionResult createSession(Scenario scenario, int iterations, long seed, PolicyParams policy) {
        validator.validate(scenario, iterations, policy);
        long startNano = System.nanoTime();

        DrawTable draws = returnsGenerator.generate(scenario, iterations, seed);
        SimulationSession session = new SimulationSession(UUID.randomUUID().toString(), scenario, draws, store.now());
        AggregatedResult result = run(session, policy);
        store.put(session);

        log.info("Created session {} for scenario {}: {} paths x {} years in {} ms",
                session.getId(), scenario.getId(), iterations, scenario.getAssumptions().yearCount(),
                (System.nanoTime() - startNano) / 1_000_000);
        return new SessionResult(session.getId(), result);
    }

    public SessionResult createSession(Scenario scenario, int iterations, long seed) {
        Objects.requireNonNull(scenario, "scenario must not be null");
        return createSession(scenario, iterations, seed, PolicyParams.defaultsFor(scenario));
    }

    /**
     * Re-runs the session with {@code overrides} merged over its last policy. Calls on the same
     * session queue behind each other and commit in arrival order.
     */
    public AggregatedResult recalc(String sessionId, PartialPolicyParams overrides) {
        SimulationSession session = store.get(sessionId);
        PartialPolicyParams partial = overrides != null ? overrides : PartialPolicyParams.none();

        session.getLock().lock();
        try {
            PolicyParams policy = partial.mergeOver(session.getLastPolicy());
            validator.validatePolicy(policy);
            long startNano = System.nanoTime();
            AggregatedResult result = run(session, policy);
            log.debug("Recalculated session {} with {} in {} ms",
                    sessionId, policy, (System.nanoTime() - startNano) / 1_000_000);
            return result;
        } finally {
            session.getLock().unlock();
        }
    }

    public void invalidate(String sessionId) {
        if (store.invalidate(sessionId)) {
            log.debug("Invalidated session {}", sessionId);
        }
    }

    /** Call after a scenario is edited; its sessions must be recreated. */
    public void invalidateScenario(String scenarioId) {
        int removed = store.invalidateScenario(scenarioId);
        log.info("Scenario {} changed, dropped {} sessions", scenarioId, removed);
    }

    private AggregatedResult run(SimulationSession session, PolicyParams policy) {
        SimulationPlan plan = SimulationPlan.of(session.getScenario(), policy);
        RawResults raw = orchestrator.run(plan, session.getDraws());
        AggregatedResult result = aggregator.aggregate(raw, plan);
        session.commit(policy, raw, result);
        return result;
    }
}
