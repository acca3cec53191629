package com.gillianbc.wealthsim.engine;

import com.gillianbc.wealthsim.model.YearRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Runs one path from the scenario's starting balances to the end year. Shares nothing
 * between calls, so paths may run on any thread.
 */
@Component
@RequiredArgsConstructor
public class PathSimulator {

    private final YearStepEngine engine;

    public YearRecord[] simulate(SimulationPlan plan, DrawTable draws, int path) {
        HouseholdState state = HouseholdState.initial(plan);
        YearRecord[] timeline = new YearRecord[plan.getYearCount()];
        for (int y = 0; y < timeline.length; y++) {
            timeline[y] = engine.step(plan, state, draws, path, y);
        }
        return timeline;
    }
}
