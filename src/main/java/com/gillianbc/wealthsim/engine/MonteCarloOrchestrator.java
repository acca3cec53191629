package com.gillianbc.wealthsim.engine;

import com.gillianbc.wealthsim.config.SimulationProperties;
import com.gillianbc.wealthsim.exception.EngineException;
import com.gillianbc.wealthsim.model.YearRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs every path of a draw table across the simulation thread pool. Paths are split into
 * contiguous chunks; each path writes only its own row, so no locking is needed. The first
 * failing chunk aborts the run and remaining chunks are cancelled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonteCarloOrchestrator {

    private final PathSimulator pathSimulator;
    private final ExecutorService executor;
    private final SimulationProperties properties;

    public RawResults run(SimulationPlan plan, DrawTable draws) {
        int iterations = draws.getIterations();
        YearRecord[][] rows = new YearRecord[iterations][];
        int chunks = Math.max(1, Math.min(iterations, properties.parallelism() * 2));
        int chunkSize = (iterations + chunks - 1) / chunks;

        long startNano = System.nanoTime();
        List<Future<?>> futures = new ArrayList<>(chunks);
        for (int from = 0; from < iterations; from += chunkSize) {
            final int start = from;
            final int end = Math.min(iterations, from + chunkSize);
            futures.add(executor.submit(() -> {
                for (int path = start; path < end; path++) {
                    rows[path] = pathSimulator.simulate(plan, draws, path);
                }
            }));
        }

        try {
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new EngineException("Simulation interrupted", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof EngineException) {
                throw (EngineException) cause;
            }
            throw new EngineException("Simulation failed: " + cause.getMessage(), cause);
        }

        log.debug("Simulated {} paths x {} years in {} chunks, {} ms",
                iterations, plan.getYearCount(), futures.size(), (System.nanoTime() - startNano) / 1_000_000);
        return new RawResults(plan.getStartYear(), rows);
    }

    private static void cancelAll(List<Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }
}
