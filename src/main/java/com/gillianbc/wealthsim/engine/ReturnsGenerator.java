package com.gillianbc.wealthsim.engine;

import com.gillianbc.wealthsim.config.SimulationProperties;
import com.gillianbc.wealthsim.exception.ConfigurationException;
import com.gillianbc.wealthsim.model.Asset;
import com.gillianbc.wealthsim.model.AssetType;
import com.gillianbc.wealthsim.model.Assumptions;
import com.gillianbc.wealthsim.model.Scenario;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Draws every stochastic annual return a session will need, up front.
 * <p>
 * Each path gets its own {@link SplittableRandom} seeded from the session seed and the path
 * index, so the table is identical across processes and any path can be regenerated alone.
 * Within a path draws run year by year, then asset by asset in scenario order. An asset with
 * zero std draws exactly its mean without consuming randomness.
 */
@Slf4j
@Component
public class ReturnsGenerator {

    static final long PATH_SEED_STRIDE = 0x9E3779B97F4A7C15L;

    public DrawTable generate(Scenario scenario, int iterations, long seed) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be > 0");
        }
        Assumptions assumptions = scenario.getAssumptions();
        List<Asset> assets = scenario.getAssets();
        int years = assumptions.yearCount();
        int assetCount = assets.size();

        double[] means = new double[assetCount];
        double[] stds = new double[assetCount];
        List<String> ids = new ArrayList<>(assetCount);
        for (int a = 0; a < assetCount; a++) {
            means[a] = growthMean(assets.get(a), assumptions);
            stds[a] = growthStd(assets.get(a), assumptions);
            ids.add(assets.get(a).getId());
        }

        long size = (long) iterations * years * assetCount;
        if (size > SimulationProperties.DRAW_TABLE_HARD_LIMIT) {
            throw new ConfigurationException("iterations",
                    "a table of " + iterations + " x " + years + " x " + assetCount + " draws does not fit in one array");
        }

        long startNano = System.nanoTime();
        double[] values = new double[(int) size];
        int i = 0;
        for (int path = 0; path < iterations; path++) {
            SplittableRandom rng = new SplittableRandom(seedFor(seed, path));
            for (int year = 0; year < years; year++) {
                for (int a = 0; a < assetCount; a++) {
                    values[i++] = stds[a] == 0.0 ? means[a] : means[a] + stds[a] * rng.nextGaussian();
                }
            }
        }
        log.debug("Generated {} draws ({} paths x {} years x {} assets) in {} ms",
                values.length, iterations, years, assetCount, (System.nanoTime() - startNano) / 1_000_000);
        return new DrawTable(iterations, years, ids, values);
    }

    static long seedFor(long seed, int path) {
        return seed + PATH_SEED_STRIDE * (path + 1L);
    }

    public static double growthMean(Asset asset, Assumptions assumptions) {
        if (asset.getGrowthMean() != null) {
            return asset.getGrowthMean();
        }
        return asset.getType() == AssetType.CASH ? 0.0 : assumptions.getEquityReturnMean();
    }

    public static double growthStd(Asset asset, Assumptions assumptions) {
        if (asset.getGrowthStd() != null) {
            return asset.getGrowthStd();
        }
        return asset.getType() == AssetType.CASH ? 0.0 : assumptions.getEquityReturnStd();
    }
}
