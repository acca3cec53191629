package com.gillianbc.wealthsim.engine;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * Pre-generated annual returns, one per (path, year, asset), stored flat in path-major order.
 * Immutable once built: recalculations read the same table the session was created with.
 */
public final class DrawTable {

    @Getter private final int iterations;
    @Getter private final int years;
    @Getter private final List<String> assetIds;
    private final double[] values;

    DrawTable(int iterations, int years, List<String> assetIds, double[] values) {
        Objects.requireNonNull(assetIds, "assetIds must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (values.length != (long) iterations * years * assetIds.size()) {
            throw new IllegalArgumentException("values has " + values.length + " entries, expected "
                    + (long) iterations * years * assetIds.size());
        }
        this.iterations = iterations;
        this.years = years;
        this.assetIds = List.copyOf(assetIds);
        this.values = values;
    }

    public double draw(int path, int year, int asset) {
        return values[index(path, year, asset)];
    }

    public double draw(int path, int year, String assetId) {
        int asset = assetIds.indexOf(assetId);
        if (asset < 0) {
            throw new IllegalArgumentException("Unknown asset id " + assetId);
        }
        return draw(path, year, asset);
    }

    int index(int path, int year, int asset) {
        return (path * years + year) * assetIds.size() + asset;
    }
}
