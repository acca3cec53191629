package com.gillianbc.wealthsim.exception;

import lombok.Getter;

/**
 * A NaN or infinite value appeared mid-simulation. Fatal for the whole run: it points at a
 * configuration or engine defect, not at a valid random outcome.
 */
@Getter
public class NumericException extends EngineException {

    private final int path;
    private final int year;
    private final String metric;

    public NumericException(int path, int year, String metric, double value) {
        super("Non-finite value " + value + " for " + metric + " in year " + year + " of path " + path);
        this.path = path;
        this.year = year;
        this.metric = metric;
    }
}
