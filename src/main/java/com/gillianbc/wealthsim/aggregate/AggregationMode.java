package com.gillianbc.wealthsim.aggregate;

public enum AggregationMode {
    /** Nearest-rank percentile of the value across paths. */
    PERCENTILE,
    /** Share of paths where the flag is set, 0..100. */
    PERCENT_TRUE
}
