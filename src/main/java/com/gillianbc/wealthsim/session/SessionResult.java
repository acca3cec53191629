package com.gillianbc.wealthsim.session;

import com.gillianbc.wealthsim.aggregate.AggregatedResult;

public record SessionResult(String sessionId, AggregatedResult result) {
}
