package com.gillianbc.wealthsim.exception;

import lombok.Getter;

/**
 * Thrown before any simulation runs when a scenario, policy or tax table is malformed.
 * {@link #getField()} names the offending field, e.g. {@code assets[isa-1].growthStd}.
 */
@Getter
public class ConfigurationException extends EngineException {

    private final String field;

    public ConfigurationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }
}
