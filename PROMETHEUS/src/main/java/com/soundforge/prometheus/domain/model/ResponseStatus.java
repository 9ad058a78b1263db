package com.soundforge.prometheus.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResponseStatus {
    ACTIVE("active"),
    INACTIVE("inactive");

    private final String label;

    ResponseStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public ResponseStatus toggled() {
        return this == ACTIVE ? INACTIVE : ACTIVE;
    }
}
