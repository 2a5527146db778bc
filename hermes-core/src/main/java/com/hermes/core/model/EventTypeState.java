package com.hermes.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.hermes.core.exception.ValidationException;

/**
 * State an event type puts a host into.
 * A host with an outstanding {@link #REQUIRED} event needs follow-up work.
 */
public enum EventTypeState {
    REQUIRED("required"),
    READY("ready"),
    COMPLETED("completed");

    private final String value;

    EventTypeState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Check if this state demands follow-up work.
     */
    public boolean isRequired() {
        return this == REQUIRED;
    }

    /**
     * Parse a wire value.
     * 
     * @throws ValidationException if the value is not a known state
     */
    @JsonCreator
    public static EventTypeState fromValue(String value) {
        for (EventTypeState state : values()) {
            if (state.value.equals(value)) {
                return state;
            }
        }
        throw ValidationException.invalidArgument("state", value);
    }
}
