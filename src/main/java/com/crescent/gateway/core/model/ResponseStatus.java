package com.crescent.gateway.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResponseStatus {
    COMPLETED("completed"),
    IN_PROGRESS("in_progress"),
    INCOMPLETE("incomplete"),
    FAILED("failed");

    private final String code;

    ResponseStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ResponseStatus fromCode(String code) {
        if (code == null) {
            return COMPLETED;
        }
        for (ResponseStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        return COMPLETED;
    }
}
