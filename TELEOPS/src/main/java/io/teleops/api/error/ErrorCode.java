package io.teleops.api.error;

public enum ErrorCode {
    BAD_REQUEST, VALIDATION_FAILED, INCIDENT_NOT_FOUND, INVALID_RULE_TABLE, INTERNAL_ERROR
}
