package org.caureq.hostwatch.api.error;
public enum ErrorCode {
    BAD_REQUEST, NOT_FOUND, INVALID_CHECK_CONFIG, CONFLICT,
    AUTH_REQUIRED, FORBIDDEN, INTERNAL_ERROR
}
