package org.caureq.hostwatch.service.alerts;

/** Check parameters that cannot be parsed or are out of range. */
public class InvalidCheckConfigException extends RuntimeException {
    private final String checkKey;

    public InvalidCheckConfigException(String checkKey, String message) {
        super(message);
        this.checkKey = checkKey;
    }

    public InvalidCheckConfigException(String checkKey, String message, Throwable cause) {
        super(message, cause);
        this.checkKey = checkKey;
    }

    public String checkKey() { return checkKey; }
}
