package org.caureq.hostwatch.service.alerts;

/** A check type is configured whose key has no evaluator. */
public class UnknownCheckKindException extends InvalidCheckConfigException {
    public UnknownCheckKindException(String checkKey) {
        super(checkKey, "no evaluator for check kind: " + checkKey);
    }
}
