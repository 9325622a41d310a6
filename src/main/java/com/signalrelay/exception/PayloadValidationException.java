package com.signalrelay.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when an authenticated payload fails schema validation.
 * The details map carries one entry per offending field.
 */
public class PayloadValidationException extends BaseException {

    public PayloadValidationException(Map<String, String> fieldErrors) {
        super(ErrorCode.VALIDATION_ERROR, "Invalid webhook data", new LinkedHashMap<>(fieldErrors));
    }
}
