package com.signalrelay.validation;

import com.signalrelay.domain.model.SignalEvent;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Outcome of validating a webhook body.
 *
 * <p>Either VALID (event set, no errors) or REJECTED (no event, one entry per offending
 * field). All violations are reported together, not just the first.
 */
@Getter
public class PayloadValidationResult {

    private final SignalEvent event;
    private final Map<String, String> errors;

    private PayloadValidationResult(SignalEvent event, Map<String, String> errors) {
        this.event = event;
        this.errors = errors;
    }

    public static PayloadValidationResult valid(SignalEvent event) {
        return new PayloadValidationResult(event, Collections.emptyMap());
    }

    public static PayloadValidationResult rejected(Map<String, String> errors) {
        return new PayloadValidationResult(null, Collections.unmodifiableMap(new LinkedHashMap<>(errors)));
    }

    public static PayloadValidationResult rejected(String field, String message) {
        return rejected(Map.of(field, message));
    }

    public boolean isValid() {
        return event != null;
    }

    public boolean isRejected() {
        return event == null;
    }
}
