package com.signalrelay.validation;

import com.signalrelay.api.dto.request.TradingViewAlertRequest;
import com.signalrelay.domain.enums.TradeSignal;
import com.signalrelay.domain.model.SignalEvent;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DatabindException;
import tools.jackson.databind.ObjectMapper;

/**
 * Turns an authenticated webhook body into a {@link SignalEvent}.
 *
 * <p>Three passes, each of which can only add errors:
 * <ol>
 *   <li>Jackson binding: a body that is not JSON is reported against {@code body}, a value of
 *       the wrong JSON type against its own field</li>
 *   <li>Bean Validation on {@link TradingViewAlertRequest}: presence, ticker length,
 *       exact "Buy"/"Sell", positive price, chart URL scheme</li>
 *   <li>Checks Bean Validation cannot express: finite price still positive after rounding,
 *       parseable ISO-8601 time</li>
 * </ol>
 *
 * <p>Normalization on success: ticker trimmed and upper-cased, price rounded to 8 decimals.
 * The signal is never normalized.
 */
@Component
public class SignalPayloadValidator {

    private static final int PRICE_SCALE = 8;

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public SignalPayloadValidator(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public PayloadValidationResult validate(byte[] body) {
        if (body == null || body.length == 0) {
            return PayloadValidationResult.rejected("body", "Request body is empty");
        }

        TradingViewAlertRequest request;
        try {
            request = objectMapper.readValue(body, TradingViewAlertRequest.class);
        } catch (DatabindException e) {
            return PayloadValidationResult.rejected(fieldOf(e), "Invalid value type");
        } catch (JacksonException e) {
            return PayloadValidationResult.rejected("body", "Malformed JSON payload");
        }
        if (request == null) {
            return PayloadValidationResult.rejected("body", "Payload must be a JSON object");
        }

        // Sorted so the error listing is stable across runs
        Map<String, String> errors = new TreeMap<>();
        for (ConstraintViolation<TradingViewAlertRequest> violation : validator.validate(request)) {
            errors.putIfAbsent(violation.getPropertyPath().toString(), violation.getMessage());
        }

        BigDecimal price = null;
        if (request.getPrice() != null) {
            if (!Double.isFinite(request.getPrice())) {
                errors.putIfAbsent("price", "Price must be a finite number");
            } else {
                price = roundPrice(request.getPrice());
                if (price.signum() <= 0) {
                    // 1e-9 passes @Positive but rounds to zero at 8 decimals
                    errors.putIfAbsent("price", "Price must be positive");
                }
            }
        }

        Instant timestamp = null;
        if (request.getTime() != null && !request.getTime().isBlank()) {
            timestamp = parseTimestamp(request.getTime());
            if (timestamp == null) {
                errors.putIfAbsent("time", "Time must be an ISO-8601 timestamp");
            }
        }

        if (!errors.isEmpty()) {
            return PayloadValidationResult.rejected(errors);
        }

        SignalEvent event = SignalEvent.builder()
                .ticker(request.getTicker().trim().toUpperCase(Locale.ROOT))
                .signal(TradeSignal.fromLabel(request.getSignal()).orElseThrow())
                .price(price)
                .time(request.getTime().trim())
                .timestamp(timestamp)
                .interval(blankToNull(request.getInterval()))
                .chart(blankToNull(request.getChart()))
                .build();
        return PayloadValidationResult.valid(event);
    }

    private static BigDecimal roundPrice(double raw) {
        return BigDecimal.valueOf(raw).setScale(PRICE_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
    }

    /**
     * Parses an ISO-8601 date-time. An explicit offset or zone is honored; a bare local
     * date-time is read as UTC.
     *
     * @return the instant, or null if the text is not an ISO-8601 date-time
     */
    static Instant parseTimestamp(String raw) {
        try {
            TemporalAccessor parsed =
                    DateTimeFormatter.ISO_DATE_TIME.parseBest(raw.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private String fieldOf(DatabindException e) {
        List<JacksonException.Reference> path = e.getPath();
        if (path == null || path.isEmpty() || path.get(0).getPropertyName() == null) {
            return "body";
        }
        return path.get(0).getPropertyName();
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
