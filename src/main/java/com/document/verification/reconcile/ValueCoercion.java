package com.document.verification.reconcile;

import com.document.verification.scoring.Scores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.OptionalDouble;

/**
 * Lenient conversion of untrusted field values and confidences.
 * Every method returns a safe default instead of throwing.
 */
public final class ValueCoercion {
    private static final Logger log = LoggerFactory.getLogger(ValueCoercion.class);

    private static final double MAX_EXACT_LONG = 1e15;

    private ValueCoercion() {
    }

    /**
     * Converts a field value to text. Absent and malformed values become {@code ""}.
     * Whole numbers print without a fractional part.
     */
    public static String asText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        if (value instanceof Boolean || value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Number number) {
            return numberToText(number);
        }
        log.debug("field.malformed valueType={} reason=not-a-scalar", value.getClass().getSimpleName());
        return "";
    }

    /**
     * Parses a confidence percentage. Unparseable or non-finite values yield 0;
     * the result is clamped into [0, 100].
     */
    public static double asConfidence(Object value) {
        return Scores.clamp(tryParseDouble(value).orElse(0.0));
    }

    /**
     * Parses a finite number from a {@link Number} or a numeric string.
     */
    public static OptionalDouble tryParseDouble(Object value) {
        double parsed;
        if (value instanceof Number number) {
            parsed = number.doubleValue();
        } else if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (trimmed.isEmpty()) {
                return OptionalDouble.empty();
            }
            try {
                parsed = Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                log.debug("field.malformed value='{}' reason=not-numeric", trimmed);
                return OptionalDouble.empty();
            }
        } else {
            if (value != null) {
                log.debug("field.malformed valueType={} reason=not-numeric", value.getClass().getSimpleName());
            }
            return OptionalDouble.empty();
        }

        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(parsed);
    }

    private static String numberToText(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte || number instanceof BigInteger) {
            return number.toString();
        }
        if (number instanceof BigDecimal decimal) {
            return decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
        }
        double d = number.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            log.debug("field.malformed value={} reason=non-finite", d);
            return "";
        }
        if (d == Math.rint(d) && Math.abs(d) < MAX_EXACT_LONG) {
            return Long.toString((long) d);
        }
        return BigDecimal.valueOf(d).toPlainString();
    }
}
