package com.questrail.homehub.validation;

import com.questrail.homehub.api.Reading;
import com.questrail.homehub.api.SensorProperty;
import com.questrail.homehub.internal.time.WallClock;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ReadingValidator
 * =============================================================================
 * Turns the raw {@code (sensor, property, payload)} triple of an MQTT message
 * into a {@link Reading}, or explains why it cannot.
 *
 * <h2>Checks, in order</h2>
 * <ol>
 *   <li>sensor id matches {@code [A-Za-z0-9_-]{1,50}}</li>
 *   <li>property name matches the same pattern</li>
 *   <li>property is one of {@link SensorProperty}</li>
 *   <li>payload parses as a decimal number</li>
 *   <li>the number is finite</li>
 *   <li>the number lies inside the property's range</li>
 * </ol>
 * The first failing check determines the {@link RejectReason}.
 *
 * <h2>Contract</h2>
 * Never throws for malformed input and has no side effects besides reading the
 * wall clock for the accepted reading's timestamp. Identifiers are pattern
 * restricted because they become keys in the reading store.
 */
public final class ReadingValidator {

    public static final int MAX_IDENTIFIER_LENGTH = 50;

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_-]{1," + MAX_IDENTIFIER_LENGTH + "}");

    // Plain decimal only: no type suffixes (21.5f, 21.5d) and no hex floats.
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Pattern NON_FINITE = Pattern.compile("([+-]?)(nan|inf|infinity)", Pattern.CASE_INSENSITIVE);

    private final WallClock wallClock;

    public ReadingValidator(WallClock wallClock) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public ValidationResult validate(String sensorId, String property, String rawValue) {
        if (!isIdentifier(sensorId)) {
            return new ValidationResult.Rejected(RejectReason.INVALID_SENSOR_ID,
                    "sensor id " + quote(sensorId) + " is not 1-50 of [A-Za-z0-9_-]");
        }
        if (!isIdentifier(property)) {
            return new ValidationResult.Rejected(RejectReason.INVALID_PROPERTY_NAME,
                    "property " + quote(property) + " is not 1-50 of [A-Za-z0-9_-]");
        }

        Optional<SensorProperty> known = SensorProperty.fromWireName(property);
        if (known.isEmpty()) {
            return new ValidationResult.Rejected(RejectReason.UNKNOWN_PROPERTY,
                    "property " + quote(property) + " is not supported");
        }
        SensorProperty prop = known.get();

        OptionalDouble parsed = parse(rawValue);
        if (parsed.isEmpty()) {
            return new ValidationResult.Rejected(RejectReason.NOT_A_NUMBER,
                    "payload " + quote(rawValue) + " is not a number");
        }
        double value = parsed.getAsDouble();

        if (!Double.isFinite(value)) {
            return new ValidationResult.Rejected(RejectReason.NOT_FINITE,
                    "payload " + quote(rawValue) + " is not finite");
        }
        if (!prop.accepts(value)) {
            return new ValidationResult.Rejected(RejectReason.OUT_OF_RANGE,
                    prop.wireName() + " value " + value + " outside ["
                            + prop.minValue() + ", " + prop.maxValue() + "]");
        }

        return new ValidationResult.Accepted(new Reading(sensorId, prop, value, wallClock.now()));
    }

    private static OptionalDouble parse(String rawValue) {
        if (rawValue == null) {
            return OptionalDouble.empty();
        }
        String text = rawValue.trim();

        Matcher nonFinite = NON_FINITE.matcher(text);
        if (nonFinite.matches()) {
            if (nonFinite.group(2).equalsIgnoreCase("nan")) {
                return OptionalDouble.of(Double.NaN);
            }
            return OptionalDouble.of("-".equals(nonFinite.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
        }
        if (!DECIMAL.matcher(text).matches()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static boolean isIdentifier(String candidate) {
        return candidate != null && IDENTIFIER.matcher(candidate).matches();
    }

    private static String quote(String s) {
        if (s == null) {
            return "<null>";
        }
        // Keep log lines bounded for hostile payloads.
        String shown = s.length() > 64 ? s.substring(0, 64) + "..." : s;
        return "'" + shown + "'";
    }
}
