package com.questrail.homehub.api;

import java.util.Arrays;
import java.util.Optional;

/**
 * SensorProperty
 * -----------------------------------------------------------------------------
 * The closed set of physical quantities a sensor may report.
 *
 * <h2>Wire names</h2>
 * Each constant carries the lowercase name used in the MQTT topic
 * ({@code pico/{property}/{sensor}}) and in the {@code prop} field of
 * viewer messages.
 *
 * <h2>Realistic ranges</h2>
 * Bounds are inclusive and describe what a household sensor can plausibly
 * measure. A value outside them is a sensor fault or a forged message, never a
 * legitimate reading, so it is rejected before it reaches the cache.
 */
public enum SensorProperty
{
    /** Degrees Celsius. */
    TEMPERATURE("temperature", -50.0, 100.0),

    /** Relative humidity, percent. */
    HUMIDITY("humidity", 0.0, 100.0),

    /** Barometric pressure, hPa. */
    PRESSURE("pressure", 800.0, 1200.0);

    private final String wireName;
    private final double minValue;
    private final double maxValue;

    SensorProperty(String wireName, double minValue, double maxValue)
    {
        this.wireName = wireName;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public String wireName()
    {
        return wireName;
    }

    public double minValue()
    {
        return minValue;
    }

    public double maxValue()
    {
        return maxValue;
    }

    /**
     * Whether {@code value} lies within this property's inclusive range.
     */
    public boolean accepts(double value)
    {
        return value >= minValue && value <= maxValue;
    }

    /**
     * Look up a property by its wire name (case-sensitive).
     */
    public static Optional<SensorProperty> fromWireName(String wireName)
    {
        return Arrays.stream(values())
                .filter(p -> p.wireName.equals(wireName))
                .findFirst();
    }
}
