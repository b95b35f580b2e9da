package com.questrail.homehub.validation;

/**
 * Why a raw sensor message was dropped. Each constant names exactly one
 * violated constraint.
 */
public enum RejectReason
{
    /** Topic is not {@code pico/{property}/{sensor}}. */
    MALFORMED_TOPIC,

    /** Sensor id is missing, longer than 50 characters, or outside {@code [A-Za-z0-9_-]}. */
    INVALID_SENSOR_ID,

    /** Property segment is longer than 50 characters or outside {@code [A-Za-z0-9_-]}. */
    INVALID_PROPERTY_NAME,

    /** Property is well-formed but not one of the supported quantities. */
    UNKNOWN_PROPERTY,

    /** Payload does not parse as a decimal number. */
    NOT_A_NUMBER,

    /** Payload parses to NaN or an infinity. */
    NOT_FINITE,

    /** Value lies outside the property's realistic range. */
    OUT_OF_RANGE
}
