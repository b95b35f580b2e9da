package com.questrail.homehub.message;

/**
 * Value of the {@code type} field of every message sent to a viewer.
 */
public enum ViewerMessageType
{
    /** Full state, sent once right after the handshake. Flattened: no {@code data} wrapper. */
    INITIAL("initial", false),

    /** All cached readings, sent on every accepted telemetry update. */
    SENSORS("sensors", false),

    /** Online/offline status of all known sensors, sent on every transition. */
    SENSOR_STATUS("sensor_status", false),

    TRANSPORT("transport", true),
    WEATHER("weather", true),
    NAMEDAY("nameday", true),
    SYSTEM("system", true),

    /** Keep-alive for idle viewers. Carries no payload. */
    HEARTBEAT("heartbeat", false),

    TODOIST("todoist", true),
    CALENDAR("calendar", true);

    private final String wireName;
    private final boolean feed;

    ViewerMessageType(String wireName, boolean feed)
    {
        this.wireName = wireName;
        this.feed = feed;
    }

    public String wireName()
    {
        return wireName;
    }

    /**
     * Whether this type carries the payload of an external data feed.
     */
    public boolean isFeed()
    {
        return feed;
    }
}
