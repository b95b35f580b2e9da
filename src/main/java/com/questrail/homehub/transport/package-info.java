/**
 * Sensor Transport Port
 * =============================================================================
 *
 * Framework-agnostic boundary between the MQTT client library and the
 * ingestion path.
 *
 * <p>Everything above the adapter sees only topic strings, raw payloads as
 * {@code byte[]} and up/down notifications. Paho types stay inside
 * {@code transport.mqtt}.</p>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Perform transport I/O only (no payload interpretation)</li>
 *   <li>Not touch live state, storage, or viewers</li>
 *   <li>Own reconnect and re-subscribe behavior</li>
 * </ul>
 */
package com.questrail.homehub.transport;
