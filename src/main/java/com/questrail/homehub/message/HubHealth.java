package com.questrail.homehub.message;

/**
 * Health indicators shown on the dashboard.
 *
 * @param mqtt     the sensor broker connection is up
 * @param database the last write to the reading store succeeded
 * @param wifi     the hub has network reachability
 */
public record HubHealth(boolean mqtt, boolean database, boolean wifi) {
}
