package com.questrail.homehub.broadcast;

import java.util.Objects;

/**
 * Outcome of {@link BroadcastHub#connect(ViewerConnection)}.
 */
public sealed interface ConnectResult permits ConnectResult.Accepted, ConnectResult.Rejected
{
    boolean isAccepted();

    record Accepted(int active) implements ConnectResult {
        @Override
        public boolean isAccepted() {
            return true;
        }
    }

    record Rejected(String reason) implements ConnectResult {
        public Rejected {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isAccepted() {
            return false;
        }
    }
}
