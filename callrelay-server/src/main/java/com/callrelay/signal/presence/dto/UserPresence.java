package com.callrelay.signal.presence.dto;

import java.util.Objects;
import java.util.Optional;

public record UserPresence(
        String userId,
        String liveConnection,
        String notificationAddress
) {

    public static UserPresence empty(String userId) {
        return new UserPresence(userId, null, null);
    }

    public UserPresence withLiveConnection(String connectionId) {
        return new UserPresence(userId, connectionId, notificationAddress);
    }

    public UserPresence withNotificationAddress(String address) {
        return new UserPresence(userId, liveConnection, address);
    }

    public boolean isHeldBy(String connectionId) {
        return Objects.equals(liveConnection, connectionId);
    }

    /** Nothing left worth keeping: offline and no push address on file. */
    public boolean isVacant() {
        return liveConnection == null && notificationAddress == null;
    }

    public Optional<String> liveConnectionIfPresent() {
        return Optional.ofNullable(liveConnection);
    }

    public Optional<String> notificationAddressIfPresent() {
        return Optional.ofNullable(notificationAddress);
    }
}
