package com.callrelay.signal.presence.storage;

import java.util.Optional;

import com.callrelay.signal.presence.dto.UserPresence;

/**
 * Maps user identities to their live connection and push address.
 * Every operation is atomic with respect to the others.
 */
public interface PresenceRegistry {

    void register(String userId, String connectionId);

    void registerNotificationAddress(String userId, String address);

    Optional<String> resolveLiveConnection(String userId);

    Optional<String> resolveNotificationAddress(String userId);

    /**
     * Clears the live connection of the user this connection registered as,
     * only while the registry still points at this connection.
     *
     * @return the user whose entry was cleared, empty if nothing changed
     */
    Optional<String> clearLiveConnection(String connectionId);

    Optional<UserPresence> find(String userId);
}
