package com.callrelay.signal.presence.storage;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.stereotype.Component;

import com.callrelay.signal.presence.dto.UserPresence;

/**
 * 인메모리 기반 PresenceRegistry 구현체.
 * 단일 인스턴스 환경에 적합합니다.
 */
@Component
public class InMemoryPresenceRegistry implements PresenceRegistry {

    // userId -> presence
    private final Map<String, UserPresence> presences = new ConcurrentHashMap<>();

    // connectionId -> userId
    private final Map<String, String> connectionToUser = new ConcurrentHashMap<>();

    @Override
    public void register(String userId, String connectionId) {
        if (isBlank(userId) || isBlank(connectionId)) return;

        // connectionToUser -> presences, the only lock order used
        connectionToUser.compute(connectionId, (conn, previousUser) -> {
            if (previousUser != null && !previousUser.equals(userId)) {
                release(previousUser, conn);
            }
            presences.compute(userId, (id, current) ->
                    (current == null ? UserPresence.empty(id) : current).withLiveConnection(conn));
            return userId;
        });
    }

    @Override
    public void registerNotificationAddress(String userId, String address) {
        if (isBlank(userId) || isBlank(address)) return;

        presences.compute(userId, (id, current) ->
                (current == null ? UserPresence.empty(id) : current).withNotificationAddress(address));
    }

    @Override
    public Optional<String> resolveLiveConnection(String userId) {
        return find(userId).flatMap(UserPresence::liveConnectionIfPresent);
    }

    @Override
    public Optional<String> resolveNotificationAddress(String userId) {
        return find(userId).flatMap(UserPresence::notificationAddressIfPresent);
    }

    @Override
    public Optional<String> clearLiveConnection(String connectionId) {
        if (isBlank(connectionId)) return Optional.empty();

        AtomicReference<String> clearedUser = new AtomicReference<>();
        connectionToUser.computeIfPresent(connectionId, (conn, userId) -> {
            if (release(userId, conn)) {
                clearedUser.set(userId);
            }
            return null;
        });
        return Optional.ofNullable(clearedUser.get());
    }

    @Override
    public Optional<UserPresence> find(String userId) {
        if (userId == null) return Optional.empty();
        return Optional.ofNullable(presences.get(userId));
    }

    private boolean release(String userId, String connectionId) {
        AtomicBoolean cleared = new AtomicBoolean(false);
        presences.computeIfPresent(userId, (id, current) -> {
            if (!current.isHeldBy(connectionId)) {
                return current;
            }
            cleared.set(true);
            UserPresence offline = current.withLiveConnection(null);
            return offline.isVacant() ? null : offline;
        });
        return cleared.get();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
