package com.callrelay.signal.presence.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryPresenceRegistryTest {

    private InMemoryPresenceRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryPresenceRegistry();
    }

    @Test
    void register_repeatedForSameUser_lastWriteWins() {
        registry.register("doctor", "c1");
        registry.register("doctor", "c2");
        registry.register("doctor", "c3");

        assertEquals(Optional.of("c3"), registry.resolveLiveConnection("doctor"));
    }

    @Test
    void register_blankUserOrConnection_isIgnored() {
        registry.register("", "c1");
        registry.register(null, "c1");
        registry.register("doctor", " ");

        assertTrue(registry.find("").isEmpty());
        assertTrue(registry.find("doctor").isEmpty());
        assertTrue(registry.clearLiveConnection("c1").isEmpty());
    }

    @Test
    void registerNotificationAddress_createsRecordWithoutLiveConnection() {
        registry.registerNotificationAddress("patient", "ExponentPushToken[abc]");

        assertEquals(Optional.of("ExponentPushToken[abc]"), registry.resolveNotificationAddress("patient"));
        assertTrue(registry.resolveLiveConnection("patient").isEmpty());
    }

    @Test
    void registerNotificationAddress_missingArgument_isIgnored() {
        registry.registerNotificationAddress("patient", "");
        registry.registerNotificationAddress(null, "token");

        assertTrue(registry.find("patient").isEmpty());
    }

    @Test
    void clearLiveConnection_keepsNotificationAddress() {
        registry.register("patient", "c2");
        registry.registerNotificationAddress("patient", "token-1");

        assertEquals(Optional.of("patient"), registry.clearLiveConnection("c2"));

        assertTrue(registry.resolveLiveConnection("patient").isEmpty());
        assertEquals(Optional.of("token-1"), registry.resolveNotificationAddress("patient"));
    }

    @Test
    void clearLiveConnection_withoutAddress_dropsRecord() {
        registry.register("doctor", "c1");

        registry.clearLiveConnection("c1");

        assertTrue(registry.find("doctor").isEmpty());
    }

    @Test
    void clearLiveConnection_staleConnection_doesNotClobberNewerRegistration() {
        registry.register("doctor", "old");
        registry.register("doctor", "new");

        assertTrue(registry.clearLiveConnection("old").isEmpty());

        assertEquals(Optional.of("new"), registry.resolveLiveConnection("doctor"));
    }

    @Test
    void clearLiveConnection_unregisteredConnection_isNoOp() {
        registry.register("doctor", "c1");

        assertTrue(registry.clearLiveConnection("never-registered").isEmpty());
        assertEquals(Optional.of("c1"), registry.resolveLiveConnection("doctor"));
    }

    @Test
    void clearLiveConnection_calledTwice_secondCallIsNoOp() {
        registry.register("doctor", "c1");

        assertEquals(Optional.of("doctor"), registry.clearLiveConnection("c1"));
        assertTrue(registry.clearLiveConnection("c1").isEmpty());
    }

    @Test
    void register_sameConnectionAsAnotherUser_releasesPreviousUser() {
        registry.register("alice", "c1");
        registry.register("bob", "c1");

        assertTrue(registry.resolveLiveConnection("alice").isEmpty());
        assertEquals(Optional.of("c1"), registry.resolveLiveConnection("bob"));

        registry.clearLiveConnection("c1");
        assertTrue(registry.resolveLiveConnection("bob").isEmpty());
    }

    @Test
    void resolve_unknownUser_isEmpty() {
        assertTrue(registry.resolveLiveConnection("ghost").isEmpty());
        assertTrue(registry.resolveNotificationAddress("ghost").isEmpty());
        assertTrue(registry.resolveLiveConnection(null).isEmpty());
    }

    @Nested
    class Concurrency {

        private ExecutorService executor;

        @BeforeEach
        void startExecutor() {
            executor = Executors.newFixedThreadPool(2);
        }

        @AfterEach
        void stopExecutor() {
            executor.shutdownNow();
        }

        @Test
        void reconnectRacingStaleDisconnect_alwaysKeepsNewestConnection() throws Exception {
            registry.register("doctor", "c0");

            for (int i = 1; i <= 500; i++) {
                String fresh = "c" + i;
                String stale = "c" + (i - 1);
                CountDownLatch start = new CountDownLatch(1);

                Future<?> reconnect = executor.submit(() -> {
                    await(start);
                    registry.register("doctor", fresh);
                });
                Future<?> disconnect = executor.submit(() -> {
                    await(start);
                    registry.clearLiveConnection(stale);
                });

                start.countDown();
                reconnect.get(5, TimeUnit.SECONDS);
                disconnect.get(5, TimeUnit.SECONDS);

                assertEquals(Optional.of(fresh), registry.resolveLiveConnection("doctor"));
            }
        }

        @Test
        void registerRacingOwnDisconnect_neverLeavesUnreachableLiveConnection() throws Exception {
            for (int i = 1; i <= 500; i++) {
                String connection = "s" + i;
                CountDownLatch start = new CountDownLatch(1);

                Future<?> register = executor.submit(() -> {
                    await(start);
                    registry.register("patient", connection);
                });
                Future<?> disconnect = executor.submit(() -> {
                    await(start);
                    registry.clearLiveConnection(connection);
                });

                start.countDown();
                register.get(5, TimeUnit.SECONDS);
                disconnect.get(5, TimeUnit.SECONDS);

                // a live connection must always be clearable through its back-reference
                registry.clearLiveConnection(connection);
                assertEquals(Optional.empty(), registry.resolveLiveConnection("patient"));
            }
        }

        private void await(CountDownLatch latch) {
            try {
                latch.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
