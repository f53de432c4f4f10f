package com.callrelay.signal.router;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.util.Collections;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.callrelay.signal.presence.storage.InMemoryPresenceRegistry;

class CallSessionRouterTest {

    private InMemoryPresenceRegistry registry;
    private SignalMessenger messenger;
    private CallSessionRouter router;

    @BeforeEach
    void setUp() {
        registry = new InMemoryPresenceRegistry();
        messenger = mock(SignalMessenger.class);
        router = new CallSessionRouter(registry, messenger);
    }

    @Test
    void call_registeredCallee_forwardsPayloadOnceAndDoesNotReplyToCaller() {
        registry.register("doctor", "c1");
        Map<String, Object> payload = Map.of("to", "doctor", "from", "patient", "channel", "room1", "callerUid", 42);

        router.call(payload, "c2");

        verify(messenger, times(1)).sendToSession("c1", "incoming_call", payload);
        verify(messenger, never()).sendToSession(eq("c2"), anyString(), any());
    }

    @Test
    void call_unregisteredCallee_repliesCalleeUnavailableOnlyToCaller() {
        router.call(Map.of("to", "doctor", "from", "patient", "channel", "room1"), "c2");

        verify(messenger, times(1)).sendToSession("c2", "callee_unavailable", Collections.singletonMap("to", "doctor"));
        verifyNoMoreInteractions(messenger);
    }

    @Test
    void call_withoutTo_repliesCalleeUnavailableWithNullTarget() {
        router.call(Map.of("from", "patient"), "c2");

        verify(messenger).sendToSession("c2", "callee_unavailable", Collections.singletonMap("to", null));
    }

    @Test
    void accept_registeredCaller_forwardsAsCallAccepted() {
        registry.register("patient", "c2");
        Map<String, Object> payload = Map.of("to", "patient", "from", "doctor", "channel", "room1", "calleeUid", 7);

        router.accept(payload, "c1");

        verify(messenger).sendToSession("c2", "call_accepted", payload);
        verifyNoMoreInteractions(messenger);
    }

    @Test
    void reject_registeredCaller_forwardsAsCallRejected() {
        registry.register("patient", "c2");
        Map<String, Object> payload = Map.of("to", "patient", "from", "doctor");

        router.reject(payload, "c1");

        verify(messenger).sendToSession("c2", "call_rejected", payload);
    }

    @Test
    void end_registeredPeer_forwardsAsEndCall() {
        registry.register("doctor", "c1");
        Map<String, Object> payload = Map.of("to", "doctor", "from", "patient");

        router.end(payload, "c2");

        verify(messenger).sendToSession("c1", "end_call", payload);
    }

    @Test
    void acceptRejectEnd_offlineRecipient_areDroppedSilently() {
        router.accept(Map.of("to", "patient", "from", "doctor"), "c1");
        router.reject(Map.of("to", "patient", "from", "doctor"), "c1");
        router.end(Map.of("to", "patient", "from", "doctor"), "c1");

        verifyNoInteractions(messenger);
    }

    @Test
    void route_targetsMostRecentConnection() {
        registry.register("doctor", "c1");
        registry.register("doctor", "c3");

        router.call(Map.of("to", "doctor", "from", "patient"), "c2");

        verify(messenger).sendToSession(eq("c3"), eq("incoming_call"), any());
        verify(messenger, never()).sendToSession(eq("c1"), anyString(), any());
    }

    @Test
    void callEvent_keepsPayloadFieldsUntouched() {
        Map<String, Object> payload = Map.of("to", "doctor", "from", "patient", "channel", "room1", "extra", true);

        CallEvent event = new CallEvent(CallEventKind.CALL, payload);

        assertEquals(payload, event.payload());
        assertEquals("doctor", event.to());
        assertEquals("room1", event.channel());
    }
}
