package com.callrelay.signal.router;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.callrelay.signal.presence.storage.PresenceRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Forwards call lifecycle events to the live connection of their {@code to} user.
 *
 * <p>Only {@link CallEventKind#CALL} tells the sender when the recipient is offline,
 * with a {@code callee_unavailable} reply. Accept, reject and end events for an
 * offline recipient are dropped without notice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallSessionRouter {

    static final String CALLEE_UNAVAILABLE = "callee_unavailable";

    private final PresenceRegistry presenceRegistry;
    private final SignalMessenger messenger;

    public void route(CallEvent event, String originConnectionId) {
        String to = event.to();
        Optional<String> target = presenceRegistry.resolveLiveConnection(to);

        if (target.isPresent()) {
            messenger.sendToSession(target.get(), event.kind().getOutboundName(), event.payload());
            log.info("Forwarded {} from {} to {} (channel {})",
                    event.kind().getOutboundName(), event.from(), to, event.channel());
            return;
        }

        if (event.kind() == CallEventKind.CALL) {
            messenger.sendToSession(originConnectionId, CALLEE_UNAVAILABLE, Collections.singletonMap("to", to));
            log.info("Callee {} unavailable, notified caller {}", to, event.from());
        } else {
            log.debug("Dropped {} for offline user {}", event.kind().getInboundName(), to);
        }
    }

    public void call(Map<String, Object> payload, String originConnectionId) {
        route(new CallEvent(CallEventKind.CALL, payload), originConnectionId);
    }

    public void accept(Map<String, Object> payload, String originConnectionId) {
        route(new CallEvent(CallEventKind.ACCEPT, payload), originConnectionId);
    }

    public void reject(Map<String, Object> payload, String originConnectionId) {
        route(new CallEvent(CallEventKind.REJECT, payload), originConnectionId);
    }

    public void end(Map<String, Object> payload, String originConnectionId) {
        route(new CallEvent(CallEventKind.END, payload), originConnectionId);
    }
}
