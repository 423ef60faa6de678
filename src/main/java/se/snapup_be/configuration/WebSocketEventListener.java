package se.snapup_be.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

/**
 * Connection bookkeeping only. Clients resync through {@code /app/sync.resync} after a
 * reconnect; nothing missed while disconnected is replayed from here.
 */
@Component
@Slf4j
public class WebSocketEventListener {

    @EventListener
    public void handleWebSocketConnectListener(SessionConnectedEvent event) {
        Principal user = event.getUser();
        log.info("Web socket connected: {}", user != null ? user.getName() : "anonymous");
    }

    @EventListener
    public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
        StompHeaderAccessor headerAccessor = StompHeaderAccessor.wrap(event.getMessage());
        Principal user = headerAccessor.getUser();
        log.info("Web socket {} disconnected ({}), client must resync on reconnect",
                event.getSessionId(), user != null ? user.getName() : "anonymous");
    }
}
