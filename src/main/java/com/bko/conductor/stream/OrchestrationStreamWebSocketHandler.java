package com.bko.conductor.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;

/**
 * Server-push endpoint: {@code /ws/stream?runId=...&since=...}. Buffered events newer than {@code since}
 * are replayed on connect, then live events follow.
 */
@Component
public class OrchestrationStreamWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(OrchestrationStreamWebSocketHandler.class);

    private final OrchestrationStreamHub hub;

    public OrchestrationStreamWebSocketHandler(OrchestrationStreamHub hub) {
        this.hub = hub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        URI uri = session.getUri();
        if (uri == null) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        String runId = params.getFirst("runId");
        if (!StringUtils.hasText(runId)) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        if (!hub.hasRun(runId)) {
            log.debug("Stream requested for unknown run {}", runId);
        }
        hub.registerSession(runId, session, sinceId(params.getFirst("since")));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // Clients only listen; control goes through the REST API.
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.removeSession(session);
    }

    static long sinceId(String value) {
        if (!StringUtils.hasText(value)) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(value.trim()));
        } catch (NumberFormatException ex) {
            log.debug("Ignoring invalid since parameter {}", value);
            return 0L;
        }
    }
}
