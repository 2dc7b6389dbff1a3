package ringSettler;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import org.eclipse.jetty.websocket.api.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broadcasts every settlement plan to connected WebSocket clients.
 */
public final class SettlementFeedService {
    private static final Logger LOG = LoggerFactory.getLogger(SettlementFeedService.class);

    private final Set<Session> sessions = new CopyOnWriteArraySet<>();

    public void register(Session session) {
        sessions.add(session);
    }

    public void unregister(Session session) {
        sessions.remove(session);
    }

    public void broadcastSettlement(SettlementResult result) {
        Map<String, Object> payload = RingPayloadCodec.toJson(result);
        payload.put("type", "SETTLEMENT");
        String message = RingPayloadCodec.toJsonString(payload);
        for (Session session : sessions) {
            if (!session.isOpen()) {
                sessions.remove(session);
                continue;
            }
            try {
                session.getRemote().sendString(message);
            } catch (Exception ex) {
                LOG.warn("Failed to send settlement to session", ex);
            }
        }
    }
}
