package quickpoll.websockets.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import jakarta.annotation.PreDestroy;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delivers events to connections.
 *
 * Each call works on a registry snapshot taken when it starts. Sends run in
 * parallel on a sender pool and the call waits at most the send time limit
 * for all of them. A connection whose send fails or is still blocked at the
 * deadline is evicted; the remaining connections still get the event.
 * Nothing is retried or buffered beyond the per-connection send limits.
 */
@Component
public class MessageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    private final SubscriptionRegistry registry;
    private final ConnectionManager connectionManager;
    private final ObjectMapper objectMapper;
    private final Counter evictionsCounter;
    private final ExecutorService sendExecutor;

    public MessageDispatcher(
            SubscriptionRegistry registry,
            ConnectionManager connectionManager,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry
    ) {
        this.registry = registry;
        this.connectionManager = connectionManager;
        this.objectMapper = objectMapper;
        this.evictionsCounter = Counter.builder("quickpoll.websocket.evictions")
                .description("Connections evicted after a failed send")
                .register(meterRegistry);

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("ws-send-");
        threadFactory.setDaemon(true);
        this.sendExecutor = Executors.newCachedThreadPool(threadFactory);
    }

    @PreDestroy
    public void shutdown() {
        sendExecutor.shutdownNow();
    }

    /**
     * @return number of connections the event was delivered to
     */
    public int broadcastToTopic(long pollId, PollEvent event) {
        int delivered = deliver(registry.subscribersOf(pollId), event);
        log.debug("Broadcast {} for poll {} to {} subscriber(s)", event.type().getValue(), pollId, delivered);
        return delivered;
    }

    /**
     * @return number of connections the event was delivered to
     */
    public int broadcastToAll(PollEvent event) {
        int delivered = deliver(registry.allConnections(), event);
        log.debug("Broadcast {} to {} connection(s)", event.type().getValue(), delivered);
        return delivered;
    }

    /**
     * @return true if the event was delivered
     */
    public boolean sendDirect(Connection connection, PollEvent event) {
        return deliver(List.of(connection), event) == 1;
    }

    private int deliver(Collection<Connection> targets, PollEvent event) {
        if (targets.isEmpty()) {
            return 0;
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event, nothing sent", event.type().getValue(), e);
            return 0;
        }

        Map<Connection, Future<?>> sends = new LinkedHashMap<>();
        for (Connection connection : targets) {
            sends.put(connection, sendExecutor.submit(() -> {
                connection.send(payload);
                return null;
            }));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(connectionManager.sendTimeLimitMs());
        int delivered = 0;
        List<Connection> failed = new ArrayList<>();
        for (Map.Entry<Connection, Future<?>> send : sends.entrySet()) {
            Connection connection = send.getKey();
            try {
                send.getValue().get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                delivered++;
            } catch (TimeoutException e) {
                log.warn("Send of {} to {} exceeded {} ms, evicting",
                        event.type().getValue(), connection, connectionManager.sendTimeLimitMs());
                send.getValue().cancel(true);
                failed.add(connection);
            } catch (ExecutionException e) {
                log.warn("Send of {} to {} failed, evicting: {}",
                        event.type().getValue(), connection, e.getCause().toString());
                failed.add(connection);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while delivering {}, {} send(s) left unconfirmed",
                        event.type().getValue(), sends.size() - delivered - failed.size());
                break;
            }
        }

        for (Connection connection : failed) {
            if (connectionManager.disconnect(connection, CloseStatus.SESSION_NOT_RELIABLE)) {
                evictionsCounter.increment();
            }
        }
        return delivered;
    }
}
