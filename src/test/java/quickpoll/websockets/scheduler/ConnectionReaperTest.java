package quickpoll.websockets.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import quickpoll.websockets.websocket.Connection;
import quickpoll.websockets.websocket.ConnectionManager;
import quickpoll.websockets.websocket.FakeWebSocketSession;
import quickpoll.websockets.websocket.SubscriptionRegistry;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConnectionReaper Tests")
class ConnectionReaperTest {

    private SubscriptionRegistry registry;
    private ConnectionManager connectionManager;
    private ConnectionReaper reaper;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry();
        connectionManager = new ConnectionManager(registry, 1_000, 64 * 1024);
        reaper = new ConnectionReaper(registry, connectionManager);
    }

    @Test
    @DisplayName("Should evict connections whose transport closed silently")
    void shouldReapClosedConnections() {
        // Given
        FakeWebSocketSession alive = new FakeWebSocketSession();
        FakeWebSocketSession dead = new FakeWebSocketSession();
        Connection aliveConnection = connectionManager.connect(alive);
        Connection deadConnection = connectionManager.connect(dead);
        registry.subscribe(aliveConnection, 1);
        registry.subscribe(deadConnection, 1);
        dead.drop();

        // When
        int reaped = reaper.reap();

        // Then
        assertThat(reaped).isEqualTo(1);
        assertThat(registry.allConnections()).containsExactly(aliveConnection);
        assertThat(registry.subscribersOf(1)).containsExactly(aliveConnection);
    }

    @Test
    @DisplayName("Should leave open connections alone")
    void shouldNotReapOpenConnections() {
        // Given
        connectionManager.connect(new FakeWebSocketSession());
        connectionManager.connect(new FakeWebSocketSession());

        // When
        reaper.reapClosedConnections();

        // Then
        assertThat(registry.connectionCount()).isEqualTo(2);
    }
}
