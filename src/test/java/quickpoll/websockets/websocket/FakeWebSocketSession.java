package quickpoll.websockets.websocket;

import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketExtension;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.security.Principal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * In-memory session that records outbound text frames and can be told to fail
 * or stall sends. A stalled send is released when the session is closed.
 */
public class FakeWebSocketSession implements WebSocketSession {

    private final String id;
    private final List<String> sentPayloads = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, Object> attributes = new HashMap<>();
    private volatile boolean open = true;
    private volatile boolean failSends;
    private volatile boolean blockSends;
    private final CountDownLatch sendStarted = new CountDownLatch(1);
    private final CountDownLatch released = new CountDownLatch(1);
    private volatile CloseStatus closeStatus;

    public FakeWebSocketSession() {
        this(UUID.randomUUID().toString());
    }

    public FakeWebSocketSession(String id) {
        this.id = id;
    }

    public List<String> sentPayloads() {
        synchronized (sentPayloads) {
            return List.copyOf(sentPayloads);
        }
    }

    public void failSends() {
        this.failSends = true;
    }

    /**
     * Makes every send block until the session is closed, as with a peer that stopped reading.
     */
    public void blockSends() {
        this.blockSends = true;
    }

    public boolean awaitBlockedSend(long timeout, TimeUnit unit) throws InterruptedException {
        return sendStarted.await(timeout, unit);
    }

    /**
     * Simulates the peer going away without a close callback.
     */
    public void drop() {
        this.open = false;
    }

    public CloseStatus closeStatus() {
        return closeStatus;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public URI getUri() {
        return URI.create("ws://localhost/ws");
    }

    @Override
    public HttpHeaders getHandshakeHeaders() {
        return new HttpHeaders();
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public Principal getPrincipal() {
        return null;
    }

    @Override
    public InetSocketAddress getLocalAddress() {
        return new InetSocketAddress("localhost", 8000);
    }

    @Override
    public InetSocketAddress getRemoteAddress() {
        return new InetSocketAddress("localhost", 50000);
    }

    @Override
    public String getAcceptedProtocol() {
        return null;
    }

    @Override
    public void setTextMessageSizeLimit(int messageSizeLimit) {
    }

    @Override
    public int getTextMessageSizeLimit() {
        return 8192;
    }

    @Override
    public void setBinaryMessageSizeLimit(int messageSizeLimit) {
    }

    @Override
    public int getBinaryMessageSizeLimit() {
        return 8192;
    }

    @Override
    public List<WebSocketExtension> getExtensions() {
        return List.of();
    }

    @Override
    public void sendMessage(WebSocketMessage<?> message) throws IOException {
        if (failSends) {
            throw new IOException("Broken pipe");
        }
        if (blockSends) {
            sendStarted.countDown();
            try {
                if (!released.await(10, TimeUnit.SECONDS)) {
                    throw new IOException("Peer never drained the socket");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Send interrupted");
            }
        }
        sentPayloads.add(((TextMessage) message).getPayload());
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        close(CloseStatus.NORMAL);
    }

    @Override
    public void close(CloseStatus status) {
        this.open = false;
        this.closeStatus = status;
        released.countDown();
    }
}
