package quickpoll.websockets.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory index of which connections follow which polls.
 *
 * Holds a forward index (poll id to connections) and a reverse index
 * (connection to poll ids). The key set of the reverse index is the set of
 * live connections. Every mutation updates both indices under the same lock,
 * and every read hands out a copy, so callers may iterate while other threads
 * subscribe, unsubscribe or disconnect.
 */
@Component
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Set<Connection>> subscribersByPoll = new HashMap<>();
    private final Map<Connection, Set<Long>> pollsByConnection = new HashMap<>();

    /**
     * Adds a connection with no subscriptions.
     *
     * @return false if the connection was already registered
     */
    public boolean register(Connection connection) {
        lock.lock();
        try {
            if (pollsByConnection.containsKey(connection)) {
                return false;
            }
            pollsByConnection.put(connection, new HashSet<>());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Subscribes a registered connection to a poll. Unknown connections are
     * ignored so that a command racing with an eviction cannot bring the
     * connection back.
     *
     * @return true if a new subscription was added
     */
    public boolean subscribe(Connection connection, long pollId) {
        lock.lock();
        try {
            Set<Long> polls = pollsByConnection.get(connection);
            if (polls == null) {
                log.debug("Ignoring subscribe to poll {} for unregistered {}", pollId, connection);
                return false;
            }
            boolean added = polls.add(pollId);
            subscribersByPoll.computeIfAbsent(pollId, id -> new HashSet<>()).add(connection);
            return added;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if a subscription was removed
     */
    public boolean unsubscribe(Connection connection, long pollId) {
        lock.lock();
        try {
            Set<Long> polls = pollsByConnection.get(connection);
            boolean removed = polls != null && polls.remove(pollId);
            detach(connection, pollId);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the connection and all of its subscriptions.
     *
     * @return true if the connection was registered, false if it had already been removed
     */
    public boolean removeConnection(Connection connection) {
        lock.lock();
        try {
            Set<Long> polls = pollsByConnection.remove(connection);
            if (polls == null) {
                return false;
            }
            for (Long pollId : polls) {
                detach(connection, pollId);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Set<Connection> subscribersOf(long pollId) {
        lock.lock();
        try {
            Set<Connection> subscribers = subscribersByPoll.get(pollId);
            return subscribers == null ? Set.of() : Set.copyOf(subscribers);
        } finally {
            lock.unlock();
        }
    }

    public Set<Connection> allConnections() {
        lock.lock();
        try {
            return Set.copyOf(pollsByConnection.keySet());
        } finally {
            lock.unlock();
        }
    }

    public Set<Long> topicsOf(Connection connection) {
        lock.lock();
        try {
            Set<Long> polls = pollsByConnection.get(connection);
            return polls == null ? Set.of() : Set.copyOf(polls);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRegistered(Connection connection) {
        lock.lock();
        try {
            return pollsByConnection.containsKey(connection);
        } finally {
            lock.unlock();
        }
    }

    public int connectionCount() {
        lock.lock();
        try {
            return pollsByConnection.size();
        } finally {
            lock.unlock();
        }
    }

    public int topicCount() {
        lock.lock();
        try {
            return subscribersByPoll.size();
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private void detach(Connection connection, long pollId) {
        Set<Connection> subscribers = subscribersByPoll.get(pollId);
        if (subscribers == null) {
            return;
        }
        subscribers.remove(connection);
        if (subscribers.isEmpty()) {
            subscribersByPoll.remove(pollId);
        }
    }
}
