package com.example.automation.realtime;

import com.example.automation.protocol.MessageCodec;
import com.example.automation.protocol.StatusEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 基于内存的会话注册表
 *
 * <p>并发策略：
 * <ul>
 *   <li>每个会话的成员集合是不可变快照，写操作在 {@code compute} 中整体替换，
 *       广播直接遍历读到的快照，不同会话之间互不争用</li>
 *   <li>连接到会话的反向映射 {@code membership} 按连接ID加锁，
 *       同一连接的订阅、迁移、退订因此串行执行</li>
 *   <li>锁顺序固定为 membership → sessions</li>
 * </ul>
 * 注册表只存在于进程内存中，进程重启后观察者通过重连重新订阅。
 * </p>
 */
@Component
public class InMemorySessionRegistry implements SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(InMemorySessionRegistry.class);

    private final ConcurrentMap<String, Set<ObserverConnection>> sessions = new ConcurrentHashMap<>();

    // connectionId -> sessionId
    private final ConcurrentMap<String, String> membership = new ConcurrentHashMap<>();

    private final MessageCodec messageCodec;

    public InMemorySessionRegistry(MessageCodec messageCodec) {
        this.messageCodec = messageCodec;
    }

    @Override
    public void subscribe(String sessionId, ObserverConnection connection) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        Objects.requireNonNull(connection, "connection");

        membership.compute(connection.getId(), (connectionId, previous) -> {
            if (sessionId.equals(previous)) {
                return previous;
            }
            if (previous != null) {
                removeMember(previous, connection);
                logger.info("Connection {} moved from session {} to {}", connectionId, previous, sessionId);
            }
            addMember(sessionId, connection);
            return sessionId;
        });
        logger.debug("Connection {} subscribed to session {}", connection.getId(), sessionId);
    }

    @Override
    public boolean unsubscribe(ObserverConnection connection) {
        boolean[] removed = new boolean[1];
        membership.computeIfPresent(connection.getId(), (connectionId, sessionId) -> {
            removeMember(sessionId, connection);
            removed[0] = true;
            return null;
        });
        if (removed[0]) {
            logger.debug("Connection {} unsubscribed", connection.getId());
        }
        return removed[0];
    }

    @Override
    public int broadcast(String sessionId, StatusEvent event) {
        Set<ObserverConnection> members = sessions.get(sessionId);
        if (members == null || members.isEmpty()) {
            logger.debug("No observers for session {}, dropping {} event", sessionId, event.type().tag());
            return 0;
        }

        String frame = messageCodec.encode(event);
        int delivered = 0;
        for (ObserverConnection connection : members) {
            if (deliver(sessionId, connection, frame)) {
                delivered++;
            }
        }
        logger.debug("Broadcast {} event to session {}: delivered={}/{}",
                event.type().tag(), sessionId, delivered, members.size());
        return delivered;
    }

    @Override
    public int memberCount(String sessionId) {
        Set<ObserverConnection> members = sessions.get(sessionId);
        return members != null ? members.size() : 0;
    }

    @Override
    public int sessionCount() {
        return sessions.size();
    }

    @Override
    public Optional<String> sessionOf(ObserverConnection connection) {
        return Optional.ofNullable(membership.get(connection.getId()));
    }

    private boolean deliver(String sessionId, ObserverConnection connection, String frame) {
        if (!connection.isOpen()) {
            logger.warn("Connection {} in session {} is closed, evicting", connection.getId(), sessionId);
            unsubscribe(connection);
            return false;
        }
        try {
            connection.send(frame);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to deliver to connection {} in session {}, evicting: {}",
                    connection.getId(), sessionId, e.getMessage());
            unsubscribe(connection);
            return false;
        }
    }

    private void addMember(String sessionId, ObserverConnection connection) {
        sessions.compute(sessionId, (key, members) -> {
            if (members == null) {
                return Collections.singleton(connection);
            }
            if (members.contains(connection)) {
                return members;
            }
            Set<ObserverConnection> copy = new LinkedHashSet<>(members);
            copy.add(connection);
            return Collections.unmodifiableSet(copy);
        });
    }

    private void removeMember(String sessionId, ObserverConnection connection) {
        sessions.computeIfPresent(sessionId, (key, members) -> {
            if (!members.contains(connection)) {
                return members;
            }
            if (members.size() == 1) {
                logger.debug("Session {} has no observers left, removing", sessionId);
                return null;
            }
            Set<ObserverConnection> copy = new LinkedHashSet<>(members);
            copy.remove(connection);
            return Collections.unmodifiableSet(copy);
        });
    }
}
