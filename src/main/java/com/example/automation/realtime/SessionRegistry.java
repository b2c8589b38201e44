package com.example.automation.realtime;

import com.example.automation.protocol.StatusEvent;

import java.util.Optional;

/**
 * 会话注册表：会话ID到观察者连接集合的进程内映射
 *
 * <p>会话在第一次订阅时隐式创建，成员集合为空时立即删除。
 * 所有方法都可以被多个线程并发调用。
 * </p>
 */
public interface SessionRegistry {

    /**
     * 将连接登记到会话下
     *
     * <p>对同一连接和同一会话重复调用无副作用；
     * 如果连接已属于其他会话，会先从原会话移除。
     * </p>
     */
    void subscribe(String sessionId, ObserverConnection connection);

    /**
     * 将连接从其所属会话移除，会话成员为空时删除该会话
     *
     * @return 连接此前是否属于某个会话
     */
    boolean unsubscribe(ObserverConnection connection);

    /**
     * 将事件投递给会话当前的所有连接
     *
     * <p>事件只序列化一次。单个连接投递失败不会影响其他连接，失败的连接按
     * {@link #unsubscribe(ObserverConnection)} 的方式被移除。
     * 未知或空会话直接忽略，不视为错误。
     * </p>
     *
     * @return 成功投递的连接数
     */
    int broadcast(String sessionId, StatusEvent event);

    int memberCount(String sessionId);

    int sessionCount();

    Optional<String> sessionOf(ObserverConnection connection);
}
