package com.example.automation.realtime;

import java.io.IOException;

/**
 * 一个观察者的实时连接
 *
 * <p>由 {@link SessionRegistry} 独占管理，同一时刻最多属于一个会话。
 * </p>
 */
public interface ObserverConnection {

    /**
     * 连接的唯一标识
     */
    String getId();

    boolean isOpen();

    /**
     * 发送一个文本帧
     *
     * @throws IOException 如果底层通道写入失败
     */
    void send(String frame) throws IOException;
}
