package com.example.automation.client;

/**
 * 观察者客户端的连接状态
 *
 * <pre>
 * IDLE --connect()--> CONNECTING --握手成功--> OPEN
 * OPEN/CONNECTING --关闭或出错--> RETRY_WAIT --延迟到期--> CONNECTING
 * 任意状态 --超过重试上限--> GIVEN_UP
 * 任意状态 --disconnect()--> IDLE
 * </pre>
 */
public enum ConnectionState {
    IDLE,
    CONNECTING,
    OPEN,

    /**
     * 连接已断开，等待下一次自动重连
     */
    RETRY_WAIT,

    /**
     * 重试次数用尽，不再自动重连；调用 connect() 可重新开始
     */
    GIVEN_UP
}
