package com.example.automation.client;

import java.util.concurrent.CompletableFuture;

/**
 * 观察者客户端使用的传输层
 *
 * <p>每次调用 {@link #open(TransportListener)} 建立一条新通道；
 * 握手失败时返回的Future以异常结束。
 * </p>
 */
public interface ObserverTransport {

    CompletableFuture<TransportChannel> open(TransportListener listener);
}
