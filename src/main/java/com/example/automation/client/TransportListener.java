package com.example.automation.client;

/**
 * 传输层回调，由传输实现的IO线程调用
 */
public interface TransportListener {

    void onFrame(String frame);

    void onClosed(String reason);

    void onError(Throwable error);
}
