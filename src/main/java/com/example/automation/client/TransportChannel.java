package com.example.automation.client;

import java.io.IOException;

/**
 * 一条已建立的传输通道
 */
public interface TransportChannel {

    void send(String frame) throws IOException;

    void close();

    boolean isOpen();
}
