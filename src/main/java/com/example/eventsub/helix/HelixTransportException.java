package com.example.eventsub.helix;

/**
 * 与 Helix 通信时的网络/传输错误（重试耗尽或线程被中断）。
 */
public class HelixTransportException extends RuntimeException {

    public HelixTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
