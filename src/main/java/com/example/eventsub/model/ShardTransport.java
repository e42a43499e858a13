package com.example.eventsub.model;

/**
 * Shard 的投递方式。secret 只在写入时携带，Helix 不会回传。
 *
 * @param method   "webhook" 或 "websocket"
 * @param callback 回调地址
 * @param secret   签名密钥
 */
public record ShardTransport(String method, String callback, String secret) {

    public static final String WEBHOOK = "webhook";

    public static ShardTransport webhook(String callback, String secret) {
        return new ShardTransport(WEBHOOK, callback, secret);
    }

    public boolean isWebhook() {
        return WEBHOOK.equals(method);
    }

    @Override
    public String toString() {
        return "ShardTransport[method=" + method + ", callback=" + callback + "]";
    }
}
