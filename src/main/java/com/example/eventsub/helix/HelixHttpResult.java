package com.example.eventsub.helix;

/**
 * 原始 HTTP 响应。
 */
public record HelixHttpResult(int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
