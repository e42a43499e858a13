package com.example.eventsub.helix;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Helix 接口调用结果。失败时 value 为 null，message 为 Helix 返回的错误说明。
 *
 * @param <T> 返回值类型
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class HelixResponse<T> {

    private final boolean success;
    private final int statusCode;
    private final String message;
    private final T value;

    public static <T> HelixResponse<T> ok(int statusCode, T value) {
        return new HelixResponse<>(true, statusCode, null, value);
    }

    public static <T> HelixResponse<T> failure(int statusCode, String message) {
        return new HelixResponse<>(false, statusCode, message, null);
    }
}
