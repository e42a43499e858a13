package com.example.eventsub.helix;

import java.util.List;

/**
 * 分页结果中的一页。cursor 为空表示没有下一页。
 */
public record HelixPage<T>(List<T> data, String cursor) {

    public HelixPage {
        data = data == null ? List.of() : List.copyOf(data);
    }

    public boolean hasNext() {
        return cursor != null && !cursor.isEmpty();
    }
}
