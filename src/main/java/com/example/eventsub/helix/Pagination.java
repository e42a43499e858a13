package com.example.eventsub.helix;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * 分页遍历工具。
 */
@Slf4j
public final class Pagination {

    private Pagination() {
    }

    /**
     * 读取全部可读取的页。
     * 某页失败时调用 onError 一次并停止遍历，返回此前已读取的数据；
     * 线程被中断时直接停止，结果视为未知（不报错）。
     *
     * @param pager   分页器
     * @param onError 失败回调
     * @param <T>     元素类型
     * @return 已读取的数据
     */
    public static <T> List<T> collect(HelixPager<T> pager, Consumer<HelixResponse<?>> onError) {
        List<T> items = new ArrayList<>();
        while (pager.hasNext()) {
            if (Thread.currentThread().isInterrupted()) {
                log.debug("Pagination interrupted after {} items", items.size());
                return items;
            }

            HelixResponse<HelixPage<T>> page;
            try {
                page = pager.next();
            } catch (HelixTransportException e) {
                if (Thread.currentThread().isInterrupted()) {
                    log.debug("Pagination interrupted after {} items", items.size());
                    return items;
                }
                page = HelixResponse.failure(-1, e.getMessage());
            }

            if (!page.isSuccess()) {
                onError.accept(page);
                return items;
            }
            items.addAll(page.getValue().data());
        }
        return items;
    }
}
