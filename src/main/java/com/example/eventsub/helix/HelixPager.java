package com.example.eventsub.helix;

/**
 * 逐页读取 Helix 分页接口。
 *
 * @param <T> 元素类型
 */
public interface HelixPager<T> {

    /**
     * @return 是否还有未读取的页
     */
    boolean hasNext();

    /**
     * 读取下一页。失败时返回失败结果，之后 {@link #hasNext()} 为 false（没有可继续的 cursor）。
     *
     * @return 当前页
     * @throws HelixTransportException 网络错误
     */
    HelixResponse<HelixPage<T>> next();
}
