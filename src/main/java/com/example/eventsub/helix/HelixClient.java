package com.example.eventsub.helix;

import com.example.eventsub.model.Conduit;
import com.example.eventsub.model.ConduitShard;
import com.example.eventsub.model.CreateSubscriptionRequest;
import com.example.eventsub.model.EventSubSubscription;
import com.example.eventsub.model.ShardAssignment;
import com.example.eventsub.model.ShardUpdateResult;

import java.util.List;

/**
 * 本服务使用到的 Helix EventSub 接口。
 * 结构化的失败通过 {@link HelixResponse} 返回，网络错误抛出 {@link HelixTransportException}。
 */
public interface HelixClient {

    HelixResponse<List<Conduit>> createConduits(int shardCount);

    HelixResponse<List<Conduit>> getConduits();

    HelixPager<ConduitShard> getConduitShards(String conduitId);

    HelixResponse<ShardUpdateResult> updateConduitShards(String conduitId, List<ShardAssignment> assignments);

    HelixResponse<EventSubSubscription> createEventSubSubscription(CreateSubscriptionRequest request);

    /**
     * 查询订阅。
     *
     * @param status 订阅状态，例如 enabled
     * @param type   类型过滤，可为 null
     * @param userId 用户过滤，可为 null
     * @return 分页器
     */
    HelixPager<EventSubSubscription> getEventSubSubscriptions(String status, String type, String userId);
}
