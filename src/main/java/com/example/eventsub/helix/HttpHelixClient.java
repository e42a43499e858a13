package com.example.eventsub.helix;

import com.example.eventsub.model.Conduit;
import com.example.eventsub.model.ConduitShard;
import com.example.eventsub.model.CreateSubscriptionRequest;
import com.example.eventsub.model.EventSubSubscription;
import com.example.eventsub.model.ShardAssignment;
import com.example.eventsub.model.ShardError;
import com.example.eventsub.model.ShardStatus;
import com.example.eventsub.model.ShardTransport;
import com.example.eventsub.model.ShardUpdateResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 基于 JDK HttpClient 与 Jackson 的 Helix 客户端。
 */
@Component
@Slf4j
public class HttpHelixClient implements HelixClient {

    private static final String POST = "POST";

    private final HelixRequestExecutor executor;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public HttpHelixClient(HelixRequestExecutor executor,
                           ObjectMapper objectMapper,
                           @Value("${app.helix.base-url:https://api.twitch.tv/helix}") String baseUrl) {
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public HelixResponse<List<Conduit>> createConduits(int shardCount) {
        ObjectNode body = objectMapper.createObjectNode().put("shard_count", shardCount);
        return call(POST, "/eventsub/conduits", null, body, json -> mapArray(json.path("data"), this::toConduit));
    }

    @Override
    public HelixResponse<List<Conduit>> getConduits() {
        return call("GET", "/eventsub/conduits", null, null, json -> mapArray(json.path("data"), this::toConduit));
    }

    @Override
    public HelixPager<ConduitShard> getConduitShards(String conduitId) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("conduit_id", conduitId);
        return new CursorPager<>("/eventsub/conduits/shards", query, this::toShard);
    }

    @Override
    public HelixResponse<ShardUpdateResult> updateConduitShards(String conduitId, List<ShardAssignment> assignments) {
        ObjectNode body = objectMapper.createObjectNode().put("conduit_id", conduitId);
        ArrayNode shards = body.putArray("shards");
        for (ShardAssignment assignment : assignments) {
            ObjectNode shard = shards.addObject().put("id", assignment.id());
            ObjectNode transport = shard.putObject("transport").put("method", assignment.transport().method());
            if (assignment.transport().callback() != null) {
                transport.put("callback", assignment.transport().callback());
            }
            if (assignment.transport().secret() != null) {
                transport.put("secret", assignment.transport().secret());
            }
        }

        return call("PATCH", "/eventsub/conduits/shards", null, body, json -> new ShardUpdateResult(
                mapArray(json.path("data"), this::toShard),
                mapArray(json.path("errors"), this::toShardError)));
    }

    @Override
    public HelixResponse<EventSubSubscription> createEventSubSubscription(CreateSubscriptionRequest request) {
        ObjectNode body = objectMapper.createObjectNode()
                .put("type", request.type())
                .put("version", request.version());
        ObjectNode condition = body.putObject("condition");
        request.condition().forEach(condition::put);
        body.putObject("transport")
                .put("method", request.transport().method())
                .put("conduit_id", request.transport().conduitId());

        return call(POST, "/eventsub/subscriptions", null, body, json -> {
            List<EventSubSubscription> created = mapArray(json.path("data"), this::toSubscription);
            return created.isEmpty() ? null : created.get(0);
        });
    }

    @Override
    public HelixPager<EventSubSubscription> getEventSubSubscriptions(String status, String type, String userId) {
        Map<String, String> query = new LinkedHashMap<>();
        if (status != null) {
            query.put("status", status);
        }
        if (type != null) {
            query.put("type", type);
        }
        if (userId != null) {
            query.put("user_id", userId);
        }
        return new CursorPager<>("/eventsub/subscriptions", query, this::toSubscription);
    }

    /**
     * 发送请求并解析响应。
     *
     * @param method HTTP 方法
     * @param path   接口路径
     * @param query  查询参数
     * @param body   请求体
     * @param parser 成功时的解析函数
     * @return 调用结果
     */
    private <T> HelixResponse<T> call(String method, String path, Map<String, String> query, JsonNode body,
                                      Function<JsonNode, T> parser) {
        URI uri = buildUri(path, query);
        HelixHttpResult result;
        try {
            String json = body == null ? null : objectMapper.writeValueAsString(body);
            result = POST.equals(method)
                    ? executor.executeOnce(method, uri, json)
                    : executor.execute(method, uri, json);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HelixTransportException("Helix request interrupted: " + method + " " + path, e);
        } catch (BackOffInterruptedException e) {
            // Interrupted while waiting between retries
            Thread.currentThread().interrupt();
            throw new HelixTransportException("Helix request interrupted: " + method + " " + path, e);
        } catch (IOException e) {
            throw new HelixTransportException("Helix request failed: " + method + " " + path, e);
        }

        if (!result.isSuccess()) {
            return HelixResponse.failure(result.statusCode(), errorMessage(result));
        }

        try {
            JsonNode json = result.body() == null || result.body().isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(result.body());
            return HelixResponse.ok(result.statusCode(), parser.apply(json));
        } catch (JsonProcessingException e) {
            log.error("Failed to parse Helix response for {} {}: {}", method, path, e.getMessage());
            return HelixResponse.failure(result.statusCode(), "Malformed response: " + e.getOriginalMessage());
        }
    }

    private URI buildUri(String path, Map<String, String> query) {
        StringBuilder sb = new StringBuilder(baseUrl).append(path);
        if (query != null && !query.isEmpty()) {
            char separator = '?';
            for (Map.Entry<String, String> entry : query.entrySet()) {
                sb.append(separator)
                        .append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                        .append('=')
                        .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
                separator = '&';
            }
        }
        return URI.create(sb.toString());
    }

    private String errorMessage(HelixHttpResult result) {
        String body = result.body();
        if (body == null || body.isBlank()) {
            return "HTTP " + result.statusCode();
        }
        try {
            JsonNode json = objectMapper.readTree(body);
            String message = json.path("message").asText("");
            return message.isEmpty() ? "HTTP " + result.statusCode() : message;
        } catch (JsonProcessingException e) {
            return "HTTP " + result.statusCode() + ": " + body;
        }
    }

    private <T> List<T> mapArray(JsonNode array, Function<JsonNode, T> mapper) {
        List<T> items = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(node -> items.add(mapper.apply(node)));
        }
        return items;
    }

    private Conduit toConduit(JsonNode node) {
        return new Conduit(node.path("id").asText(), node.path("shard_count").asInt());
    }

    private ConduitShard toShard(JsonNode node) {
        JsonNode transport = node.path("transport");
        ShardTransport shardTransport = transport.isMissingNode() || transport.isNull()
                ? null
                : new ShardTransport(textOrNull(transport, "method"), textOrNull(transport, "callback"), null);
        return new ConduitShard(node.path("id").asText(), ShardStatus.fromHelix(textOrNull(node, "status")), shardTransport);
    }

    private ShardError toShardError(JsonNode node) {
        return new ShardError(textOrNull(node, "id"), textOrNull(node, "message"), textOrNull(node, "code"));
    }

    private EventSubSubscription toSubscription(JsonNode node) {
        Map<String, String> condition = new LinkedHashMap<>();
        node.path("condition").fields().forEachRemaining(e -> {
            if (!e.getValue().isNull()) {
                condition.put(e.getKey(), e.getValue().asText());
            }
        });
        return new EventSubSubscription(
                node.path("id").asText(),
                textOrNull(node, "type"),
                textOrNull(node, "version"),
                textOrNull(node, "status"),
                condition,
                textOrNull(node.path("transport"), "conduit_id"));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    /**
     * 基于 pagination.cursor 的分页器。
     */
    private final class CursorPager<T> implements HelixPager<T> {

        private final String path;
        private final Map<String, String> query;
        private final Function<JsonNode, T> mapper;
        private String cursor;
        private boolean finished;

        private CursorPager(String path, Map<String, String> query, Function<JsonNode, T> mapper) {
            this.path = path;
            this.query = query;
            this.mapper = mapper;
        }

        @Override
        public boolean hasNext() {
            return !finished;
        }

        @Override
        public HelixResponse<HelixPage<T>> next() {
            if (finished) {
                throw new IllegalStateException("No more pages for " + path);
            }

            Map<String, String> pageQuery = new LinkedHashMap<>(query);
            if (cursor != null) {
                pageQuery.put("after", cursor);
            }

            HelixResponse<HelixPage<T>> response;
            try {
                response = call("GET", path, pageQuery, null, json -> new HelixPage<>(
                        mapArray(json.path("data"), mapper),
                        textOrNull(json.path("pagination"), "cursor")));
            } catch (HelixTransportException e) {
                finished = true;
                throw e;
            }

            if (!response.isSuccess()) {
                finished = true;
                return response;
            }

            cursor = response.getValue().cursor();
            finished = !response.getValue().hasNext();
            return response;
        }
    }
}
