package com.example.eventsub.controller;

import com.example.eventsub.model.EnrollmentResult;
import com.example.eventsub.model.EventSubType;
import com.example.eventsub.model.EventSubTypes;
import com.example.eventsub.service.ConduitResolver;
import com.example.eventsub.service.EnrollmentService;
import com.example.eventsub.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * Conduit 与订阅管理 API
 */
@RestController
@RequestMapping("/api/eventsub")
@RequiredArgsConstructor
public class EventSubController {

    private final ConduitResolver conduitResolver;
    private final SubscriptionService subscriptionService;
    private final EnrollmentService enrollmentService;

    /**
     * 订阅请求体。
     */
    public record EnrollRequest(String userId, String type, Map<String, String> condition) {
    }

    /**
     * 查看 conduit 状态。
     */
    @GetMapping("/conduit")
    public Map<String, Object> conduit() {
        Map<String, Object> status = new HashMap<>();
        String conduitId = conduitResolver.getConduitId().orElse(null);
        status.put("conduitId", conduitId);
        status.put("configured", conduitResolver.isConfigured());
        status.put("healthy", conduitId != null);
        status.put("callbackUrl", conduitResolver.getCallbackUrl().toString());
        return status;
    }

    /**
     * 创建新的 conduit。已有的 conduit 会被替换（缓存指向新的 conduit）。
     */
    @PostMapping("/conduit")
    public ResponseEntity<Map<String, Object>> createConduit() {
        boolean created = conduitResolver.createConduit();
        return ResponseEntity.status(created ? HttpStatus.CREATED : HttpStatus.BAD_GATEWAY)
                .body(Map.of("created", created));
    }

    /**
     * 为用户创建订阅。
     */
    @PostMapping("/subscriptions")
    public ResponseEntity<Map<String, Object>> enroll(@RequestBody EnrollRequest request) {
        if (request.userId() == null || request.userId().isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        EventSubType type = resolveType(request.type());

        EnrollmentResult result = enrollmentService.enroll(request.userId(), type, request.condition());

        Map<String, Object> body = new HashMap<>();
        body.put("outcome", result.outcome().name());
        body.put("message", result.message());
        return ResponseEntity.status(result.isSuccess() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    /**
     * 查询是否已订阅。
     */
    @GetMapping("/subscriptions")
    public Map<String, Object> isSubscribed(@RequestParam String type,
                                            @RequestParam(required = false) String userId) {
        EventSubType eventSubType = resolveType(type);

        Map<String, Object> body = new HashMap<>();
        body.put("type", eventSubType.name());
        body.put("userId", userId);
        body.put("subscribed", subscriptionService.isSubscribed(eventSubType, userId));
        return body;
    }

    private EventSubType resolveType(String name) {
        return EventSubTypes.find(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown subscription type: " + name));
    }
}
