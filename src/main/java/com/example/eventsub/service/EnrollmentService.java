package com.example.eventsub.service;

import com.example.eventsub.model.EnrollmentResult;
import com.example.eventsub.model.EventSubType;
import com.example.eventsub.model.SubscriptionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 订阅入口：权限 -> 冷却 -> 是否已订阅 -> 创建订阅。
 * 预期内的失败都转换为带提示信息的结果，不抛异常。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnrollmentService {

    private final EligibilityChecker eligibilityChecker;
    private final CooldownGate cooldownGate;
    private final SubscriptionService subscriptionService;

    /**
     * 为用户订阅指定类型。
     *
     * @param userId    用户 ID
     * @param type      订阅类型
     * @param condition 订阅条件
     * @return 结果
     */
    public EnrollmentResult enroll(String userId, EventSubType type, Map<String, String> condition) {
        if (!eligibilityChecker.isEligible(userId, type)) {
            log.info("User {} is not eligible for {}", userId, type.name());
            return EnrollmentResult.ineligible(type);
        }

        if (cooldownGate.isOnCooldown(userId, type)) {
            log.debug("Subscription to {} for {} is on cooldown", type.name(), userId);
            return EnrollmentResult.onCooldown(type);
        }

        if (subscriptionService.isSubscribed(type, userId)) {
            return EnrollmentResult.alreadySubscribed(type);
        }

        boolean subscribed = subscriptionService.subscribe(new SubscriptionRequest(userId, type, condition));
        return subscribed ? EnrollmentResult.subscribed(type) : EnrollmentResult.failed(type);
    }
}
