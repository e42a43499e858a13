package com.example.eventsub.service;

import com.example.eventsub.model.EventSubType;
import com.example.eventsub.model.UserOAuth;
import com.example.eventsub.repository.UserOAuthRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Set;

/**
 * 判断用户是否已授予订阅所需的 scope。每次都读取最新记录，不做缓存。
 */
@Service
@RequiredArgsConstructor
public class EligibilityChecker {

    private final UserOAuthRepository oauthRepository;

    @Transactional(readOnly = true)
    public boolean isEligible(String userId, EventSubType type) {
        UserOAuth oauth = oauthRepository.findByUserIdAndProvider(userId, UserOAuth.PROVIDER_TWITCH).orElse(null);
        if (oauth == null) {
            return false;
        }

        Set<String> granted = oauth.getScopes();
        if (granted == null || granted.isEmpty()) {
            return false;
        }

        return granted.containsAll(type.requiredScopes());
    }
}
