package com.example.eventsub.repository;

import com.example.eventsub.model.UserOAuth;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * OAuth 授权记录仓储接口。
 */
@Repository
public interface UserOAuthRepository extends JpaRepository<UserOAuth, Long> {
    /**
     * 查询用户在指定平台的授权记录。
     *
     * @param userId   用户 ID
     * @param provider 平台
     * @return 授权记录
     */
    Optional<UserOAuth> findByUserIdAndProvider(String userId, String provider);
}
