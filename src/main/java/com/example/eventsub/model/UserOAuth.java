package com.example.eventsub.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * 用户授予的 OAuth 权限记录。本服务只读取 scopes。
 */
@Entity
@Table(name = "user_oauth", uniqueConstraints = @UniqueConstraint(columnNames = { "userId", "provider" }))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserOAuth {

    public static final String PROVIDER_TWITCH = "twitch";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String userId; // Twitch 用户 ID

    @Builder.Default
    @Column(nullable = false, length = 32)
    private String provider = PROVIDER_TWITCH;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_oauth_scope", joinColumns = @JoinColumn(name = "oauth_id"))
    @Column(name = "scope", nullable = false)
    private Set<String> scopes = new HashSet<>();

    private LocalDateTime updatedAt;
}
