package com.example.eventsub.security;

import com.example.eventsub.service.SecretStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;

/**
 * EventSub 投递验签：HMAC-SHA256(secret, messageId + timestamp + body)。
 * 供接收回调的 HTTP 接口使用。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeliverySignatureVerifier {

    private static final String HMAC_SHA256 = "HmacSHA256";
    private static final String SIGNATURE_PREFIX = "sha256=";

    private final SecretStore secretStore;

    /**
     * 校验投递签名。
     *
     * @param messageId 消息 ID 请求头
     * @param timestamp 时间戳请求头
     * @param body      原始请求体
     * @param signature 签名请求头（sha256=...）
     * @return 校验通过返回 true
     */
    public boolean verify(String messageId, String timestamp, String body, String signature) {
        if (messageId == null || timestamp == null || body == null || signature == null) {
            return false;
        }

        if (!signature.startsWith(SIGNATURE_PREFIX)) {
            log.warn("EventSub signature has unexpected format for message {}", messageId);
            return false;
        }

        try {
            String message = messageId + timestamp + body;
            if (matches(message, signature, secretStore.getSecret())) {
                return true;
            }

            // 缓存的密钥可能已被其他进程替换
            Optional<String> reloaded = secretStore.reload();
            return reloaded.isPresent() && matches(message, signature, reloaded.get());
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            log.error("EventSub signature verification error", e);
            return false;
        }
    }

    private static boolean matches(String message, String signature, String secret)
            throws NoSuchAlgorithmException, InvalidKeyException {
        String expected = SIGNATURE_PREFIX + calculateHmac(message, secret);

        // 常量时间比较，防止计时攻击
        return MessageDigest.isEqual(
                signature.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 计算 HMAC 值。
     *
     * @param data 原文
     * @param key  密钥
     * @return HMAC 十六进制字符串
     */
    static String calculateHmac(String data, String key) throws NoSuchAlgorithmException, InvalidKeyException {
        Mac mac = Mac.getInstance(HMAC_SHA256);
        mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
        byte[] hmacBytes = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));

        StringBuilder hex = new StringBuilder();
        for (byte b : hmacBytes) {
            String h = Integer.toHexString(0xff & b);
            if (h.length() == 1)
                hex.append('0');
            hex.append(h);
        }
        return hex.toString();
    }
}
