package com.example.eventsub.helix;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * 发送 Helix HTTP 请求。
 * 幂等请求（GET、PATCH）在网络错误时指数退避重试；POST 只发送一次，
 * 超时后服务端可能已经创建了资源，重发会留下重复的 conduit。
 * 非 2xx 响应不重试，原样返回给调用方。
 */
@Component
@Slf4j
public class HelixRequestExecutor {

    private final HttpClient httpClient;
    private final String clientId;
    private final String accessToken;
    private final HelixRetrySettings retrySettings;

    public HelixRequestExecutor(HttpClient helixHttpClient,
                                @Value("${app.helix.client-id:}") String clientId,
                                @Value("${app.helix.access-token:}") String accessToken,
                                HelixRetrySettings retrySettings) {
        this.httpClient = helixHttpClient;
        this.clientId = clientId;
        this.accessToken = accessToken;
        this.retrySettings = retrySettings;
    }

    /**
     * 执行幂等请求，网络错误时重试。
     *
     * @param method HTTP 方法
     * @param uri    完整地址
     * @param body   JSON 请求体，可为 null
     * @return HTTP 响应
     * @throws IOException          重试耗尽后的网络错误
     * @throws InterruptedException 线程被中断
     */
    @Retryable(retryFor = IOException.class,
            maxAttemptsExpression = "${app.helix.retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${app.helix.retry.delay-ms:500}",
                    multiplierExpression = "${app.helix.retry.multiplier:2.0}"))
    public HelixHttpResult execute(String method, URI uri, String body) throws IOException, InterruptedException {
        return send(method, uri, body);
    }

    /**
     * 执行非幂等请求，只发送一次。
     *
     * @param method HTTP 方法
     * @param uri    完整地址
     * @param body   JSON 请求体，可为 null
     * @return HTTP 响应
     * @throws IOException          网络错误
     * @throws InterruptedException 线程被中断
     */
    public HelixHttpResult executeOnce(String method, URI uri, String body) throws IOException, InterruptedException {
        return send(method, uri, body);
    }

    private HelixHttpResult send(String method, URI uri, String body) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(retrySettings.getRequestTimeout())
                .header("Client-Id", clientId)
                .header("Authorization", "Bearer " + accessToken);

        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body));
        }

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        log.debug("Helix {} {} -> HTTP {}", method, uri.getPath(), response.statusCode());
        return new HelixHttpResult(response.statusCode(), response.body());
    }
}
