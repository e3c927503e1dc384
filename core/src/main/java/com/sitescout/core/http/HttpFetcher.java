package com.sitescout.core.http;

import com.sitescout.core.api.IFetcher;
import com.sitescout.core.model.CrawlConfig;
import com.sitescout.core.model.FetchOutcome;
import com.sitescout.core.util.StructuredLog;
import com.sitescout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 공유 HttpClient로 GET 한 번을 보내고 결과를 분류한다.
 * - 리다이렉트는 투명하게 따라감(https→http 포함, 최종 URL이 다르면 로그만 남김)
 * - timeout은 헤더 대기뿐 아니라 본문 수신까지 포함한 전체 상한
 * - 최종 상태가 정확히 200일 때만 Success
 * - 타임아웃/전송 오류/비200은 Failure로 반환(예외 없음)
 */
public class HttpFetcher implements IFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpFetcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(HttpFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final Duration timeout;
    private final String userAgent;
    private final HttpSender sender;

    public HttpFetcher(CrawlConfig config) {
        this(config, buildClient(config));
    }

    public HttpFetcher(CrawlConfig config, HttpClient client) {
        this(config, boundedSender(client, config.getTimeout()));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpFetcher(CrawlConfig config, HttpSender sender) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    /** 세션 역할: 헤더/커넥션 풀 공유, 스레드 세이프 */
    public static HttpClient buildClient(CrawlConfig config) {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.ALWAYS)
                .connectTimeout(config.getTimeout())
                .build();
    }

    /** 응답 전체(헤더 + 본문)를 timeout 안에 받지 못하면 요청을 취소하고 HttpTimeoutException */
    static HttpSender boundedSender(HttpClient client, Duration timeout) {
        Objects.requireNonNull(client, "client");
        long limitMs = timeout.toMillis();
        return req -> {
            CompletableFuture<HttpResponse<String>> future =
                    client.sendAsync(req, HttpResponse.BodyHandlers.ofString());
            try {
                return future.get(limitMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                throw new HttpTimeoutException("response not complete within " + limitMs + " ms");
            } catch (InterruptedException e) {
                future.cancel(true);
                throw e;
            } catch (ExecutionException e) {
                Throwable cause = (e.getCause() != null ? e.getCause() : e);
                if (cause instanceof IOException io) throw io;
                throw new IOException(cause.toString(), cause);
            }
        };
    }

    @Override
    public FetchOutcome fetch(String url) {
        URI uri = UrlUtils.parseHttp(url);
        if (uri == null) {
            return FetchOutcome.invalidUrl(String.valueOf(url), "not an absolute http(s) URL");
        }

        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(uri)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return FetchOutcome.invalidUrl(url, e.getMessage());
        }

        try {
            HttpResponse<String> resp = sender.send(req);
            URI finalUri = (resp.uri() != null ? resp.uri() : uri);
            if (!finalUri.equals(uri)) {
                LOG.info("Request to {} was redirected to {}", url, finalUri);
                SLOG.info("fetch-redirected", "url", url, "finalUrl", finalUri.toString());
            }

            int status = resp.statusCode();
            if (status == 200) {
                return FetchOutcome.success(url, finalUri.toString(), resp.body());
            }
            LOG.debug("Failed to fetch {}: Status {}", url, status);
            return FetchOutcome.httpStatus(url, status);

        } catch (HttpTimeoutException e) {
            // HttpConnectTimeoutException 포함
            return FetchOutcome.timeout(url, e.toString());
        } catch (IOException e) {
            return FetchOutcome.transport(url, e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchOutcome.transport(url, "interrupted");
        }
    }
}
