package com.rightsparser.security;

import com.rightsparser.model.entity.UsageLog;
import com.rightsparser.service.UsageLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.net.InetSocketAddress;
import java.util.UUID;

/**
 * Appends one usage row for every API request, admitted or rejected.
 * Runs ahead of the security chain so rejected requests are recorded too.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class UsageLoggingFilter implements WebFilter {

    public static final String API_KEY_HASH_ATTRIBUTE = UsageLoggingFilter.class.getName() + ".apiKeyHash";
    public static final String JOB_ID_ATTRIBUTE = UsageLoggingFilter.class.getName() + ".jobId";
    public static final String FILE_SIZE_ATTRIBUTE = UsageLoggingFilter.class.getName() + ".fileSize";

    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private final UsageLogService usageLogService;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!path.startsWith("/api/")) {
            return chain.filter(exchange);
        }

        long startedAt = System.currentTimeMillis();
        return chain.filter(exchange)
                .doFinally(signal -> record(exchange, signal, System.currentTimeMillis() - startedAt));
    }

    private void record(ServerWebExchange exchange, SignalType signal, long elapsedMs) {
        ServerHttpRequest request = exchange.getRequest();
        HttpStatusCode status = exchange.getResponse().getStatusCode();

        UsageLog entry = UsageLog.builder()
                .jobId(exchange.getAttribute(JOB_ID_ATTRIBUTE) instanceof UUID jobId ? jobId : null)
                .apiKeyHash(exchange.getAttribute(API_KEY_HASH_ATTRIBUTE))
                .endpoint(request.getPath().value())
                .method(request.getMethod().name())
                .statusCode(statusCode(status, signal))
                .processingTimeMs(elapsedMs)
                .fileSize(exchange.getAttribute(FILE_SIZE_ATTRIBUTE))
                .ipAddress(clientAddress(request))
                .userAgent(request.getHeaders().getFirst(HttpHeaders.USER_AGENT))
                .build();

        // Logging must not delay or fail the response
        usageLogService.record(entry).subscribe(
                saved -> { },
                error -> log.error("Failed to record usage for {} {}", entry.getMethod(), entry.getEndpoint(), error));
    }

    /**
     * An error that escaped the chain has not set a status yet; it is answered with 500.
     */
    static int statusCode(HttpStatusCode status, SignalType signal) {
        if (status != null) {
            return status.value();
        }
        return signal == SignalType.ON_ERROR ? HttpStatus.INTERNAL_SERVER_ERROR.value() : HttpStatus.OK.value();
    }

    private static String clientAddress(ServerHttpRequest request) {
        String forwarded = request.getHeaders().getFirst(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote == null || remote.getAddress() == null) {
            return null;
        }
        return remote.getAddress().getHostAddress();
    }
}
