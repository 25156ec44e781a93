package com.rightsparser.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rightsparser.exception.ApiKeyRejectedException;
import com.rightsparser.exception.GlobalExceptionHandler;
import com.rightsparser.service.ApiKeyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Collections;

/**
 * Filter for API Key authentication and rate limiting.
 * Accepts the key from {@code X-API-Key} or a Bearer token and sets the admitted key as principal.
 */
@Slf4j
@RequiredArgsConstructor
public class ApiKeyAuthenticationFilter implements WebFilter {

    public static final String API_KEY_HEADER = "X-API-Key";
    private static final String BEARER_PREFIX = "Bearer ";

    private final ApiKeyService apiKeyService;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();

        // Skip authentication for public endpoints
        if (isPublicEndpoint(path)) {
            return chain.filter(exchange);
        }

        String apiKey = extractApiKey(exchange.getRequest().getHeaders());

        return apiKeyService.authorize(apiKey)
                .flatMap(key -> {
                    exchange.getAttributes().put(UsageLoggingFilter.API_KEY_HASH_ATTRIBUTE, key.getKeyHash());
                    UsernamePasswordAuthenticationToken authentication =
                            new UsernamePasswordAuthenticationToken(key, null, Collections.emptyList());

                    return chain.filter(exchange)
                            .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication));
                })
                .onErrorResume(ApiKeyRejectedException.class, error -> {
                    log.warn("API key rejected for {}: {}", path, error.getMessage());
                    return reject(exchange.getResponse(), error);
                });
    }

    static String extractApiKey(HttpHeaders headers) {
        String apiKey = headers.getFirst(API_KEY_HEADER);
        if (apiKey != null && !apiKey.isBlank()) {
            return apiKey.trim();
        }
        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            return authHeader.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }

    private Mono<Void> reject(ServerHttpResponse response, ApiKeyRejectedException error) {
        HttpStatus status = error.getReason().getStatus();
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(
                    GlobalExceptionHandler.errorBody(error.getReason().getKind(), error.getMessage()));
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }

        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = response.bufferFactory().wrap(body);
        return response.writeWith(Mono.just(buffer));
    }

    private boolean isPublicEndpoint(String path) {
        return path.equals("/") ||
               path.equals("/api/health") ||
               path.startsWith("/actuator");
    }
}
