package com.serge.scheduler.web;

import com.serge.scheduler.config.logging.RequestIdFilter;
import com.serge.scheduler.service.TokenService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.graphql.server.WebGraphQlInterceptor;
import org.springframework.graphql.server.WebGraphQlRequest;
import org.springframework.graphql.server.WebGraphQlResponse;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the bearer token once per GraphQL request and puts the caller id, when there is one,
 * and the request id into the GraphQL context.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class CallerContextInterceptor implements WebGraphQlInterceptor {
    private static final String BEARER = "Bearer ";

    private final TokenService tokenService;

    @Override
    public Mono<WebGraphQlResponse> intercept(WebGraphQlRequest request, Chain chain) {
        Map<String, Object> values = new HashMap<>();
        String requestId = request.getHeaders().getFirst(RequestIdFilter.HEADER);
        values.put(Callers.REQUEST_ID, requestId != null ? requestId : UUID.randomUUID().toString());
        bearerToken(request.getHeaders().getFirst("Authorization"))
                .flatMap(tokenService::authenticate)
                .ifPresent(callerId -> values.put(Callers.CALLER_ID, callerId));
        request.configureExecutionInput((input, builder) -> builder.graphQLContext(values).build());
        return chain.next(request);
    }

    static Optional<String> bearerToken(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return Optional.empty();
        }
        String token = header.substring(BEARER.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
