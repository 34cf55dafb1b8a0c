package com.serge.scheduler.web.error;

import com.serge.scheduler.config.logging.RequestIdFilter;
import com.serge.scheduler.error.ErrorCode;
import com.serge.scheduler.error.Messages;
import com.serge.scheduler.web.Callers;
import graphql.ErrorClassification;
import graphql.ErrorType;
import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.graphql.server.WebGraphQlInterceptor;
import org.springframework.graphql.server.WebGraphQlRequest;
import org.springframework.graphql.server.WebGraphQlResponse;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Gives errors raised outside resolvers (syntax, schema validation, unresolved faults) the same
 * envelope as resolver errors.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class ErrorEnvelopeInterceptor implements WebGraphQlInterceptor {

    @Override
    public Mono<WebGraphQlResponse> intercept(WebGraphQlRequest request, Chain chain) {
        return chain.next(request).map(response -> {
            List<GraphQLError> errors = response.getExecutionResult().getErrors();
            if (errors.isEmpty()) return response;
            String requestId = request.getHeaders().getFirst(RequestIdFilter.HEADER);
            Object fromContext = response.getExecutionInput().getGraphQLContext().get(Callers.REQUEST_ID);
            String id = fromContext != null ? fromContext.toString() : requestId;
            List<GraphQLError> normalized = errors.stream().map(e -> normalize(e, id)).collect(Collectors.toList());
            return response.transform(builder -> builder.errors(normalized));
        });
    }

    static GraphQLError normalize(GraphQLError error, String requestId) {
        Map<String, Object> current = error.getExtensions();
        if (current != null && current.containsKey(GraphQlErrorResolver.CODE)) {
            if (current.get(GraphQlErrorResolver.REQUEST_ID) != null) return error;
            Map<String, Object> ext = new LinkedHashMap<>(current);
            ext.put(GraphQlErrorResolver.REQUEST_ID, requestId);
            return rebuild(error, error.getMessage(), error.getErrorType(), ext);
        }
        boolean clientFault = error.getErrorType() == ErrorType.ValidationError
                || error.getErrorType() == ErrorType.InvalidSyntax;
        ErrorCode code = clientFault ? ErrorCode.BAD_USER_INPUT : ErrorCode.INTERNAL_SERVER_ERROR;
        String message = clientFault ? error.getMessage() : Messages.INTERNAL_ERROR;
        Map<String, Object> ext = new LinkedHashMap<>();
        ext.put(GraphQlErrorResolver.CODE, code.name());
        ext.put(GraphQlErrorResolver.REQUEST_ID, requestId);
        return rebuild(error, message, code, ext);
    }

    private static GraphQLError rebuild(GraphQLError error, String message, ErrorClassification type, Map<String, Object> ext) {
        GraphqlErrorBuilder<?> builder = GraphqlErrorBuilder.newError()
                .message(message)
                .errorType(type)
                .extensions(ext);
        if (error.getLocations() != null) builder.locations(error.getLocations());
        if (error.getPath() != null) builder.path(error.getPath());
        return builder.build();
    }
}
