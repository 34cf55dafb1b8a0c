package com.serge.scheduler.web.error;

import com.serge.scheduler.error.FieldIssue;
import com.serge.scheduler.web.Callers;
import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.schema.DataFetchingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.execution.DataFetcherExceptionResolverAdapter;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns resolver faults into GraphQL errors with {@code extensions.code}, {@code extensions.requestId}
 * and, for validation faults, {@code extensions.details}. Unexpected faults are logged in full and
 * reported without detail.
 */
@Component
public class GraphQlErrorResolver extends DataFetcherExceptionResolverAdapter {
    private static final Logger log = LoggerFactory.getLogger(GraphQlErrorResolver.class);

    public static final String CODE = "code";
    public static final String REQUEST_ID = "requestId";
    public static final String DETAILS = "details";

    @Override
    protected GraphQLError resolveToSingleError(Throwable ex, DataFetchingEnvironment env) {
        NormalizedError error = NormalizedError.of(ex);
        String requestId = env.getGraphQlContext().get(Callers.REQUEST_ID);
        String field = env.getField() == null ? "-" : env.getField().getName();
        if (error.isInternal()) {
            log.error("graphql.error.internal field={} requestId={}", field, requestId, ex);
        } else {
            log.info("graphql.error field={} code={} message=\"{}\" requestId={}", field, error.getCode(), error.getMessage(), requestId);
        }
        return GraphqlErrorBuilder.newError(env)
                .message(error.getMessage())
                .errorType(error.getCode())
                .extensions(extensions(error, requestId))
                .build();
    }

    static Map<String, Object> extensions(NormalizedError error, String requestId) {
        Map<String, Object> ext = new LinkedHashMap<>();
        ext.put(CODE, error.getCode().name());
        ext.put(REQUEST_ID, requestId);
        if (error.getDetails() != null) {
            ext.put(DETAILS, details(error.getDetails()));
        }
        return ext;
    }

    private static List<Map<String, String>> details(List<FieldIssue> issues) {
        return issues.stream().map(i -> {
            Map<String, String> m = new LinkedHashMap<>();
            m.put("field", i.getField());
            m.put("message", i.getMessage());
            return m;
        }).collect(Collectors.toList());
    }
}
