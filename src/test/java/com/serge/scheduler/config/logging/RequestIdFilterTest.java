package com.serge.scheduler.config.logging;

import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdFilterTest {
    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void keepsTheCallersRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/graphql");
        request.addHeader("X-Request-Id", "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getHeader("X-Request-Id")).isEqualTo("abc-123");
        assertThat(((HttpServletRequest) chain.getRequest()).getHeader("X-Request-Id")).isEqualTo("abc-123");
    }

    @Test
    void generatesOneWhenAbsentAndExposesItDownstream() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/graphql");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        String generated = response.getHeader("X-Request-Id");
        assertThat(generated).isNotBlank();
        HttpServletRequest seen = (HttpServletRequest) chain.getRequest();
        assertThat(seen.getHeader("x-request-id")).isEqualTo(generated);
        assertThat(Collections.list(seen.getHeaderNames())).contains("X-Request-Id");
    }
}
