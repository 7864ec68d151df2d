package com.hieshield.frauddetector.config;

import jakarta.servlet.ServletException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestLoggingFilterTest {

    private final RequestLoggingFilter filter = new RequestLoggingFilter();

    @Test
    void shouldPassRequestDownTheChain() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/fraud/cases");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    void shouldRethrowDownstreamFailure() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/fraud/analyze-procedures");

        assertThatThrownBy(() -> filter.doFilter(request, new MockHttpServletResponse(),
                (req, res) -> {
                    throw new ServletException("boom");
                }))
                .isInstanceOf(ServletException.class)
                .hasMessage("boom");
    }
}
