package com.phillippitts.tastemodel.config.web;

import com.phillippitts.tastemodel.service.health.ServingRequestStats;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestStatsFilterTest {

    private final ServingRequestStats stats = new ServingRequestStats();
    private final RequestStatsFilter filter = new RequestStatsFilter(stats);

    @Test
    void countsSuccessAndServerErrors() throws ServletException, IOException {
        MockHttpServletResponse ok = new MockHttpServletResponse();
        filter.doFilter(new MockHttpServletRequest("GET", "/tracks/t1"), ok, new MockFilterChain());

        MockHttpServletResponse failed = new MockHttpServletResponse();
        failed.setStatus(503);
        filter.doFilter(new MockHttpServletRequest("GET", "/tracks/t1"), failed, new MockFilterChain());

        MockHttpServletResponse notFound = new MockHttpServletResponse();
        notFound.setStatus(404);
        filter.doFilter(new MockHttpServletRequest("GET", "/tracks/none"), notFound, new MockFilterChain());

        ServingRequestStats.Snapshot s = stats.drain();
        assertThat(s.requestCount()).isEqualTo(3);
        assertThat(s.failureCount()).isEqualTo(1);
    }

    @Test
    void exceptionCountsAsFailure() {
        MockFilterChain throwing = new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest request, ServletResponse response) {
                throw new IllegalStateException("boom");
            }
        };

        assertThatThrownBy(() -> filter.doFilter(new MockHttpServletRequest("POST", "/pipeline/train"),
                new MockHttpServletResponse(), throwing)).isInstanceOf(IllegalStateException.class);

        assertThat(stats.drain().failureCount()).isEqualTo(1);
    }

    @Test
    void actuatorRequestsAreIgnored() throws ServletException, IOException {
        filter.doFilter(new MockHttpServletRequest("GET", "/actuator/health"), new MockHttpServletResponse(),
                new MockFilterChain());

        assertThat(stats.drain().requestCount()).isZero();
    }
}
