package com.protocolguide.api.tracing;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdFilterTest {

  private final RequestIdFilter filter = new RequestIdFilter();

  @Test
  void reusesWellFormedIdAndClearsAfterwards() throws Exception {
    var req = new MockHttpServletRequest("GET", "/api/v1/health");
    req.addHeader(RequestIdFilter.HDR_CORRELATION_ID, "corr-42");
    var res = new MockHttpServletResponse();
    AtomicReference<String> seen = new AtomicReference<>();

    filter.doFilter(req, res, new MockFilterChain() {
      @Override
      public void doFilter(jakarta.servlet.ServletRequest request, jakarta.servlet.ServletResponse response) {
        seen.set(RequestContext.requestId());
      }
    });

    assertThat(seen.get()).isEqualTo("corr-42");
    assertThat(res.getHeader(RequestIdFilter.HDR_REQUEST_ID)).isEqualTo("corr-42");
    assertThat(RequestContext.requestId()).isNull();
  }

  @Test
  void replacesUnsafeId() throws Exception {
    var req = new MockHttpServletRequest("GET", "/api/v1/health");
    req.addHeader(RequestIdFilter.HDR_REQUEST_ID, "abc\n2026-01-01 FAKE LOG LINE");
    var res = new MockHttpServletResponse();

    filter.doFilter(req, res, new MockFilterChain());

    assertThat(res.getHeader(RequestIdFilter.HDR_REQUEST_ID)).hasSize(36).doesNotContain("FAKE");
  }
}
