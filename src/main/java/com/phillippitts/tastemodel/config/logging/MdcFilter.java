package com.phillippitts.tastemodel.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags every API request in Log4j2's ThreadContext so registry and pipeline log lines can be
 * correlated with the call that caused them.
 *
 * <ul>
 *   <li>requestId: X-Request-ID header, or a generated UUID; echoed on the response</li>
 *   <li>method, uri</li>
 *   <li>modelType: from {@code /models/{type}/...} or the {@code modelType} parameter</li>
 * </ul>
 *
 * <p>The context is cleared after the request; pooled servlet threads never carry it over.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final Pattern MODEL_PATH = Pattern.compile("^/models/([^/]+)/");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = requestId(http);
                ThreadContext.put("requestId", requestId);
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
                String modelType = modelType(http);
                if (modelType != null) {
                    ThreadContext.put("modelType", modelType);
                }
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String requestId(HttpServletRequest req) {
        String v = req.getHeader(REQUEST_ID_HEADER);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v.trim();
    }

    static String modelType(HttpServletRequest req) {
        String param = req.getParameter("modelType");
        if (param != null && !param.isBlank()) {
            return param;
        }
        String uri = req.getRequestURI();
        if (uri == null) {
            return null;
        }
        Matcher m = MODEL_PATH.matcher(uri);
        return m.find() ? m.group(1) : null;
    }
}
