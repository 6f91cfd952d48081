package com.fvr.recommendation.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fvr.recommendation.common.ClientAddress;
import com.fvr.recommendation.common.ErrorResponse;
import io.micrometer.core.instrument.Metrics;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class RateLimitFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    private final RateLimiter rateLimiter;
    private final RateLimitProperties properties;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(RateLimiter rateLimiter, RateLimitProperties properties, ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.isEnabled() || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        return !isLimitedPath(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        String path = request.getRequestURI();
        String key = ClientAddress.resolve(request) + ":" + path;
        if (!rateLimiter.allow(key)) {
            log.warn("rate_limited key={}", key);
            Metrics.counter("recommendation.rate_limited.total").increment();
            response.setStatus(429);
            response.setHeader("Retry-After", String.valueOf(properties.getWindowSeconds()));
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getWriter(), ErrorResponse.of("rate_limited", "Too many requests"));
            return;
        }
        filterChain.doFilter(request, response);
    }

    static boolean isLimitedPath(String path) {
        if (path == null) {
            return false;
        }
        return path.startsWith("/recommendations")
            || path.equals("/videos/similar")
            || (path.startsWith("/videos/") && path.endsWith("/similar"));
    }
}
