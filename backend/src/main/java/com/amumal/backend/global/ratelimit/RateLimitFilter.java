package com.amumal.backend.global.ratelimit;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import com.amumal.backend.global.error.ErrorCategory;
import com.amumal.backend.global.error.ProblemResponseWriter;
import com.amumal.backend.global.error.RetryableProblemException;
import com.amumal.backend.global.ratelimit.RateLimitProperties.Route;
import com.amumal.backend.global.web.ClientAddressResolver;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

/**
 * 상태 변경 요청에 등급별 요청 제한을 적용한다. 조회 요청과 헬스 체크는 제한하지 않는다.
 */
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    private static final Set<String> UNLIMITED_METHODS = Set.of("GET", "HEAD", "OPTIONS");

    private final RateLimiter rateLimiter;
    private final ClientAddressResolver clientAddressResolver;
    private final ProblemResponseWriter problemResponseWriter;
    private final boolean enabled;
    private final List<Route> routes;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RateLimitFilter(
            RateLimiter rateLimiter,
            ClientAddressResolver clientAddressResolver,
            ProblemResponseWriter problemResponseWriter,
            RateLimitProperties properties
    ) {
        this.rateLimiter = rateLimiter;
        this.clientAddressResolver = clientAddressResolver;
        this.problemResponseWriter = problemResponseWriter;
        this.enabled = properties.enabled();
        this.routes = properties.routes();
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String limiterClass = resolveLimiterClass(request);
        String clientKey = clientAddressResolver.resolve(request).orElse(null);
        RateLimitDecision decision = rateLimiter.evaluate(clientKey, limiterClass);

        response.setHeader(LIMIT_HEADER, String.valueOf(decision.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
        if (!decision.allowed()) {
            log.warn("Rate limit exceeded: class={} client={} retryAfter={}s",
                    limiterClass, clientKey == null ? "unknown" : clientKey, decision.retryAfterSeconds());
            problemResponseWriter.write(request, response, new RetryableProblemException(
                    ErrorCategory.RATE_LIMITED, "RATE_LIMITED", "요청이 너무 많습니다. 잠시 후 다시 시도해 주세요.",
                    (int) decision.retryAfterSeconds()));
            return;
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (!enabled || UNLIMITED_METHODS.contains(request.getMethod().toUpperCase())) {
            return true;
        }
        String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
        return path.equals("/health") || path.startsWith("/actuator/health");
    }

    String resolveLimiterClass(HttpServletRequest request) {
        String method = request.getMethod();
        String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
        for (Route route : routes) {
            if (route.method().equalsIgnoreCase(method) && pathMatcher.match(route.path(), path)) {
                return route.limiterClass();
            }
        }
        return RateLimitProperties.DEFAULT_CLASS;
    }
}
