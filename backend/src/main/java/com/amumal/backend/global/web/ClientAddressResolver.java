package com.amumal.backend.global.web;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.amumal.backend.global.ratelimit.RateLimitProperties;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.web.util.matcher.IpAddressMatcher;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 요청의 실제 클라이언트 주소를 판별한다.
 * X-Forwarded-For는 TCP 피어가 신뢰 프록시일 때만 오른쪽부터 읽으며, 신뢰 프록시 홉은 건너뛴다.
 * 주소 문자열은 리터럴 형식만 허용해 DNS 조회가 일어나지 않게 한다.
 */
@Component
public class ClientAddressResolver {

    private static final Logger log = LoggerFactory.getLogger(ClientAddressResolver.class);

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    private static final Pattern IPV4 = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:.]{2,45}$");

    private final List<IpAddressMatcher> trustedProxies;

    public ClientAddressResolver(RateLimitProperties properties) {
        this.trustedProxies = properties.trustedProxies().stream()
                .map(String::trim)
                .filter(StringUtils::hasText)
                .map(IpAddressMatcher::new)
                .toList();
    }

    public Optional<String> resolve(HttpServletRequest request) {
        String peer = request.getRemoteAddr();
        if (!isAddressLiteral(peer)) {
            log.warn("Unknown client address on {} {}", request.getMethod(), request.getRequestURI());
            return Optional.empty();
        }
        try {
            return resolveForwarded(request, peer);
        } catch (IllegalArgumentException ex) {
            // 리터럴 형식 검사를 통과했지만 주소로 해석되지 않는 값 (예: ":::::")
            log.warn("Unparseable client address from peer {}: {}", peer, ex.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> resolveForwarded(HttpServletRequest request, String peer) {
        if (!isTrustedProxy(peer)) {
            return Optional.of(peer);
        }
        String forwardedFor = request.getHeader(FORWARDED_FOR_HEADER);
        if (!StringUtils.hasText(forwardedFor)) {
            return Optional.of(peer);
        }

        String[] hops = forwardedFor.split(",");
        String candidate = peer;
        for (int i = hops.length - 1; i >= 0; i--) {
            String hop = hops[i].trim();
            if (!isAddressLiteral(hop)) {
                log.warn("Malformed X-Forwarded-For hop from trusted proxy {}", peer);
                return Optional.empty();
            }
            candidate = hop;
            if (!isTrustedProxy(hop)) {
                return Optional.of(hop);
            }
        }
        // 모든 홉이 신뢰 프록시인 경우 가장 왼쪽 주소를 사용한다.
        return Optional.of(candidate);
    }

    /**
     * @throws IllegalArgumentException 주소를 해석할 수 없는 경우
     */
    private boolean isTrustedProxy(String address) {
        for (IpAddressMatcher matcher : trustedProxies) {
            if (matcher.matches(address)) {
                return true;
            }
        }
        return false;
    }

    static boolean isAddressLiteral(String address) {
        if (!StringUtils.hasText(address)) {
            return false;
        }
        if (IPV4.matcher(address).matches()) {
            return true;
        }
        return address.indexOf(':') >= 0 && IPV6.matcher(address).matches();
    }
}
