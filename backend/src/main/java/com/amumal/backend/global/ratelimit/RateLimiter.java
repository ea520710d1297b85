package com.amumal.backend.global.ratelimit;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import com.amumal.backend.global.ratelimit.RateLimitProperties.LimiterClass;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * (클라이언트 주소, 제한 등급) 단위의 슬라이딩 윈도우 요청 제한기.
 *
 * <p>상태는 접근 순서 {@link LinkedHashMap} 하나에만 보관되며 추적 키 수가 용량을 넘으면 가장 오래 사용되지
 * 않은 키부터 제거된다. 맵 락은 윈도우 조회와 LRU 갱신 동안만 잡고, 윈도우 계산은 키 해시로 고른
 * 스트라이프 락 아래에서 수행하므로 서로 다른 키는 대부분 병렬로 처리된다. 프로세스 로컬 상태이므로
 * 여러 인스턴스 간에는 공유되지 않는다.</p>
 */
@Component
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    static final int LOCK_STRIPES = 64;

    private final Map<String, LimiterClass> classes;
    private final int capacity;
    private final int unknownClientMax;
    private final Clock clock;
    private final ReentrantLock mapLock = new ReentrantLock();
    private final ReentrantLock[] stripes;
    private final LinkedHashMap<WindowKey, Deque<Long>> windows;

    public RateLimiter(RateLimitProperties properties, Clock clock) {
        this.classes = properties.classes();
        this.capacity = properties.capacity();
        this.unknownClientMax = properties.unknownClientMax();
        this.clock = clock;
        this.stripes = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
        this.windows = new LinkedHashMap<>(256, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<WindowKey, Deque<Long>> eldest) {
                return size() > RateLimiter.this.capacity;
            }
        };
    }

    public boolean allow(String clientKey, String limiterClass) {
        return evaluate(clientKey, limiterClass).allowed();
    }

    public RateLimitDecision evaluate(String clientKey, String limiterClass) {
        LimiterClass config = resolveClass(limiterClass);
        boolean unknownClient = !StringUtils.hasText(clientKey);
        int max = unknownClient ? Math.min(config.maxRequests(), unknownClientMax) : config.maxRequests();
        long windowMillis = config.window().toMillis();
        WindowKey key = new WindowKey(unknownClient ? "unknown" : clientKey, limiterClass);

        Deque<Long> timestamps = windowFor(key);
        ReentrantLock stripe = stripeFor(key);
        stripe.lock();
        try {
            long now = clock.millis();
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= now - windowMillis) {
                timestamps.pollFirst();
            }
            if (timestamps.size() < max) {
                timestamps.addLast(now);
                return new RateLimitDecision(true, max, max - timestamps.size(), 0);
            }
            long oldest = timestamps.peekFirst();
            long retryAfterMillis = oldest + windowMillis - now;
            long retryAfterSeconds = Math.max(1, (retryAfterMillis + 999) / 1000);
            return new RateLimitDecision(false, max, 0, retryAfterSeconds);
        } finally {
            stripe.unlock();
        }
    }

    /**
     * 키의 윈도우를 꺼내면서 LRU 순서를 갱신한다. 없으면 새로 만들고, 용량을 넘으면 가장 오래된 키가 제거된다.
     */
    private Deque<Long> windowFor(WindowKey key) {
        mapLock.lock();
        try {
            Deque<Long> timestamps = windows.get(key);
            if (timestamps == null) {
                timestamps = new ArrayDeque<>();
                windows.put(key, timestamps);
            }
            return timestamps;
        } finally {
            mapLock.unlock();
        }
    }

    private ReentrantLock stripeFor(WindowKey key) {
        return stripes[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    public void evict(String clientKey, String limiterClass) {
        mapLock.lock();
        try {
            windows.remove(new WindowKey(clientKey, limiterClass));
        } finally {
            mapLock.unlock();
        }
    }

    public int trackedKeyCount() {
        mapLock.lock();
        try {
            return windows.size();
        } finally {
            mapLock.unlock();
        }
    }

    private LimiterClass resolveClass(String limiterClass) {
        LimiterClass config = classes.get(limiterClass);
        if (config != null) {
            return config;
        }
        LimiterClass fallback = classes.get(RateLimitProperties.DEFAULT_CLASS);
        if (fallback == null) {
            throw new IllegalStateException("No limiter class configured for '" + limiterClass + "' and no default class");
        }
        log.debug("Limiter class '{}' not configured, using default", limiterClass);
        return fallback;
    }

    private record WindowKey(String clientKey, String limiterClass) {
    }
}
