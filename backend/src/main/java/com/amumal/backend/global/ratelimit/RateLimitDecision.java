package com.amumal.backend.global.ratelimit;

/**
 * 한 번의 요청 제한 판정 결과.
 *
 * @param allowed           허용 여부
 * @param limit             적용된 창(window) 내 최대 요청 수
 * @param remaining         이번 요청 이후 남은 허용 횟수
 * @param retryAfterSeconds 거부된 경우 다시 시도할 수 있을 때까지의 초 (허용 시 0)
 */
public record RateLimitDecision(boolean allowed, int limit, int remaining, long retryAfterSeconds) {
}
