package com.len.admission.domain.ratelimit;

/**
 * @param totalWindows  저장된 윈도우 수 (만료됐지만 아직 안 지워진 것 포함)
 * @param activeWindows 아직 끝나지 않은 윈도우 수
 */
public record RateLimitStats(int totalWindows, int activeWindows) {}
