package com.len.admission.application.ratelimit;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
public class RateLimitCleanupJob {

    private final OtpRateLimiter rateLimiter;

    @Scheduled(fixedRateString = "${admission.rate-limit.cleanup-interval-ms:1800000}") // 30분
    public void cleanup() {
        rateLimiter.cleanup();
    }
}
