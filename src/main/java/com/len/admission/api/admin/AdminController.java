package com.len.admission.api.admin;

import com.len.admission.application.ratelimit.OtpRateLimiter;
import com.len.admission.application.waitlist.WaitlistExpirySweeper;
import com.len.admission.domain.ratelimit.RateLimitStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 운영용 수동 트리거 / 조회
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class AdminController {

    private final WaitlistExpirySweeper sweeper;
    private final OtpRateLimiter otpRateLimiter;

    // 스케줄 잡과 같은 sweep 을 즉시 한 번 돌린다
    @PostMapping("/waitlist/sweep")
    public SweepResponse sweep() {
        int removed = sweeper.sweep();
        log.info("Manual waitlist sweep. removed={}", removed);
        return new SweepResponse(removed);
    }

    @GetMapping("/otp/rate-limit/stats")
    public RateLimitStats rateLimitStats() {
        return otpRateLimiter.stats();
    }

    public record SweepResponse(int removed) {}
}
