package com.len.admission.application.waitlist;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "admission.waitlist.sweep-enabled", havingValue = "true", matchIfMissing = true)
public class WaitlistExpireJob {

    private final WaitlistExpirySweeper sweeper;

    @Scheduled(fixedDelayString = "${admission.waitlist.sweep-interval-ms:60000}")
    public void expireEntries() {
        sweeper.sweep();
    }
}
