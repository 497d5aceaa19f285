package com.len.admission.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

@Configuration
public class AdmissionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    // SlotLockTemplate 이 락 안에서 트랜잭션을 열고 닫을 때 사용
    @Bean
    public TransactionOperations slotTransactionOperations(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
