package com.len.admission.infra.outbox;

import com.len.admission.domain.outbox.OutboxEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@ConditionalOnProperty(name = "admission.outbox.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int batchSize;
    private final long publishTimeoutMs;

    public OutboxPublisher(
            OutboxEventRepository outboxEventRepository,
            KafkaTemplate<String, String> kafkaTemplate,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${admission.outbox.batch-size:100}") int batchSize,
            @Value("${admission.outbox.publish-timeout-ms:3000}") long publishTimeoutMs
    ) {
        this.outboxEventRepository = outboxEventRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.batchSize = batchSize;
        this.publishTimeoutMs = publishTimeoutMs;
    }

    @Scheduled(fixedDelayString = "${admission.outbox.publish-interval-ms:500}")
    @Transactional
    public void publish() {
        final long startNs = System.nanoTime();
        int published = 0;
        int retry = 0;
        int failed = 0;

        try {
            List<OutboxEvent> batch = outboxEventRepository.lockPendingBatch(LocalDateTime.now(clock), batchSize);
            if (batch.isEmpty()) {
                return;
            }
            meterRegistry.summary("admission.outbox.batch.size").record(batch.size());

            for (OutboxEvent e : batch) {
                try {
                    kafkaTemplate
                            .send(e.getTopic(), e.getEventKey(), e.getPayload())
                            .get(publishTimeoutMs, TimeUnit.MILLISECONDS);
                    e.markPublished(LocalDateTime.now(clock));
                    published++;
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.markRetryOrFail("interrupted", LocalDateTime.now(clock));
                    retry++;
                    break;
                } catch (Exception ex) {
                    e.markRetryOrFail(ex.getMessage(), LocalDateTime.now(clock));
                    if (e.isFailed()) {
                        failed++;
                        log.error("Outbox publish failed permanently. eventId={}, kind={}, key={}, retryCount={}, err={}",
                                e.getEventId(), e.getKind(), e.getEventKey(), e.getRetryCount(), e.getLastError());
                    } else {
                        retry++;
                        log.warn("Outbox publish retry scheduled. eventId={}, kind={}, retryCount={}, nextRetryAt={}, err={}",
                                e.getEventId(), e.getKind(), e.getRetryCount(), e.getNextRetryAt(), e.getLastError());
                    }
                }
            }

            outboxEventRepository.saveAll(batch);
            count("published", published);
            count("retry", retry);
            count("failed", failed);

            log.info("Outbox batch done. total={}, published={}, retry={}, failed={}",
                    batch.size(), published, retry, failed);
        } finally {
            meterRegistry.timer("admission.outbox.publish.loop")
                    .record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
        }
    }

    private void count(String result, int n) {
        if (n > 0) {
            meterRegistry.counter("admission.outbox.events", "result", result).increment(n);
        }
    }
}
