package com.petition.archive.service;

import com.petition.archive.model.WorkflowConfig;
import com.petition.archive.repository.QueueStatusRepository;
import com.petition.archive.repository.StoreAccessException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes the watermark: the instant before which every record may be treated as
 * closed.
 *
 * <pre>
 *   W = min({ lastEmptied(q) for every queue q } ∪ { now - minimumLifetime })
 * </pre>
 *
 * The minimum keeps the watermark behind the slowest intake queue: as long as one
 * queue may still deliver data from before some instant, nothing at or after that
 * instant is final. A required queue that has never reported counts as emptied at
 * the epoch, which holds the watermark at the epoch until it does report.
 */
@Singleton
public class WatermarkCalculator {

    private static final Logger log = LoggerFactory.getLogger(WatermarkCalculator.class);

    private final QueueStatusRepository queueStatusRepository;
    private final Clock clock;

    @Inject
    public WatermarkCalculator(QueueStatusRepository queueStatusRepository, Clock clock) {
        this.queueStatusRepository = queueStatusRepository;
        this.clock = clock;
    }

    /**
     * Reads the queue status and computes the watermark for one run.
     *
     * @param config configuration snapshot of the run
     * @return the watermark
     * @throws WatermarkUnavailableException if the queue status cannot be read or is empty
     */
    public Instant computeWatermark(WorkflowConfig config) {
        Map<String, Long> reported;
        try {
            reported = queueStatusRepository.lastEmptiedTimestamps();
        } catch (StoreAccessException e) {
            throw new WatermarkUnavailableException("Queue status could not be read", e);
        }

        if (reported == null || reported.isEmpty()) {
            throw new WatermarkUnavailableException("Queue status reported no queues");
        }

        Map<String, Instant> lastEmptied = new LinkedHashMap<>();
        reported.forEach((queue, epochSeconds) -> lastEmptied.put(queue, Instant.ofEpochSecond(epochSeconds)));

        for (String queue : config.requiredQueues()) {
            if (!lastEmptied.containsKey(queue)) {
                log.warn("Queue status missing for required queue={}, treating it as never emptied", queue);
                lastEmptied.put(queue, Instant.EPOCH);
            }
        }

        Instant now = clock.instant();
        Instant watermark = calculate(lastEmptied, config.minimumSignatureLifetime(), now);
        log.info("Computed watermark={} now={} minimumLifetime={} queues={}",
                watermark, now, config.minimumSignatureLifetime(), lastEmptied);
        return watermark;
    }

    /**
     * Pure watermark formula.
     *
     * @param lastEmptied     last-emptied instant per queue
     * @param minimumLifetime minimum record age
     * @param now             current instant
     * @return the smallest of all last-emptied instants and {@code now - minimumLifetime}
     */
    public static Instant calculate(Map<String, Instant> lastEmptied, Duration minimumLifetime, Instant now) {
        Instant watermark = now.minus(minimumLifetime);
        for (Instant emptiedAt : lastEmptied.values()) {
            if (emptiedAt.isBefore(watermark)) {
                watermark = emptiedAt;
            }
        }
        return watermark;
    }
}
