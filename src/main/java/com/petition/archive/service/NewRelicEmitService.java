package com.petition.archive.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.petition.archive.model.WorkflowRun;
import io.micronaut.context.annotation.Value;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fire-and-forget service that emits archive metrics as custom events to the
 * New Relic Insights Events API.
 *
 * Event types:
 * <ul>
 *   <li>{@code ArchiveStoreSize}      - gauge: row count of a store after a transition step</li>
 *   <li>{@code ArchiveStoreItems}     - counter: rows added to or removed from a store</li>
 *   <li>{@code ArchiveWorkflowResult} - one per invocation, with status and per-category counts</li>
 * </ul>
 *
 * All public methods catch all exceptions internally and log warnings; they never throw.
 * Metrics failures never disrupt the archive workflow. When no API key is configured
 * the events are only logged at debug level.
 */
@Singleton
public class NewRelicEmitService {

    private static final Logger log = LoggerFactory.getLogger(NewRelicEmitService.class);

    static final String DIRECTION_ADDED   = "added";
    static final String DIRECTION_REMOVED = "removed";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String eventsUrl;

    @Inject
    public NewRelicEmitService(@Client HttpClient httpClient,
                               ObjectMapper objectMapper,
                               @Value("${newrelic.api-key:}") String apiKey,
                               @Value("${newrelic.events-url:}") String eventsUrl) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.eventsUrl = eventsUrl;
    }

    // -----------------------------------------------------------------------
    // Public event emitters
    // -----------------------------------------------------------------------

    /**
     * Emits an {@code ArchiveStoreSize} gauge for one store.
     *
     * @param storeName table the size was taken from
     * @param size      current row count
     */
    public void emitStoreSize(String storeName, long size) {
        try {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("eventType", "ArchiveStoreSize");
            event.put("storeName", storeName);
            event.put("size", size);
            event.put("timestamp", System.currentTimeMillis());

            postEvents(List.of(event), "ArchiveStoreSize");

        } catch (Exception e) {
            log.warn("Failed to emit ArchiveStoreSize for store={}: {}", storeName, e.getMessage());
        }
    }

    /**
     * Emits an {@code ArchiveStoreItems} counter for rows copied into a store.
     *
     * @param storeName receiving table
     * @param count     number of rows inserted
     */
    public void emitItemsAdded(String storeName, int count) {
        emitItems(storeName, DIRECTION_ADDED, count);
    }

    /**
     * Emits an {@code ArchiveStoreItems} counter for rows deleted from a store.
     *
     * @param storeName table rows were deleted from
     * @param count     number of rows deleted
     */
    public void emitItemsRemoved(String storeName, int count) {
        emitItems(storeName, DIRECTION_REMOVED, count);
    }

    /**
     * Emits an {@code ArchiveWorkflowResult} event summarising one invocation.
     *
     * @param run the finished run
     */
    public void emitWorkflowResult(WorkflowRun run) {
        try {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("eventType", "ArchiveWorkflowResult");
            event.put("jobId", run.getJobId());
            event.put("serverName", run.getServerName());
            event.put("workerName", run.getWorkerName());
            event.put("status", run.getStatus() == null ? null : run.getStatus().name());
            event.put("watermark", run.getWatermark() == null ? 0L : run.getWatermark().toEpochMilli());
            event.put("invalidSignaturesArchived", run.getInvalidSignaturesArchived());
            event.put("invalidSignaturesDeleted", run.getInvalidSignaturesDeleted());
            event.put("orphanedValidationsArchived", run.getOrphanedValidationsArchived());
            event.put("orphanedValidationsDeleted", run.getOrphanedValidationsDeleted());
            event.put("processedSignaturesArchived", run.getProcessedSignaturesArchived());
            event.put("processedSignaturesDeleted", run.getProcessedSignaturesDeleted());
            event.put("processedValidationsArchived", run.getProcessedValidationsArchived());
            event.put("processedValidationsDeleted", run.getProcessedValidationsDeleted());
            event.put("timestamp", System.currentTimeMillis());

            postEvents(List.of(event), "ArchiveWorkflowResult");

        } catch (Exception e) {
            log.warn("Failed to emit ArchiveWorkflowResult for jobId={}: {}", run.getJobId(), e.getMessage());
        }
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private void emitItems(String storeName, String direction, int count) {
        try {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("eventType", "ArchiveStoreItems");
            event.put("storeName", storeName);
            event.put("direction", direction);
            event.put("count", count);
            event.put("timestamp", System.currentTimeMillis());

            postEvents(List.of(event), "ArchiveStoreItems");

        } catch (Exception e) {
            log.warn("Failed to emit ArchiveStoreItems for store={} direction={}: {}",
                    storeName, direction, e.getMessage());
        }
    }

    /**
     * Serializes the event list to JSON and POSTs to the NR Events API.
     * Uses a blocking call; the workflow already runs on a background thread.
     *
     * @param events    list of event maps to POST
     * @param eventType label used only for logging
     */
    private void postEvents(List<Map<String, Object>> events, String eventType) {
        if (events == null || events.isEmpty()) {
            return;
        }
        if (apiKey == null || apiKey.isBlank() || eventsUrl == null || eventsUrl.isBlank()) {
            log.debug("NR not configured, skipping {} events={}", eventType, events);
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(events);

            HttpRequest<String> request = HttpRequest.POST(eventsUrl, payload)
                    .contentType(MediaType.APPLICATION_JSON_TYPE)
                    .header("X-Insert-Key", apiKey);

            HttpResponse<String> response = httpClient.toBlocking().exchange(request, String.class);
            log.info("NR {} POST status={} events={}", eventType, response.getStatus().getCode(), events.size());

        } catch (Exception e) {
            log.warn("NR POST failed for eventType={} events={}: {}", eventType, events.size(), e.getMessage());
        }
    }
}
