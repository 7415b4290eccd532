package com.petition.archive.repository;

import com.petition.archive.model.WorkflowRun;
import com.petition.archive.model.WorkflowStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowRunRepositoryTest {

    private static final Instant STARTED = Instant.parse("2024-03-20T03:30:00Z");

    private WorkflowRunRepository repository;

    @BeforeEach
    void setUp() {
        repository = new WorkflowRunRepository(H2TestDatabase.create(H2TestDatabase.PROCESSING_SCHEMA),
                Duration.ofSeconds(5));
    }

    private static WorkflowRun run(String jobId, WorkflowStatus status, Instant startedAt) {
        return WorkflowRun.builder()
                .jobId(jobId)
                .serverName("host-a")
                .workerName("scheduler")
                .status(status)
                .watermark(startedAt.minus(Duration.ofDays(14)))
                .invalidSignaturesArchived(3)
                .invalidSignaturesDeleted(3)
                .orphanedValidationsArchived(1)
                .orphanedValidationsDeleted(1)
                .processedSignaturesArchived(10)
                .processedSignaturesDeleted(10)
                .processedValidationsArchived(9)
                .processedValidationsDeleted(9)
                .startedAt(startedAt)
                .finishedAt(startedAt.plusSeconds(42))
                .build();
    }

    @Test
    @DisplayName("unknown job id finds nothing")
    void notFound() {
        assertThat(repository.findLatestByJobId("missing")).isEmpty();
    }

    @Test
    @DisplayName("a saved run reads back unchanged")
    void saveAndFind() {
        WorkflowRun saved = run("job-1", WorkflowStatus.OK, STARTED);

        repository.save(saved);

        assertThat(repository.findLatestByJobId("job-1")).hasValueSatisfying(found ->
                assertThat(found).usingRecursiveComparison().isEqualTo(saved));
    }

    @Test
    @DisplayName("the most recent run wins when a job id is reused")
    void latestWins() {
        repository.save(run("job-1", WorkflowStatus.SERVER_ERROR, STARTED));
        repository.save(run("job-1", WorkflowStatus.OK, STARTED.plusSeconds(600)));

        assertThat(repository.findLatestByJobId("job-1"))
                .hasValueSatisfying(found -> assertThat(found.getStatus()).isEqualTo(WorkflowStatus.OK));
    }

    @Test
    @DisplayName("failed runs without a watermark are stored with a truncated message")
    void failedRun() {
        WorkflowRun failed = run("job-2", WorkflowStatus.SERVER_ERROR, STARTED);
        failed.setWatermark(null);
        failed.setErrorMessage("x".repeat(WorkflowRunRepository.ERROR_MESSAGE_MAX + 50));

        repository.save(failed);

        assertThat(repository.findLatestByJobId("job-2")).hasValueSatisfying(found -> {
            assertThat(found.getWatermark()).isNull();
            assertThat(found.getErrorMessage()).hasSize(WorkflowRunRepository.ERROR_MESSAGE_MAX);
        });
    }
}
