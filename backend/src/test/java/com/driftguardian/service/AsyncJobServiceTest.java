package com.driftguardian.service;

import com.driftguardian.dto.AsyncJobResponse;
import com.driftguardian.dto.AsyncJobStatus;
import com.driftguardian.dto.JobType;
import com.driftguardian.exception.JobNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class AsyncJobServiceTest {

    private AsyncJobService service;

    @BeforeEach
    void setUp() {
        service = new AsyncJobService();
        ReflectionTestUtils.setField(service, "poolSize", 2);
        ReflectionTestUtils.setField(service, "maxRetained", 3);
        service.init();
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private AsyncJobResponse awaitFinished(UUID jobId) {
        await().atMost(Duration.ofSeconds(5)).until(() -> {
            AsyncJobStatus status = service.getJob(jobId).getStatus();
            return status == AsyncJobStatus.COMPLETED || status == AsyncJobStatus.FAILED;
        });
        return service.getJob(jobId);
    }

    @Test
    void completedJob_exposesResult() {
        UUID jobId = service.submit(JobType.ANALYSIS, "credit", "req-1", () -> Map.of("alerts", 2));

        AsyncJobResponse job = awaitFinished(jobId);

        assertThat(job.getStatus()).isEqualTo(AsyncJobStatus.COMPLETED);
        assertThat(job.getResult()).isEqualTo(Map.of("alerts", 2));
        assertThat(job.getJobType()).isEqualTo(JobType.ANALYSIS);
        assertThat(job.getModelId()).isEqualTo("credit");
        assertThat(job.getRequestId()).isEqualTo("req-1");
        assertThat(job.getStartedAt()).isNotNull();
        assertThat(job.getCompletedAt()).isAfterOrEqualTo(job.getStartedAt());
    }

    @Test
    void failingJob_recordsMessage() {
        UUID jobId = service.submit(JobType.ROOT_CAUSE, "credit", "req-2", () -> {
            throw new IllegalStateException("attribution exploded");
        });

        AsyncJobResponse job = awaitFinished(jobId);

        assertThat(job.getStatus()).isEqualTo(AsyncJobStatus.FAILED);
        assertThat(job.getMessage()).isEqualTo("attribution exploded");
        assertThat(job.getResult()).isNull();
    }

    @Test
    void unknownJob_isNotFound() {
        assertThatThrownBy(() -> service.getJob(UUID.randomUUID()))
            .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void finishedJobsAreEvictedBeyondRetentionLimit() {
        UUID first = service.submit(JobType.ANALYSIS, "m", "r", () -> 1);
        awaitFinished(first);
        for (int i = 0; i < 3; i++) {
            awaitFinished(service.submit(JobType.ANALYSIS, "m", "r", () -> 1));
        }

        assertThatThrownBy(() -> service.getJob(first)).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void jobInFlightForSameModel_isReused() {
        CountDownLatch release = new CountDownLatch(1);
        UUID running = service.submit(JobType.ANALYSIS, "credit", "req-a", () -> {
            awaitLatch(release);
            return "first";
        });

        UUID again = service.submit(JobType.ANALYSIS, "credit", "req-b", () -> "second");
        UUID otherModel = service.submit(JobType.ANALYSIS, "fraud", "req-c", () -> "other");
        UUID otherType = service.submit(JobType.ROOT_CAUSE, "credit", "req-d", () -> "rc");

        assertThat(again).isEqualTo(running);
        assertThat(otherModel).isNotEqualTo(running);
        assertThat(otherType).isNotEqualTo(running);

        release.countDown();
        assertThat(awaitFinished(running).getResult()).isEqualTo("first");
        UUID next = service.submit(JobType.ANALYSIS, "credit", "req-e", () -> "next");
        assertThat(next).isNotEqualTo(running);
        assertThat(awaitFinished(next).getResult()).isEqualTo("next");
    }

    @Test
    void completedJob_reportsResultType() {
        AsyncJobResponse job = awaitFinished(service.submit(JobType.ANALYSIS, "credit", "r", () -> 7));

        assertThat(job.getResultType()).isEqualTo("Integer");
    }

    @Test
    void jobsForModel_listsOnlyThatModelNewestFirst() {
        ReflectionTestUtils.setField(service, "maxRetained", 10);
        UUID first = awaitFinished(service.submit(JobType.ANALYSIS, "credit", "r", () -> 1)).getJobId();
        UUID second = awaitFinished(service.submit(JobType.ROOT_CAUSE, "credit", "r", () -> 2)).getJobId();
        awaitFinished(service.submit(JobType.ANALYSIS, "fraud", "r", () -> 3));

        assertThat(service.jobsForModel("credit")).extracting(AsyncJobResponse::getJobId)
            .containsExactlyInAnyOrder(first, second);
        assertThat(service.jobsForModel("credit")).extracting(AsyncJobResponse::getCreatedAt)
            .isSortedAccordingTo(Comparator.reverseOrder());
        assertThat(service.jobsForModel("unknown")).isEmpty();
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }
}
