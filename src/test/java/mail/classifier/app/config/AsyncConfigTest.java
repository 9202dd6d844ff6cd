package mail.classifier.app.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AsyncConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        MDC.clear();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void enrichmentExecutor_ShouldUseFixedPoolSizeFromProperties() {
        MailClassifierProperties properties = new MailClassifierProperties();
        properties.setWorkers(3);
        properties.setQueueCapacity(7);

        executor = new AsyncConfig().enrichmentExecutor(properties);

        assertEquals(3, executor.getCorePoolSize());
        assertEquals(3, executor.getMaxPoolSize());
    }

    @Test
    void enrichmentExecutor_ShouldCarryRequestIdIntoWorkerThread() throws Exception {
        // Given
        executor = new AsyncConfig().enrichmentExecutor(new MailClassifierProperties());
        MDC.put(RequestIdFilter.MDC_KEY, "req-42");
        CompletableFuture<String> seen = new CompletableFuture<>();

        // When
        executor.execute(() -> seen.complete(MDC.get(RequestIdFilter.MDC_KEY)));

        // Then
        assertEquals("req-42", seen.get(5, TimeUnit.SECONDS));
    }
}
