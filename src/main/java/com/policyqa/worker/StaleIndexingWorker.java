package com.policyqa.worker;

import com.policyqa.config.IndexingProperties;
import com.policyqa.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fails documents whose indexing task died mid-way (process restart, lost thread). A new upload is needed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StaleIndexingWorker {

    public static final String STALE = "stale";

    private final DocumentRepository documentRepository;
    private final IndexingProperties properties;

    @Scheduled(fixedDelayString = "${app.indexing.maintenance-interval-ms:60000}")
    public void failStaleDocuments() {
        log.debug("Starting maintenance: checking for documents stuck in processing...");

        List<Long> failedIds = documentRepository.failStaleProcessing(properties.staleThresholdMinutes(), STALE);

        if (failedIds.isEmpty()) {
            return;
        }

        log.warn("Maintenance marked {} stale documents as failed: {}", failedIds.size(), failedIds);
    }
}
