package com.policyqa.listener;

import com.policyqa.event.DocumentUploadedEvent;
import com.policyqa.indexing.DocumentIndexer;
import com.policyqa.indexing.IndexingOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@Slf4j
@RequiredArgsConstructor
public class DocumentEventListener {

    private final DocumentIndexer documentIndexer;

    @Async("indexingTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleDocumentUploaded(DocumentUploadedEvent event) {
        log.info("Starting async indexing for doc: {}", event.documentId());
        IndexingOutcome outcome = documentIndexer.index(event.documentId());
        log.info("Indexing of doc {} finished: {}", event.documentId(), outcome);
    }
}
