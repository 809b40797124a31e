package com.policyqa.indexing;

import com.policyqa.config.IndexingProperties;
import com.policyqa.exception.DocumentNotFoundException;
import com.policyqa.infra.DocumentStorage;
import com.policyqa.model.ChunkDraft;
import com.policyqa.model.Document;
import com.policyqa.repository.ChunkRepository;
import com.policyqa.repository.DocumentRepository;
import com.policyqa.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns one uploaded document into embedded chunks.
 * <p>
 * Status moves {@code PENDING -> PROCESSING -> COMPLETED | FAILED} and never back. Chunks and the
 * completed status are written in one transaction, so a document is either fully searchable or not at all.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentIndexer {

    public static final String UNEXTRACTABLE = "unextractable";
    private static final int MAX_REASON_LENGTH = 500;

    private final DocumentRepository documentRepository;
    private final ChunkRepository chunkRepository;
    private final DocumentStorage storage;
    private final TextExtractor textExtractor;
    private final PolicyChunker chunker;
    private final EmbeddingService embeddingService;
    private final IndexingProperties properties;
    private final TransactionTemplate transactionTemplate;

    public IndexingOutcome index(Long documentId) {
        if (!documentRepository.claimForIndexing(documentId)) {
            log.info("Doc {}: not pending, skipping indexing", documentId);
            return IndexingOutcome.SKIPPED;
        }

        try {
            Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

            byte[] content = storage.load(document.storageRef());
            List<ExtractedPage> pages = textExtractor.extract(content, document.contentType());
            List<PolicyChunker.PageChunk> pieces = chunker.split(pages);

            if (pieces.isEmpty()) {
                log.warn("Doc {}: no extractable text in {} ({})", documentId, document.filename(), document.contentType());
                documentRepository.markFailed(documentId, UNEXTRACTABLE);
                return IndexingOutcome.FAILED;
            }

            log.info("Doc {}: {} pages extracted, {} chunks to embed", documentId, pages.size(), pieces.size());
            List<ChunkDraft> drafts = embed(pieces);

            transactionTemplate.executeWithoutResult(tx -> {
                chunkRepository.saveChunks(documentId, drafts);
                if (!documentRepository.markCompleted(documentId)) {
                    throw new IllegalStateException("Document " + documentId + " left processing during indexing");
                }
            });

            log.info("Doc {}: indexing completed with {} chunks", documentId, drafts.size());
            return IndexingOutcome.COMPLETED;

        } catch (Exception e) {
            log.error("Doc {}: indexing failed", documentId, e);
            documentRepository.markFailed(documentId, reason(e));
            return IndexingOutcome.FAILED;
        }
    }

    private List<ChunkDraft> embed(List<PolicyChunker.PageChunk> pieces) {
        List<ChunkDraft> drafts = new ArrayList<>(pieces.size());
        int batchSize = properties.embeddingBatchSize();

        for (int from = 0; from < pieces.size(); from += batchSize) {
            List<PolicyChunker.PageChunk> batch = pieces.subList(from, Math.min(from + batchSize, pieces.size()));
            List<float[]> vectors = embeddingService.embedAll(batch.stream().map(PolicyChunker.PageChunk::text).toList());

            for (int i = 0; i < batch.size(); i++) {
                PolicyChunker.PageChunk piece = batch.get(i);
                drafts.add(new ChunkDraft(
                    piece.ordinal(),
                    piece.page(),
                    piece.section(),
                    piece.category(),
                    piece.text(),
                    vectors.get(i)
                ));
            }
        }
        return drafts;
    }

    private static String reason(Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return message.length() > MAX_REASON_LENGTH ? message.substring(0, MAX_REASON_LENGTH) : message;
    }
}
