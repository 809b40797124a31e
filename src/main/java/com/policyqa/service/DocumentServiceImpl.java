package com.policyqa.service;

import com.policyqa.config.IndexingProperties;
import com.policyqa.controller.DocumentResponse;
import com.policyqa.event.DocumentUploadedEvent;
import com.policyqa.exception.DocumentNotFoundException;
import com.policyqa.exception.DocumentTooLargeException;
import com.policyqa.exception.InvalidQueryException;
import com.policyqa.exception.UnsupportedContentTypeException;
import com.policyqa.infra.DocumentStorage;
import com.policyqa.model.Document;
import com.policyqa.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private final DocumentRepository documentRepository;
    private final DocumentStorage storage;
    private final IndexingProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public DocumentResponse upload(Long ownerId, String filename, String contentType, byte[] content) {
        if (contentType == null || !properties.isAllowed(contentType)) {
            throw new UnsupportedContentTypeException(contentType);
        }
        long size = content == null ? 0 : content.length;
        if (size > properties.maxDocumentBytes()) {
            throw new DocumentTooLargeException(size, properties.maxDocumentBytes());
        }

        log.debug("Uploading document for owner {}: {} ({} bytes)", ownerId, filename, size);

        Document saved = documentRepository.save(
            Document.pending(ownerId, filename, IndexingProperties.baseType(contentType), size));

        String storageRef = storage.store(saved.id(), filename, content == null ? new byte[0] : content);
        documentRepository.updateStorageRef(saved.id(), storageRef);

        eventPublisher.publishEvent(new DocumentUploadedEvent(saved.id()));

        return DocumentResponse.from(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public DocumentResponse getById(Long ownerId, Long id) {
        return DocumentResponse.from(findOwned(ownerId, id));
    }

    @Override
    @Transactional(readOnly = true)
    public List<DocumentResponse> list(Long ownerId) {
        return documentRepository.findByOwner(ownerId).stream()
            .map(DocumentResponse::from)
            .toList();
    }

    @Override
    @Transactional
    public void delete(Long ownerId, Long id) {
        Document document = findOwned(ownerId, id);
        documentRepository.delete(id);
        log.info("Deleted document {} with its chunks", id);

        if (document.storageRef() != null) {
            try {
                storage.delete(document.storageRef());
            } catch (UncheckedIOException e) {
                log.warn("Stored bytes for document {} could not be removed: {}", id, e.getMessage());
            }
        }
    }

    @Override
    @Transactional(readOnly = true)
    public void requireOwned(Long ownerId, Collection<Long> documentIds) {
        if (documentIds == null || documentIds.isEmpty()) {
            return;
        }
        documentIds.stream()
            .filter(id -> id == null || id <= 0)
            .findFirst()
            .ifPresent(id -> {
                throw new InvalidQueryException("Invalid document id: " + id);
            });

        Map<Long, Document> found = documentRepository.findByIds(documentIds).stream()
            .collect(Collectors.toMap(Document::id, Function.identity()));

        for (Long id : documentIds) {
            Document document = found.get(id);
            if (document == null || !document.ownerId().equals(ownerId)) {
                log.warn("Document {} not found for owner {}", id, ownerId);
                throw new DocumentNotFoundException(id);
            }
        }
    }

    private Document findOwned(Long ownerId, Long id) {
        return documentRepository.findById(id)
            .filter(doc -> doc.ownerId().equals(ownerId))
            .orElseThrow(() -> {
                log.warn("Document not found with ID: {}", id);
                return new DocumentNotFoundException(id);
            });
    }
}
