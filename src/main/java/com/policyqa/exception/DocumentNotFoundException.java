package com.policyqa.exception;

public class DocumentNotFoundException extends EntityNotFoundException {

    public DocumentNotFoundException(Long documentId) {
        super("Document", documentId);
    }
}
