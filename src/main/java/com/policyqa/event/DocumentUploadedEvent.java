package com.policyqa.event;

public record DocumentUploadedEvent(Long documentId) {}
