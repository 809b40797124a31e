package com.policyqa.controller;

import com.policyqa.service.DocumentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService documentService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DocumentResponse> uploadDocument(
        @RequestHeader(QueryController.USER_HEADER) Long userId,
        @RequestPart("file") MultipartFile file) throws IOException {

        DocumentResponse response = documentService.upload(
            userId,
            file.getOriginalFilename(),
            file.getContentType(),
            file.getBytes()
        );

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<DocumentResponse>> listDocuments(@RequestHeader(QueryController.USER_HEADER) Long userId) {
        return ResponseEntity.ok(documentService.list(userId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentResponse> getDocument(
        @RequestHeader(QueryController.USER_HEADER) Long userId,
        @PathVariable Long id) {
        return ResponseEntity.ok(documentService.getById(userId, id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDocument(
        @RequestHeader(QueryController.USER_HEADER) Long userId,
        @PathVariable Long id) {
        documentService.delete(userId, id);
        return ResponseEntity.noContent().build();
    }
}
