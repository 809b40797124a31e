package com.policyqa.indexing;

public record ExtractedPage(int pageNumber, String text) {

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
