package com.policyqa.indexing;

import com.policyqa.config.IndexingProperties;
import com.policyqa.model.ClauseCategory;
import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits extracted pages into overlapping chunks, keeping page number, section heading and clause category.
 * Ordinals are dense across the whole document.
 */
@Component
public class PolicyChunker {

    private final DocumentSplitter splitter;

    public PolicyChunker(IndexingProperties properties) {
        this.splitter = DocumentSplitters.recursive(properties.chunkSize(), properties.chunkOverlap());
    }

    public List<PageChunk> split(List<ExtractedPage> pages) {
        List<PageChunk> chunks = new ArrayList<>();
        for (ExtractedPage page : pages) {
            if (!page.hasText()) {
                continue;
            }
            List<SectionHeadings.Heading> headings = SectionHeadings.find(page.text());
            int searchFrom = 0;
            for (TextSegment segment : splitter.split(Document.from(page.text()))) {
                String text = segment.text().strip();
                if (text.isEmpty()) {
                    continue;
                }
                int position = page.text().indexOf(text, searchFrom);
                if (position >= 0) {
                    searchFrom = position + 1;
                } else {
                    position = searchFrom;
                }
                chunks.add(new PageChunk(
                    chunks.size(),
                    page.pageNumber(),
                    SectionHeadings.at(headings, position),
                    ClauseCategory.classify(text),
                    text
                ));
            }
        }
        return chunks;
    }

    public record PageChunk(int ordinal, int page, String section, ClauseCategory category, String text) {}
}
