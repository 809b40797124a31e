package com.policyqa.agent.evaluation;

import com.policyqa.agent.ProcedureCatalog;
import com.policyqa.model.ClauseEvidence;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.RetrievedChunk;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A single sentence of a retrieved chunk. Rules match against sentences so citations quote the exact clause.
 */
record ClauseSentence(RetrievedChunk chunk, String text) {

    // No break after abbreviations that precede an amount or a reference: "Rs. 3,00,000", "Sec. 4", "e.g. dental".
    private static final Pattern SENTENCE_BREAK = Pattern.compile(
        "(?<!\\b(?:rs|no|nos|sec|cl|art|para|approx|vs|viz|dr|e\\.g|i\\.e)\\.)(?<=[.!?;])\\s+|\\n+",
        Pattern.CASE_INSENSITIVE);

    static final List<String> NEGATIVE_MARKERS = List.of("not covered", "excluded", "exclusion", "not payable",
        "shall not", "does not cover", "will not cover", "not be covered", "not eligible", "not admissible");

    /**
     * Sentences of all retrieved chunks, in retrieval rank order.
     */
    static List<ClauseSentence> of(RetrievalResult evidence) {
        List<ClauseSentence> sentences = new ArrayList<>();
        for (RetrievedChunk chunk : evidence.chunks()) {
            for (String part : SENTENCE_BREAK.split(chunk.chunk().content())) {
                String sentence = part.strip();
                if (!sentence.isEmpty()) {
                    sentences.add(new ClauseSentence(chunk, sentence));
                }
            }
        }
        return sentences;
    }

    String lower() {
        return text.toLowerCase(Locale.ROOT);
    }

    boolean containsAny(List<String> markers) {
        String lower = lower();
        return markers.stream().anyMatch(lower::contains);
    }

    boolean isNegative() {
        return containsAny(NEGATIVE_MARKERS);
    }

    boolean mentions(List<String> terms) {
        return ProcedureCatalog.mentionsAny(text, terms);
    }

    ClauseEvidence toEvidence() {
        return new ClauseEvidence(chunk, text);
    }
}
