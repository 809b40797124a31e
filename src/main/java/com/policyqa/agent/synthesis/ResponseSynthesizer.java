package com.policyqa.agent.synthesis;

import com.policyqa.exception.CitationIntegrityException;
import com.policyqa.model.ClauseEvidence;
import com.policyqa.model.Decision;
import com.policyqa.model.EvaluationDraft;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.RetrievedChunk;
import com.policyqa.model.RuleOutcome;
import com.policyqa.model.SourceCitation;
import com.policyqa.model.StructuredResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Renders an evaluation draft into the fixed response schema. Citations are exactly the chunks the rule trace
 * relied on, in the order rules first cite them; a chunk outside the retrieval set is an internal error.
 */
@Slf4j
@Component
public class ResponseSynthesizer {

    static final String DISCLAIMER = "This assessment is based only on the retrieved policy clauses.";
    private static final int MAX_FALLBACK_QUOTE = 300;

    public StructuredResponse synthesize(EvaluationDraft draft, RetrievalResult retrieval) {
        List<SourceCitation> sources = citations(draft.trace(), retrieval);
        return new StructuredResponse(
            draft.decision(),
            draft.decision() == Decision.APPROVED ? draft.amount() : null,
            justification(draft),
            sources,
            draft.confidence(),
            0L
        );
    }

    /**
     * Response for a query cut short by the time budget or a failing dependency, citing whatever was retrieved.
     */
    public StructuredResponse fallback(RetrievalResult partial, String reason, int maxSources) {
        List<SourceCitation> sources = partial.chunks().stream()
            .limit(maxSources)
            .map(chunk -> new SourceCitation(chunk.documentId(), chunk.chunkId(),
                abbreviate(chunk.chunk().content()), chunk.chunk().page()))
            .toList();

        String justification = "More information is required: " + reason + " " + DISCLAIMER;
        return new StructuredResponse(Decision.REQUIRES_MORE_INFO, null, justification, sources, 0.0, 0L);
    }

    List<SourceCitation> citations(List<RuleOutcome> trace, RetrievalResult retrieval) {
        Set<Long> retrieved = retrieval.chunkIds();
        Set<Long> seen = new LinkedHashSet<>();
        List<SourceCitation> citations = new ArrayList<>();

        for (RuleOutcome outcome : trace) {
            for (ClauseEvidence evidence : outcome.evidence()) {
                RetrievedChunk chunk = evidence.chunk();
                if (!retrieved.contains(chunk.chunkId())) {
                    log.error("Rule {} cited chunk {} which was not retrieved", outcome.ruleId(), chunk.chunkId());
                    throw new CitationIntegrityException(chunk.chunkId());
                }
                if (seen.add(chunk.chunkId())) {
                    citations.add(new SourceCitation(chunk.documentId(), chunk.chunkId(), evidence.quote(),
                        chunk.chunk().page()));
                }
            }
        }
        return citations;
    }

    String justification(EvaluationDraft draft) {
        StringBuilder text = new StringBuilder(headline(draft));
        for (RuleOutcome outcome : draft.trace()) {
            text.append('\n')
                .append("- ").append(outcome.ruleId()).append(": ")
                .append(outcome.verdict().name().toLowerCase(Locale.ROOT).replace('_', ' '));
            if (outcome.isApplicable()) {
                text.append(String.format(Locale.ROOT, " (%.2f)", outcome.confidence()));
            }
            text.append(". ").append(outcome.explanation());
        }
        return text.append('\n').append(DISCLAIMER).toString();
    }

    private static String headline(EvaluationDraft draft) {
        return switch (draft.decision()) {
            case APPROVED -> "Approved: every applicable coverage condition is met. Payable amount: "
                + draft.amount().toPlainString() + ".";
            case REJECTED -> "Rejected: a coverage condition is not met.";
            case REQUIRES_MORE_INFO -> "More information is required: the retrieved policy clauses do not settle "
                + "every coverage condition.";
        };
    }

    private static String abbreviate(String content) {
        String text = content.strip();
        return text.length() <= MAX_FALLBACK_QUOTE ? text : text.substring(0, MAX_FALLBACK_QUOTE) + "...";
    }
}
