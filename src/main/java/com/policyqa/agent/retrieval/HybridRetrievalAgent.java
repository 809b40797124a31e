package com.policyqa.agent.retrieval;

import com.policyqa.agent.ProcedureCatalog;
import com.policyqa.config.RetrievalProperties;
import com.policyqa.model.ChunkMatch;
import com.policyqa.model.Document;
import com.policyqa.model.DocumentStatus;
import com.policyqa.model.ParsedQuery;
import com.policyqa.model.QueryAttribute;
import com.policyqa.model.RetrievalResult;
import com.policyqa.model.RetrievedChunk;
import com.policyqa.repository.ChunkRepository;
import com.policyqa.repository.DocumentRepository;
import com.policyqa.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Blends cosine similarity of the query embedding with overlap on the parsed attributes.
 * <p>
 * {@code score = vector + (1 - vector) * keywordWeight * keyword}, where {@code keyword} is the share of
 * attribute groups (procedure vocabulary, location) the chunk mentions. Keyword overlap can only raise a
 * chunk's score, and the result stays in [0, 1].
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HybridRetrievalAgent implements RetrievalAgent {

    private final DocumentRepository documentRepository;
    private final ChunkRepository chunkRepository;
    private final EmbeddingService embeddingService;
    private final ProcedureCatalog procedureCatalog;
    private final RetrievalProperties properties;

    record KeywordGroup(QueryAttribute attribute, List<String> terms) {}

    @Override
    public RetrievalResult retrieve(ParsedQuery query, RetrievalScope scope) {
        List<Long> universe = searchableDocuments(scope);
        if (universe.isEmpty()) {
            log.debug("No completed documents in scope for owner {}", scope.ownerId());
            return new RetrievalResult(List.of(), List.of());
        }

        float[] vector = embeddingService.embedQuery(query.rawText());
        List<KeywordGroup> groups = keywordGroups(query);

        Map<Long, ChunkMatch> candidates = new LinkedHashMap<>();
        chunkRepository.findNearest(vector, universe, properties.candidatePool())
            .forEach(match -> candidates.put(match.chunk().id(), match));

        List<String> allTerms = groups.stream()
            .flatMap(group -> group.terms().stream())
            .distinct()
            .toList();
        if (!allTerms.isEmpty()) {
            chunkRepository.findByKeywords(vector, allTerms, universe, properties.candidatePool())
                .forEach(match -> candidates.putIfAbsent(match.chunk().id(), match));
        }

        List<RetrievedChunk> ranked = candidates.values().stream()
            .map(match -> score(match, groups))
            .sorted(RetrievedChunk.RANKING)
            .limit(properties.topK())
            .toList();

        log.debug("Retrieved {} of {} candidates from {} documents", ranked.size(), candidates.size(), universe.size());
        return new RetrievalResult(universe, ranked);
    }

    private List<Long> searchableDocuments(RetrievalScope scope) {
        if (!scope.isExplicit()) {
            return documentRepository.findIdsByOwnerAndStatus(scope.ownerId(), DocumentStatus.COMPLETED);
        }
        return documentRepository.findByIds(scope.documentIds()).stream()
            .filter(doc -> doc.ownerId().equals(scope.ownerId()))
            .filter(doc -> doc.status() == DocumentStatus.COMPLETED)
            .map(Document::id)
            .sorted()
            .toList();
    }

    List<KeywordGroup> keywordGroups(ParsedQuery query) {
        List<KeywordGroup> groups = new ArrayList<>();
        query.procedure()
            .map(procedureCatalog::termsFor)
            .filter(terms -> !terms.isEmpty())
            .ifPresent(terms -> groups.add(new KeywordGroup(QueryAttribute.PROCEDURE, terms)));
        query.location()
            .map(location -> List.of(location.toLowerCase(Locale.ROOT)))
            .ifPresent(terms -> groups.add(new KeywordGroup(QueryAttribute.LOCATION, terms)));
        return groups;
    }

    private RetrievedChunk score(ChunkMatch match, List<KeywordGroup> groups) {
        double vectorScore = match.vectorScore();
        Set<String> matchedTerms = new LinkedHashSet<>();
        int matchedGroups = 0;

        for (KeywordGroup group : groups) {
            Optional<String> mention = ProcedureCatalog.firstMention(match.chunk().content(), group.terms());
            if (mention.isPresent()) {
                matchedGroups++;
                matchedTerms.add(mention.get());
            }
        }

        double keywordScore = groups.isEmpty() ? 0.0 : (double) matchedGroups / groups.size();
        double score = vectorScore + (1.0 - vectorScore) * properties.keywordWeight() * keywordScore;

        return new RetrievedChunk(
            match.chunk(),
            Math.max(0.0, Math.min(1.0, score)),
            vectorScore,
            keywordScore,
            List.copyOf(matchedTerms)
        );
    }
}
