package com.reasonai.infrastructure.ai;

import com.reasonai.domain.reasoning.model.RankedDocument;
import com.reasonai.domain.reasoning.service.Reranker;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reranker scoring candidates by term overlap with the query (cosine similarity of term
 * frequencies). Near-duplicate candidates are dropped first, then candidates below the
 * minimum score. Ties keep their input order.
 */
@Slf4j
public class LexicalReranker implements Reranker {

    public static final double DEFAULT_MIN_SCORE = 0.0;
    public static final double DEFAULT_REDUNDANCY_THRESHOLD = 0.95;

    private static final Pattern TERM = Pattern.compile("[\\p{L}\\p{N}]+");

    private final double minScore;
    private final double redundancyThreshold;

    public LexicalReranker() {
        this(DEFAULT_MIN_SCORE, DEFAULT_REDUNDANCY_THRESHOLD);
    }

    public LexicalReranker(double minScore, double redundancyThreshold) {
        if (minScore < 0 || minScore > 1) {
            throw new IllegalArgumentException("minScore must be within [0, 1], got " + minScore);
        }
        if (redundancyThreshold <= 0 || redundancyThreshold > 1) {
            throw new IllegalArgumentException("redundancyThreshold must be within (0, 1], got " + redundancyThreshold);
        }
        this.minScore = minScore;
        this.redundancyThreshold = redundancyThreshold;
    }

    @Override
    public List<RankedDocument> rerank(String query, List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> queryTerms = termFrequencies(query);

        List<Map<String, Integer>> kept = new ArrayList<>();
        List<RankedDocument> scored = new ArrayList<>();
        int redundant = 0;

        for (String candidate : candidates) {
            Map<String, Integer> terms = termFrequencies(candidate);
            if (isRedundant(terms, kept)) {
                redundant++;
                continue;
            }
            kept.add(terms);

            double score = cosine(queryTerms, terms);
            if (score >= minScore) {
                scored.add(new RankedDocument(candidate, score));
            }
        }

        // List.sort is stable, so equal scores keep input order
        scored.sort(Comparator.comparingDouble(RankedDocument::score).reversed());
        log.debug("Reranked {} candidates: {} redundant, {} below min score {}",
                candidates.size(), redundant, candidates.size() - redundant - scored.size(), minScore);
        return scored;
    }

    private boolean isRedundant(Map<String, Integer> terms, List<Map<String, Integer>> kept) {
        for (Map<String, Integer> other : kept) {
            if (cosine(terms, other) >= redundancyThreshold) {
                return true;
            }
        }
        return false;
    }

    static Map<String, Integer> termFrequencies(String text) {
        Map<String, Integer> frequencies = new HashMap<>();
        if (text == null) {
            return frequencies;
        }
        Matcher matcher = TERM.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            frequencies.merge(matcher.group(), 1, Integer::sum);
        }
        return frequencies;
    }

    static double cosine(Map<String, Integer> a, Map<String, Integer> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        double dot = 0;
        for (Map.Entry<String, Integer> entry : a.entrySet()) {
            Integer other = b.get(entry.getKey());
            if (other != null) {
                dot += entry.getValue() * (double) other;
            }
        }
        return dot / (norm(a) * norm(b));
    }

    private static double norm(Map<String, Integer> terms) {
        double sum = 0;
        for (int count : terms.values()) {
            sum += (double) count * count;
        }
        return Math.sqrt(sum);
    }
}
