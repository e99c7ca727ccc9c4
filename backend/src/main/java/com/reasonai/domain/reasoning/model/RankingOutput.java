package com.reasonai.domain.reasoning.model;

import java.util.List;

/**
 * Candidates ordered best first. The top document is what downstream stages read.
 */
public record RankingOutput(List<RankedDocument> ranked) implements StageOutput {

    public RankingOutput {
        if (ranked == null || ranked.isEmpty()) {
            throw new IllegalArgumentException("RankingOutput needs at least one document");
        }
        ranked = List.copyOf(ranked);
    }

    public RankedDocument top() {
        return ranked.get(0);
    }

    @Override
    public String asText() {
        return top().document();
    }
}
