package com.reasonai.infrastructure.pipeline.stage;

import com.reasonai.domain.reasoning.model.CompactionOutput;
import com.reasonai.domain.reasoning.model.PerspectivesOutput;
import com.reasonai.domain.reasoning.model.RankedDocument;
import com.reasonai.domain.reasoning.model.RankingOutput;
import com.reasonai.domain.reasoning.model.StageOutput;
import com.reasonai.domain.reasoning.model.StageType;
import com.reasonai.domain.reasoning.service.Reranker;
import com.reasonai.infrastructure.pipeline.Deadline;
import com.reasonai.infrastructure.pipeline.StageContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders candidate answers (individual perspectives plus the compacted text) by relevance
 * to the request prompt.
 */
@Slf4j
public class RerankingStage extends AbstractStage {

    private final Reranker reranker;

    public RerankingStage(Reranker reranker, boolean enabled, StageRuntime runtime) {
        super(StageType.RERANKING, enabled, runtime);
        this.reranker = reranker;
    }

    @Override
    protected StageOutput process(StageContext context, Deadline deadline) {
        List<String> candidates = candidates(context);
        log.debug("Extracted {} candidates for reranking", candidates.size());

        if (candidates.size() == 1) {
            log.info("Only one candidate, no reranking needed");
            return new RankingOutput(List.of(new RankedDocument(candidates.get(0), 1.0)));
        }

        String query = context.getRequest().prompt();
        List<RankedDocument> ranked = call(context, deadline, () -> reranker.rerank(query, candidates));

        List<RankedDocument> usable = ranked == null ? List.of() : ranked.stream()
                .filter(doc -> doc != null && doc.document() != null)
                .toList();
        if (usable.isEmpty()) {
            log.warn("Reranker returned no usable results for {} candidates, keeping the first candidate",
                    candidates.size());
            return new RankingOutput(List.of(new RankedDocument(candidates.get(0), 0.0)));
        }
        if (usable.size() < ranked.size()) {
            log.warn("Dropped {} reranked entries without a document", ranked.size() - usable.size());
        }

        List<RankedDocument> ordered = usable.stream()
                .sorted(Comparator.comparingDouble(RankedDocument::score).reversed())
                .toList();
        log.info("Reranking complete, top score {} from {} candidates",
                String.format("%.3f", ordered.get(0).score()), candidates.size());
        return new RankingOutput(ordered);
    }

    private static List<String> candidates(StageContext context) {
        List<String> candidates = new ArrayList<>();
        context.output(StageType.WORKING_AWARENESS, PerspectivesOutput.class)
                .ifPresent(p -> candidates.addAll(p.texts()));
        context.output(StageType.COMPACTION, CompactionOutput.class)
                .filter(CompactionOutput::compacted)
                .ifPresent(c -> candidates.add(c.text()));

        if (candidates.isEmpty()) {
            context.getSharedData().values().forEach(o -> candidates.add(o.asText()));
        }
        if (candidates.isEmpty()) {
            candidates.add(context.getRequest().prompt());
        }
        return candidates;
    }
}
