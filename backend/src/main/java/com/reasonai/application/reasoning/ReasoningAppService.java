package com.reasonai.application.reasoning;

import com.reasonai.domain.reasoning.model.PipelineRequest;
import com.reasonai.domain.reasoning.model.PipelineResult;
import com.reasonai.infrastructure.pipeline.ReasoningPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReasoningAppService {

    private final ReasoningPipeline reasoningPipeline;

    /**
     * Full reasoning run via pipeline (preprocess → perspectives → compaction → reranking → final response).
     */
    public PipelineResult reason(String prompt,
                                 String context,
                                 List<String> constraints,
                                 Map<String, String> metadata,
                                 Integer maxTokens,
                                 Double temperature) {
        PipelineRequest request = new PipelineRequest(prompt, context, constraints, metadata, maxTokens, temperature);
        PipelineResult result = reasoningPipeline.process(request);

        if (result.hasFailures()) {
            log.warn("Reasoning run finished with failed stages: {}", result.stages().stream()
                    .filter(s -> s.isFailed())
                    .map(s -> s.error().message())
                    .toList());
        }
        return result;
    }
}
