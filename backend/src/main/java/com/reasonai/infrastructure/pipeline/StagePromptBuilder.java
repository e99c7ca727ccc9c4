package com.reasonai.infrastructure.pipeline;

import com.reasonai.domain.reasoning.model.PipelineRequest;
import com.reasonai.domain.reasoning.model.StageOutput;
import com.reasonai.domain.reasoning.model.StageType;
import com.reasonai.infrastructure.pipeline.stage.PerspectiveFraming;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the prompts the reasoning stages send to the agent.
 */
@Component
public class StagePromptBuilder {

    static final int OUTPUT_PREVIEW_CHARS = 500;

    // ===== Preprocessing =====

    public String buildPreprocessingPrompt(PipelineRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a preprocessing agent for a reasoning pipeline.\n");
        sb.append("Your task is to validate, normalize, and prepare the following input for reasoning:\n");
        sb.append("\nInput: ").append(request.prompt()).append("\n");

        if (request.hasContext()) {
            sb.append("\nContext: ").append(request.context()).append("\n");
        }
        if (!request.constraints().isEmpty()) {
            sb.append("\nConstraints:\n").append(formatConstraints(request.constraints())).append("\n");
        }

        sb.append("\nProvide a clear, well-structured version of this task that will be ")
                .append("easier for downstream reasoning stages to process.");
        return sb.toString();
    }

    // ===== Working awareness =====

    public String buildPerspectivePrompt(PerspectiveFraming framing, String input) {
        return framing.instruction() + "\n" + input;
    }

    // ===== Compaction =====

    /**
     * Number the outputs so the compactor can tell where one ends and the next begins.
     */
    public String buildCompactionInput(List<String> outputs) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < outputs.size(); i++) {
            if (i > 0) sb.append("\n\n");
            sb.append("--- Output ").append(i + 1).append(" ---\n").append(outputs.get(i));
        }
        return sb.toString();
    }

    // ===== Final response =====

    public String buildSynthesisPrompt(PipelineRequest request, Map<StageType, StageOutput> upstream) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are synthesizing the final response for a reasoning pipeline.\n");
        sb.append("\nOriginal request: ").append(request.prompt()).append("\n");

        if (request.hasContext()) {
            sb.append("\nContext: ").append(request.context()).append("\n");
        }

        sb.append("\nIntermediate results from the pipeline:\n");
        for (StageType type : StageType.values()) {
            StageOutput output = upstream.get(type);
            if (output == null || type == StageType.FINAL_RESPONSE) continue;
            sb.append("\n").append(type.displayName()).append(":\n").append(preview(output.asText())).append("\n");
        }

        sb.append("\nProvide a clear, comprehensive final answer that synthesizes all the reasoning above. ")
                .append("Be concise but complete, and ensure the response directly addresses the original request.");

        if (!request.constraints().isEmpty()) {
            sb.append("\n\nEnsure your response satisfies these constraints:\n")
                    .append(formatConstraints(request.constraints()));
        }
        return sb.toString();
    }

    static String preview(String text) {
        if (text.length() <= OUTPUT_PREVIEW_CHARS) return text;
        return text.substring(0, OUTPUT_PREVIEW_CHARS) + "...";
    }

    private static String formatConstraints(List<String> constraints) {
        return constraints.stream()
                .map(c -> "- " + c)
                .collect(Collectors.joining("\n"));
    }
}
