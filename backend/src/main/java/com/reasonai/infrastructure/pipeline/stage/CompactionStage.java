package com.reasonai.infrastructure.pipeline.stage;

import com.reasonai.domain.reasoning.model.CompactionOutput;
import com.reasonai.domain.reasoning.model.PerspectivesOutput;
import com.reasonai.domain.reasoning.model.StageOutput;
import com.reasonai.domain.reasoning.model.StageType;
import com.reasonai.domain.reasoning.service.Compactor;
import com.reasonai.infrastructure.pipeline.Deadline;
import com.reasonai.infrastructure.pipeline.StageContext;
import com.reasonai.infrastructure.pipeline.StagePromptBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Consolidates preprocessing and perspective outputs into one shorter text.
 * <p>
 * Pass-through policy: with zero or one input, or without a compactor, the input goes
 * through unchanged and the stage still completes ({@code compacted = false}).
 * </p>
 */
@Slf4j
public class CompactionStage extends AbstractStage {

    private final Compactor compactor;
    private final StagePromptBuilder promptBuilder;

    /**
     * @param compactor compaction collaborator, {@code null} selects pass-through
     */
    public CompactionStage(Compactor compactor, StagePromptBuilder promptBuilder,
                           boolean enabled, StageRuntime runtime) {
        super(StageType.COMPACTION, enabled, runtime);
        this.compactor = compactor;
        this.promptBuilder = promptBuilder;
    }

    @Override
    protected StageOutput process(StageContext context, Deadline deadline) {
        List<String> outputs = reasoningOutputs(context);
        log.debug("Extracted {} outputs to compact", outputs.size());

        if (outputs.isEmpty()) {
            log.info("No reasoning outputs to compact, passing the request prompt through");
            return new CompactionOutput(context.getRequest().prompt(), 0, false);
        }
        if (outputs.size() == 1) {
            log.info("Only one output, no compaction needed");
            return new CompactionOutput(outputs.get(0), 1, false);
        }

        String input = promptBuilder.buildCompactionInput(outputs);
        if (compactor == null) {
            log.info("No compactor configured, passing {} outputs through uncompacted", outputs.size());
            return new CompactionOutput(input, outputs.size(), false);
        }

        String compacted = call(context, deadline, () -> compactor.compact(input));
        log.info("Compaction complete, {} outputs reduced from {} to {} chars",
                outputs.size(), input.length(), compacted != null ? compacted.length() : 0);
        return new CompactionOutput(compacted != null ? compacted : "", outputs.size(), true);
    }

    private static List<String> reasoningOutputs(StageContext context) {
        List<String> outputs = new ArrayList<>();
        context.output(StageType.PREPROCESSING).ifPresent(o -> outputs.add(o.asText()));
        context.output(StageType.WORKING_AWARENESS, PerspectivesOutput.class)
                .ifPresent(p -> outputs.addAll(p.texts()));
        return outputs;
    }
}
