package com.reasonai.infrastructure.pipeline;

import com.reasonai.domain.reasoning.model.PipelineRequest;
import com.reasonai.domain.reasoning.model.StageOutput;
import com.reasonai.domain.reasoning.model.StageResult;
import com.reasonai.domain.reasoning.model.StageType;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run context passed through pipeline stages.
 * <p>
 * Created once by {@link ReasoningPipeline#process} and owned by that run only.
 * Results and shared data are append-only and written by the orchestrator after each
 * stage returns; stages only read.
 * </p>
 */
@Getter
public class StageContext {

    private final PipelineRequest request;
    private final boolean cacheEnabled;
    private final CancellationToken cancellation;

    @Getter(AccessLevel.NONE)
    private final List<StageResult> previousResults = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Map<StageType, StageOutput> sharedData = new EnumMap<>(StageType.class);

    public StageContext(PipelineRequest request, boolean cacheEnabled, CancellationToken cancellation) {
        this.request = request;
        this.cacheEnabled = cacheEnabled;
        this.cancellation = cancellation;
    }

    public List<StageResult> getPreviousResults() {
        return Collections.unmodifiableList(previousResults);
    }

    public Map<StageType, StageOutput> getSharedData() {
        return Collections.unmodifiableMap(sharedData);
    }

    public Optional<StageOutput> output(StageType type) {
        return Optional.ofNullable(sharedData.get(type));
    }

    public <T extends StageOutput> Optional<T> output(StageType type, Class<T> outputType) {
        return output(type).filter(outputType::isInstance).map(outputType::cast);
    }

    /**
     * Text of the latest completed stage, if any stage completed so far.
     */
    public Optional<String> latestCompletedText() {
        for (int i = previousResults.size() - 1; i >= 0; i--) {
            StageResult result = previousResults.get(i);
            if (result.isCompleted() && result.output() != null) {
                return Optional.ofNullable(result.output().asText());
            }
        }
        return Optional.empty();
    }

    /**
     * Append a stage result and, when it completed, publish its output under its stage key.
     * Called by the orchestrator once per stage.
     */
    public void record(StageResult result) {
        if (previousResults.stream().anyMatch(r -> r.stageType() == result.stageType())) {
            throw new IllegalStateException("Stage " + result.stageType() + " already recorded for this run");
        }
        previousResults.add(result);
        if (result.isCompleted()) {
            sharedData.put(result.stageType(), result.output());
        }
    }
}
