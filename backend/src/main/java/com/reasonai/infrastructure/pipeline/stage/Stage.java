package com.reasonai.infrastructure.pipeline.stage;

import com.reasonai.domain.reasoning.model.StageResult;
import com.reasonai.domain.reasoning.model.StageType;
import com.reasonai.infrastructure.pipeline.Deadline;
import com.reasonai.infrastructure.pipeline.StageContext;

/**
 * One unit of work in the reasoning pipeline.
 * Instances hold no per-run state and are shared by concurrent runs.
 */
public interface Stage {

    StageType type();

    boolean isEnabled();

    /**
     * Run the stage against the current context.
     * Recoverable faults come back as a FAILED result and are never thrown.
     *
     * @param context  the run's context, read-only for stages
     * @param deadline time by which the stage must finish
     * @return a terminal result for this stage
     */
    StageResult execute(StageContext context, Deadline deadline);
}
