package com.reasonai.infrastructure.pipeline;

/**
 * Invalid or contradictory {@link PipelineConfig}. Raised while the pipeline is built,
 * never during a run.
 */
public class PipelineConfigurationException extends RuntimeException {

    public PipelineConfigurationException(String message) {
        super(message);
    }
}
