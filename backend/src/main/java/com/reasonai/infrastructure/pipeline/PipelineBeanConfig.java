package com.reasonai.infrastructure.pipeline;

import com.reasonai.domain.reasoning.model.CacheStrategy;
import com.reasonai.domain.reasoning.model.StageOutput;
import com.reasonai.domain.reasoning.service.Compactor;
import com.reasonai.domain.reasoning.service.ReasoningAgent;
import com.reasonai.domain.reasoning.service.Reranker;
import com.reasonai.infrastructure.ai.AgentCompactor;
import com.reasonai.infrastructure.ai.LexicalReranker;
import com.reasonai.infrastructure.cache.Cache;
import com.reasonai.infrastructure.cache.CacheKeyBuilder;
import com.reasonai.infrastructure.cache.MemoryCache;
import com.reasonai.infrastructure.observability.PipelineMetricsTracker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class PipelineBeanConfig {

    static final String PIPELINE_LOGGER = "com.reasonai.infrastructure.pipeline";

    @Value("${reasoning.pipeline.enable-preprocessing:true}")
    private boolean enablePreprocessing;

    @Value("${reasoning.pipeline.enable-working-awareness:true}")
    private boolean enableWorkingAwareness;

    @Value("${reasoning.pipeline.enable-compaction:true}")
    private boolean enableCompaction;

    @Value("${reasoning.pipeline.enable-reranking:true}")
    private boolean enableReranking;

    @Value("${reasoning.pipeline.enable-final-response:true}")
    private boolean enableFinalResponse;

    @Value("${reasoning.pipeline.parallel-execution:true}")
    private boolean parallelExecution;

    @Value("${reasoning.pipeline.num-perspectives:3}")
    private int numPerspectives;

    @Value("${reasoning.pipeline.timeout-seconds:60}")
    private double timeoutSeconds;

    @Value("${reasoning.pipeline.cache-strategy:MEMORY}")
    private CacheStrategy cacheStrategy;

    @Value("${reasoning.pipeline.cache-ttl-seconds:3600}")
    private long cacheTtlSeconds;

    @Value("${reasoning.pipeline.enable-metrics:true}")
    private boolean enableMetrics;

    @Value("${reasoning.pipeline.enable-tracing:false}")
    private boolean enableTracing;

    @Value("${reasoning.pipeline.log-level:INFO}")
    private String logLevel;

    @Value("${reasoning.compaction.template:}")
    private String compactionTemplate;

    @Value("${reasoning.reranking.min-score:0.0}")
    private double rerankMinScore;

    @Value("${reasoning.reranking.redundancy-threshold:0.95}")
    private double rerankRedundancyThreshold;

    @Bean
    public PipelineConfig pipelineConfig() {
        return PipelineConfig.builder()
                .enablePreprocessing(enablePreprocessing)
                .enableWorkingAwareness(enableWorkingAwareness)
                .enableCompaction(enableCompaction)
                .enableReranking(enableReranking)
                .enableFinalResponse(enableFinalResponse)
                .parallelExecution(parallelExecution)
                .numPerspectives(numPerspectives)
                .timeoutSeconds(timeoutSeconds)
                .cacheStrategy(cacheStrategy)
                .cacheTtlSeconds(cacheTtlSeconds)
                .enableMetrics(enableMetrics)
                .enableTracing(enableTracing)
                .logLevel(logLevel)
                .build();
    }

    @Bean
    public Cache<StageOutput> stageCache() {
        return new MemoryCache<>();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("reasoning-"));
    }

    @Bean
    public Compactor compactor(ReasoningAgent reasoningAgent) {
        return new AgentCompactor(reasoningAgent, compactionTemplate);
    }

    @Bean
    public Reranker reranker() {
        return new LexicalReranker(rerankMinScore, rerankRedundancyThreshold);
    }

    @Bean
    public ReasoningPipeline reasoningPipeline(ReasoningAgent reasoningAgent,
                                               PipelineConfig pipelineConfig,
                                               Compactor compactor,
                                               Reranker reranker,
                                               Cache<StageOutput> stageCache,
                                               ExecutorService pipelineExecutor,
                                               PipelineMetricsTracker metricsTracker,
                                               StagePromptBuilder promptBuilder,
                                               CacheKeyBuilder cacheKeyBuilder,
                                               ObjectProvider<LoggingSystem> loggingSystem) {
        LoggingSystem logging = loggingSystem.getIfAvailable();
        if (logging != null) {
            logging.setLogLevel(PIPELINE_LOGGER, pipelineConfig.resolvedLogLevel());
        }
        return ReasoningPipeline.builder()
                .agent(reasoningAgent)
                .config(pipelineConfig)
                .compactor(compactor)
                .reranker(reranker)
                .cache(stageCache)
                .executor(pipelineExecutor)
                .metricsTracker(metricsTracker)
                .promptBuilder(promptBuilder)
                .cacheKeyBuilder(cacheKeyBuilder)
                .build();
    }
}
