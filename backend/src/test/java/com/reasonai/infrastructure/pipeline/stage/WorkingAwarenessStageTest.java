package com.reasonai.infrastructure.pipeline.stage;

import com.reasonai.domain.reasoning.model.AgentPayload;
import com.reasonai.domain.reasoning.model.AgentResponse;
import com.reasonai.domain.reasoning.model.Perspective;
import com.reasonai.domain.reasoning.model.PerspectivesOutput;
import com.reasonai.domain.reasoning.model.StageError;
import com.reasonai.domain.reasoning.model.StageOutput;
import com.reasonai.domain.reasoning.model.StageResult;
import com.reasonai.domain.reasoning.model.StageStatus;
import com.reasonai.domain.reasoning.model.StageType;
import com.reasonai.domain.reasoning.model.TextOutput;
import com.reasonai.domain.reasoning.service.ReasoningAgent;
import com.reasonai.infrastructure.ai.AiReasoningException;
import com.reasonai.infrastructure.cache.MemoryCache;
import com.reasonai.infrastructure.pipeline.Deadline;
import com.reasonai.infrastructure.pipeline.StageContext;
import com.reasonai.infrastructure.pipeline.StagePromptBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkingAwarenessStageTest {

    @Mock
    private ReasoningAgent agent;

    private final StagePromptBuilder promptBuilder = new StagePromptBuilder();
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(5);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /** Answers with the framing's label; the logical framing answers last. */
    private void answerByFraming() {
        when(agent.execute(any())).thenAnswer(invocation -> {
            AgentPayload payload = invocation.getArgument(0);
            for (PerspectiveFraming framing : PerspectiveFraming.values()) {
                if (payload.prompt().startsWith(framing.instruction())) {
                    if (framing == PerspectiveFraming.LOGICAL) {
                        Thread.sleep(200);
                    }
                    return AgentResponse.of(framing.label() + " answer");
                }
            }
            throw new IllegalStateException("unknown framing");
        });
    }

    private WorkingAwarenessStage stage(int perspectives, boolean parallel) {
        return new WorkingAwarenessStage(agent, promptBuilder, perspectives, parallel, true,
                StageFixtures.runtime(executor));
    }

    @Nested
    @DisplayName("parallel fan-out")
    class Parallel {

        @Test
        @DisplayName("N perspectives make exactly N agent calls and keep index order")
        void orderedByIndex() {
            answerByFraming();

            StageResult result = stage(3, true).execute(StageFixtures.context("Explain recursion"), Deadline.none());

            assertThat(result.status()).isEqualTo(StageStatus.COMPLETED);
            PerspectivesOutput output = (PerspectivesOutput) result.output();
            assertThat(output.texts()).containsExactly("logical answer", "creative answer", "critical answer");
            assertThat(output.perspectives()).extracting(Perspective::index).containsExactly(0, 1, 2);
            verify(agent, times(3)).execute(any());
        }

        @Test
        @DisplayName("five perspectives use five distinct framings")
        void fivePerspectives() {
            answerByFraming();

            StageResult result = stage(5, true).execute(StageFixtures.context("Explain recursion"), Deadline.none());

            PerspectivesOutput output = (PerspectivesOutput) result.output();
            assertThat(output.perspectives()).extracting(Perspective::framing)
                    .containsExactly("logical", "creative", "critical", "practical", "simplifying");
        }

        @Test
        @DisplayName("one failing perspective is dropped, the rest complete the stage")
        void partialFailure() {
            when(agent.execute(any())).thenAnswer(invocation -> {
                AgentPayload payload = invocation.getArgument(0);
                if (payload.prompt().startsWith(PerspectiveFraming.CREATIVE.instruction())) {
                    throw new AiReasoningException("creative failed");
                }
                return AgentResponse.of("ok");
            });

            StageResult result = stage(3, true).execute(StageFixtures.context("Explain recursion"), Deadline.none());

            assertThat(result.status()).isEqualTo(StageStatus.COMPLETED);
            PerspectivesOutput output = (PerspectivesOutput) result.output();
            assertThat(output.perspectives()).extracting(Perspective::index).containsExactly(0, 2);
        }

        @Test
        @DisplayName("the stage fails when every perspective fails")
        void allFail() {
            when(agent.execute(any())).thenThrow(new AiReasoningException("down"));

            StageResult result = stage(3, true).execute(StageFixtures.context("Explain recursion"), Deadline.none());

            assertThat(result.status()).isEqualTo(StageStatus.FAILED);
            assertThat(result.error().kind()).isEqualTo(StageError.Kind.COLLABORATOR);
            assertThat(result.error().message()).contains("All 3 reasoning perspectives failed");
        }
    }

    @Nested
    @DisplayName("sequential execution")
    class Sequential {

        @Test
        @DisplayName("N perspectives make exactly N agent calls in index order")
        void sequentialCalls() {
            answerByFraming();

            StageResult result = stage(2, false).execute(StageFixtures.context("Explain recursion"), Deadline.none());

            PerspectivesOutput output = (PerspectivesOutput) result.output();
            assertThat(output.texts()).containsExactly("logical answer", "creative answer");
            verify(agent, times(2)).execute(any());
        }

        @Test
        @DisplayName("a failing perspective does not stop the following ones")
        void continuesAfterFailure() {
            when(agent.execute(any()))
                    .thenThrow(new AiReasoningException("first failed"))
                    .thenReturn(AgentResponse.of("second"));

            StageResult result = stage(2, false).execute(StageFixtures.context("Explain recursion"), Deadline.none());

            PerspectivesOutput output = (PerspectivesOutput) result.output();
            assertThat(output.perspectives()).extracting(Perspective::index).containsExactly(1);
            assertThat(output.texts()).containsExactly("second");
        }
    }

    @Test
    @DisplayName("reasons over the preprocessing output when it is available")
    void usesPreprocessingOutput() {
        when(agent.execute(any())).thenReturn(AgentResponse.of("ok"));
        StageContext context = StageFixtures.context("Explain recursion");
        StageFixtures.publish(context, StageType.PREPROCESSING, new TextOutput("Normalized: recursion"));

        stage(1, true).execute(context, Deadline.none());

        ArgumentCaptor<AgentPayload> payload = ArgumentCaptor.forClass(AgentPayload.class);
        verify(agent).execute(payload.capture());
        assertThat(payload.getValue().prompt())
                .startsWith(PerspectiveFraming.LOGICAL.instruction())
                .endsWith("Normalized: recursion");
        assertThat(payload.getValue().maxTokens()).isEqualTo(WorkingAwarenessStage.MAX_TOKENS);
    }

    @Test
    @DisplayName("only a complete perspective set is cached")
    void cachesOnlyCompleteSets() {
        MemoryCache<StageOutput> cache = new MemoryCache<>();
        WorkingAwarenessStage cached = new WorkingAwarenessStage(agent, promptBuilder, 3, false, true,
                StageFixtures.cachedRuntime(cache));
        when(agent.execute(any()))
                .thenThrow(new AiReasoningException("logical failed"))
                .thenReturn(AgentResponse.of("ok"));

        StageResult partial = cached.execute(StageFixtures.cachedContext("Explain recursion"), Deadline.none());
        assertThat(((PerspectivesOutput) partial.output()).perspectives()).hasSize(2);
        assertThat(cache.size()).isZero();

        StageResult complete = cached.execute(StageFixtures.cachedContext("Explain recursion"), Deadline.none());
        assertThat(complete.cacheHit()).isFalse();
        assertThat(((PerspectivesOutput) complete.output()).perspectives()).hasSize(3);
        assertThat(cache.size()).isEqualTo(1);

        StageResult reused = cached.execute(StageFixtures.cachedContext("Explain recursion"), Deadline.none());
        assertThat(reused.cacheHit()).isTrue();
        verify(agent, times(6)).execute(any());
    }

    @Test
    @DisplayName("disabled stage makes no agent calls")
    void disabled() {
        WorkingAwarenessStage stage = new WorkingAwarenessStage(agent, promptBuilder, 3, true, false,
                StageFixtures.runtime(executor));

        StageResult result = stage.execute(StageFixtures.context("Explain recursion"), Deadline.none());

        assertThat(result.status()).isEqualTo(StageStatus.SKIPPED);
        verifyNoInteractions(agent);
    }

    @Test
    @DisplayName("output text lists every perspective with its framing")
    void outputText() {
        PerspectivesOutput output = new PerspectivesOutput(List.of(
                new Perspective(1, "creative", "B"),
                new Perspective(0, "logical", "A")));

        assertThat(output.asText())
                .startsWith("Multiple reasoning perspectives:")
                .contains("Perspective 1 (logical):\nA")
                .contains("Perspective 2 (creative):\nB");
        assertThat(output.asText().indexOf("logical")).isLessThan(output.asText().indexOf("creative"));
    }
}
