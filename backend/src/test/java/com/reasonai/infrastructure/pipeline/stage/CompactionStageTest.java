package com.reasonai.infrastructure.pipeline.stage;

import com.reasonai.domain.reasoning.model.CompactionOutput;
import com.reasonai.domain.reasoning.model.Perspective;
import com.reasonai.domain.reasoning.model.PerspectivesOutput;
import com.reasonai.domain.reasoning.model.StageError;
import com.reasonai.domain.reasoning.model.StageResult;
import com.reasonai.domain.reasoning.model.StageStatus;
import com.reasonai.domain.reasoning.model.StageType;
import com.reasonai.domain.reasoning.model.TextOutput;
import com.reasonai.domain.reasoning.service.Compactor;
import com.reasonai.infrastructure.pipeline.Deadline;
import com.reasonai.infrastructure.pipeline.StageContext;
import com.reasonai.infrastructure.pipeline.StagePromptBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompactionStageTest {

    @Mock
    private Compactor compactor;

    private final StagePromptBuilder promptBuilder = new StagePromptBuilder();

    private CompactionStage stage(Compactor compactor) {
        return new CompactionStage(compactor, promptBuilder, true, StageFixtures.runtime());
    }

    private static StageContext contextWithReasoning() {
        StageContext context = StageFixtures.context("Explain recursion");
        StageFixtures.publish(context, StageType.PREPROCESSING, new TextOutput("task"));
        StageFixtures.publish(context, StageType.WORKING_AWARENESS, new PerspectivesOutput(List.of(
                new Perspective(0, "logical", "step by step"),
                new Perspective(1, "creative", "mirrors"))));
        return context;
    }

    @Test
    @DisplayName("without upstream outputs the request prompt passes through")
    void noInputs() {
        StageResult result = stage(compactor).execute(StageFixtures.context("Explain recursion"), Deadline.none());

        assertThat(result.status()).isEqualTo(StageStatus.COMPLETED);
        assertThat(result.output()).isEqualTo(new CompactionOutput("Explain recursion", 0, false));
        verifyNoInteractions(compactor);
    }

    @Test
    @DisplayName("a single upstream output passes through unchanged")
    void singleInput() {
        StageContext context = StageFixtures.context("Explain recursion");
        StageFixtures.publish(context, StageType.PREPROCESSING, new TextOutput("only one"));

        StageResult result = stage(compactor).execute(context, Deadline.none());

        assertThat(result.output()).isEqualTo(new CompactionOutput("only one", 1, false));
        verifyNoInteractions(compactor);
    }

    @Test
    @DisplayName("several outputs are numbered and handed to the compactor")
    void compacts() {
        when(compactor.compact(anyString())).thenReturn("consolidated");

        StageResult result = stage(compactor).execute(contextWithReasoning(), Deadline.none());

        assertThat(result.output()).isEqualTo(new CompactionOutput("consolidated", 3, true));
        ArgumentCaptor<String> input = ArgumentCaptor.forClass(String.class);
        verify(compactor).compact(input.capture());
        assertThat(input.getValue())
                .isEqualTo("--- Output 1 ---\ntask\n\n--- Output 2 ---\nstep by step\n\n--- Output 3 ---\nmirrors");
    }

    @Test
    @DisplayName("without a compactor the numbered outputs pass through uncompacted")
    void noCompactor() {
        StageResult result = stage(null).execute(contextWithReasoning(), Deadline.none());

        CompactionOutput output = (CompactionOutput) result.output();
        assertThat(output.compacted()).isFalse();
        assertThat(output.inputCount()).isEqualTo(3);
        assertThat(output.text()).startsWith("--- Output 1 ---\ntask");
    }

    @Test
    @DisplayName("compactor failure fails the stage")
    void compactorFailure() {
        when(compactor.compact(anyString())).thenThrow(new IllegalStateException("context window exceeded"));

        StageResult result = stage(compactor).execute(contextWithReasoning(), Deadline.none());

        assertThat(result.status()).isEqualTo(StageStatus.FAILED);
        assertThat(result.error().kind()).isEqualTo(StageError.Kind.COLLABORATOR);
        assertThat(result.error().message()).startsWith("Stage compaction failed:");
    }
}
