package com.reasonai.infrastructure.pipeline.stage;

import com.reasonai.domain.reasoning.model.CompactionOutput;
import com.reasonai.domain.reasoning.model.Perspective;
import com.reasonai.domain.reasoning.model.PerspectivesOutput;
import com.reasonai.domain.reasoning.model.RankedDocument;
import com.reasonai.domain.reasoning.model.RankingOutput;
import com.reasonai.domain.reasoning.model.StageError;
import com.reasonai.domain.reasoning.model.StageResult;
import com.reasonai.domain.reasoning.model.StageStatus;
import com.reasonai.domain.reasoning.model.StageType;
import com.reasonai.domain.reasoning.service.Reranker;
import com.reasonai.infrastructure.ai.AiReasoningException;
import com.reasonai.infrastructure.pipeline.Deadline;
import com.reasonai.infrastructure.pipeline.StageContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RerankingStageTest {

    @Mock
    private Reranker reranker;

    private RerankingStage stage() {
        return new RerankingStage(reranker, true, StageFixtures.runtime());
    }

    private static StageContext contextWithPerspectives(String... texts) {
        StageContext context = StageFixtures.context("Explain recursion");
        List<Perspective> perspectives = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            perspectives.add(new Perspective(i, "p" + i, texts[i]));
        }
        StageFixtures.publish(context, StageType.WORKING_AWARENESS, new PerspectivesOutput(perspectives));
        return context;
    }

    @Test
    @DisplayName("ranks perspectives and compacted text against the prompt, best first")
    void ranksCandidates() {
        StageContext context = contextWithPerspectives("a", "b");
        StageFixtures.publish(context, StageType.COMPACTION, new CompactionOutput("merged", 2, true));
        when(reranker.rerank(eq("Explain recursion"), eq(List.of("a", "b", "merged"))))
                .thenReturn(List.of(
                        new RankedDocument("a", 0.2),
                        new RankedDocument("merged", 0.9),
                        new RankedDocument("b", 0.5)));

        StageResult result = stage().execute(context, Deadline.none());

        RankingOutput output = (RankingOutput) result.output();
        assertThat(output.ranked()).extracting(RankedDocument::document).containsExactly("merged", "b", "a");
        assertThat(output.asText()).isEqualTo("merged");
    }

    @Test
    @DisplayName("uncompacted pass-through text is not a separate candidate")
    void ignoresPassThroughCompaction() {
        StageContext context = contextWithPerspectives("a", "b");
        StageFixtures.publish(context, StageType.COMPACTION, new CompactionOutput("a\n\nb", 2, false));
        when(reranker.rerank(anyString(), anyList())).thenReturn(List.of(new RankedDocument("b", 1.0)));

        stage().execute(context, Deadline.none());

        verify(reranker).rerank("Explain recursion", List.of("a", "b"));
    }

    @Test
    @DisplayName("entries without a document are dropped; none left keeps the first candidate")
    void dropsEntriesWithoutDocument() {
        List<RankedDocument> partlyBroken = new ArrayList<>();
        partlyBroken.add(new RankedDocument(null, 0.9));
        partlyBroken.add(null);
        partlyBroken.add(new RankedDocument("b", 0.4));
        when(reranker.rerank(anyString(), anyList()))
                .thenReturn(partlyBroken)
                .thenReturn(List.of(new RankedDocument(null, 0.9)));

        StageResult first = stage().execute(contextWithPerspectives("a", "b"), Deadline.none());
        StageResult second = stage().execute(contextWithPerspectives("a", "b"), Deadline.none());

        assertThat(((RankingOutput) first.output()).ranked()).containsExactly(new RankedDocument("b", 0.4));
        assertThat(second.status()).isEqualTo(StageStatus.COMPLETED);
        assertThat(((RankingOutput) second.output()).top()).isEqualTo(new RankedDocument("a", 0.0));
    }

    @Test
    @DisplayName("a single candidate is returned without calling the reranker")
    void singleCandidate() {
        StageResult result = stage().execute(contextWithPerspectives("only"), Deadline.none());

        assertThat(((RankingOutput) result.output()).top()).isEqualTo(new RankedDocument("only", 1.0));
        verifyNoInteractions(reranker);
    }

    @Test
    @DisplayName("with no upstream output the prompt itself is the only candidate")
    void promptFallback() {
        StageResult result = stage().execute(StageFixtures.context("Explain recursion"), Deadline.none());

        assertThat(result.output().asText()).isEqualTo("Explain recursion");
        verifyNoInteractions(reranker);
    }

    @Test
    @DisplayName("an empty ranking keeps the first candidate")
    void emptyRanking() {
        when(reranker.rerank(anyString(), anyList())).thenReturn(List.of());

        StageResult result = stage().execute(contextWithPerspectives("first", "second"), Deadline.none());

        assertThat(((RankingOutput) result.output()).top()).isEqualTo(new RankedDocument("first", 0.0));
    }

    @Test
    @DisplayName("reranker failure fails the stage")
    void rerankerFailure() {
        when(reranker.rerank(anyString(), anyList())).thenThrow(new AiReasoningException("model unavailable"));

        StageResult result = stage().execute(contextWithPerspectives("a", "b"), Deadline.none());

        assertThat(result.status()).isEqualTo(StageStatus.FAILED);
        assertThat(result.error().kind()).isEqualTo(StageError.Kind.COLLABORATOR);
        assertThat(result.error().message()).contains("model unavailable");
    }
}
