package me.golemcore.orchestrator.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineTest {

    private static final PipelineStep A = PipelineStep.of("p", "a");
    private static final PipelineStep B = PipelineStep.of("p", "b");
    private static final PipelineStep C = PipelineStep.of("q", "c");

    @Test
    void shouldKeepDuplicateStepsInOrder() {
        Pipeline pipeline = Pipeline.of(List.of(A, A, B));

        assertEquals(A, pipeline.next().orElseThrow());
        assertEquals(A, pipeline.next().orElseThrow());
        assertEquals(B, pipeline.next().orElseThrow());
        assertTrue(pipeline.next().isEmpty());
    }

    @Test
    void shouldReplaceOnlyRemainingSteps() {
        Pipeline pipeline = Pipeline.of(List.of(A, B));
        pipeline.next();

        pipeline.replaceRemaining(List.of(C, C));

        assertEquals(List.of(C, C), pipeline.remaining());
    }

    @Test
    void shouldReturnDetachedRemainingCopy() {
        Pipeline pipeline = Pipeline.of(List.of(A, B));
        List<PipelineStep> before = pipeline.remaining();

        pipeline.next();

        assertEquals(List.of(A, B), before);
        assertEquals(1, pipeline.size());
    }
}
