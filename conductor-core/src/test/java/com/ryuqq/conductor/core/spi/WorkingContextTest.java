package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SubtaskId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkingContext 및 기본 Compactor 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkingContextTest {

    private static final ResourceId A = ResourceId.of("src/A.java");
    private static final ResourceId B = ResourceId.of("src/B.java");

    @Test
    void record_AccumulatesProcessedAndFacts() {
        // Given
        WorkingContext context = new WorkingContext(SubtaskId.of("task-1"));

        // When
        context.record(A, Map.of("A.api", "v2"));
        context.record(B, Map.of("B.api", "v1", "A.api", "v3"));

        // Then
        assertEquals(List.of(A, B), context.processed());
        assertEquals("v3", context.facts().get("A.api"));
        assertEquals(2, context.facts().size());
    }

    @Test
    void replaceWith_RetainingFacts_KeepsEverything() {
        // Given
        WorkingContext context = new WorkingContext(SubtaskId.of("task-1"));
        context.record(A, Map.of("A.api", "v2"));

        // When
        Compaction compaction = Compactor.retainingFacts().compact(context);
        context.replaceWith(compaction);

        // Then
        assertEquals(1, compaction.residualUnits());
        assertEquals(List.of(A), context.processed());
        assertEquals("v2", context.facts().get("A.api"));
        assertEquals(1, context.compactions());
    }

    @Test
    void replaceWith_RetainingFacts_KeepsProcessingOrder() {
        // Given
        WorkingContext context = new WorkingContext(SubtaskId.of("task-1"));
        context.record(B, Map.of());
        context.record(A, Map.of());

        // When
        Compaction compaction = Compactor.retainingFacts().compact(context);
        context.replaceWith(compaction);

        // Then
        assertEquals(List.of(B, A), compaction.processed());
        assertEquals(List.of(B, A), context.processed());
    }

    @Test
    void replaceWith_DroppedProcessed_ThrowsException() {
        // Given
        WorkingContext context = new WorkingContext(SubtaskId.of("task-1"));
        context.record(A, Map.of());
        context.record(B, Map.of());

        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> context.replaceWith(new Compaction(List.of(A), new TreeMap<>(), 0))
        );
        assertTrue(exception.getMessage().contains("must preserve processed resources"));
        assertEquals(0, context.compactions());
    }

    @Test
    void processed_ReadOnlyView() {
        // Given
        WorkingContext context = new WorkingContext(SubtaskId.of("task-1"));

        // When & Then
        assertThrows(UnsupportedOperationException.class, () -> context.processed().add(A));
    }

    @Test
    void processedResource_NegativeUnits_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ProcessedResource.of("out", -1));
    }
}
