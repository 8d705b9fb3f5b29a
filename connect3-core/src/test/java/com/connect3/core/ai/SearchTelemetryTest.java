package com.connect3.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.connect3.core.Move;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchTelemetryTest {

    @Test
    void sumsIterationCounters() {
        List<SearchTelemetry.Iteration> iterations = new ArrayList<>();
        iterations.add(new SearchTelemetry.Iteration(1, 10, 2, 0, 10, 1_000_000, new Move(0, 1), 5));
        iterations.add(new SearchTelemetry.Iteration(2, 40, 7, 3, 30, 2_500_000, new Move(0, 1), 4));

        SearchTelemetry telemetry = new SearchTelemetry(iterations);
        iterations.clear();

        assertEquals(2, telemetry.iterations().size(), "Telemetry keeps its own copy");
        assertEquals(50, telemetry.totalNodes());
        assertEquals(9, telemetry.totalCutoffs());
        assertEquals(3, telemetry.totalTranspositionHits());
        assertEquals(40, telemetry.totalTranspositionStores());
        assertTrue(telemetry.summary().startsWith("2 iterations, 50 nodes, 9 cutoffs, 3 table hits, 40 table stores"));
    }

    @Test
    void emptyTelemetryHasNoTotals() {
        assertEquals(0, SearchTelemetry.empty().totalNodes());
        assertEquals(0, new SearchTelemetry(null).iterations().size());
    }
}
