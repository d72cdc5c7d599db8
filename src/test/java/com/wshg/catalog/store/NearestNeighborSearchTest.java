package com.wshg.catalog.store;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class NearestNeighborSearchTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static List<String> ids(List<NearestNeighborSearch.Hit> hits) {
        return hits.stream().map(NearestNeighborSearch.Hit::getId).collect(Collectors.toList());
    }

    @Test
    void cosineDistanceRange() {
        assertEquals(0.0, NearestNeighborSearch.cosineDistance(new float[]{1, 0}, new float[]{2, 0}), 1e-9);
        assertEquals(1.0, NearestNeighborSearch.cosineDistance(new float[]{1, 0}, new float[]{0, 1}), 1e-9);
        assertEquals(2.0, NearestNeighborSearch.cosineDistance(new float[]{1, 0}, new float[]{-1, 0}), 1e-9);
        assertEquals(1.0, NearestNeighborSearch.cosineDistance(new float[]{0, 0}, new float[]{1, 0}), 1e-9);
    }

    @Test
    void tiesBreakByNewestFirstThenId() {
        List<NearestNeighborSearch.Hit> hits = new ArrayList<>();
        hits.add(new NearestNeighborSearch.Hit("far", 1.0, T0.plusSeconds(120)));
        hits.add(new NearestNeighborSearch.Hit("old", 0.0, T0));
        hits.add(new NearestNeighborSearch.Hit("new-b", 0.0, T0.plusSeconds(60)));
        hits.add(new NearestNeighborSearch.Hit("new-a", 0.0, T0.plusSeconds(60)));

        assertEquals(List.of("new-a", "new-b", "old", "far"), ids(NearestNeighborSearch.rank(hits, 10)));
    }

    @Test
    void rankKeepsOnlyTheClosestK() {
        List<NearestNeighborSearch.Hit> hits = new ArrayList<>();
        hits.add(new NearestNeighborSearch.Hit("c", 0.3, T0));
        hits.add(new NearestNeighborSearch.Hit("a", 0.1, T0));
        hits.add(new NearestNeighborSearch.Hit("b", 0.2, T0));

        assertEquals(List.of("a", "b"), ids(NearestNeighborSearch.rank(hits, 2)));
        assertEquals(3, hits.size());
    }
}
