package com.example.offlinecache.lifecycle;

import java.util.List;

/**
 * What gets fetched at install time, and into which partition.
 * A null partition name disables that group.
 */
public final class PrecachePlan {

    private final String staticPartition;
    private final List<String> staticAssets;
    private final String apiPartition;
    private final List<String> essentialApis;
    private final String pagesPartition;
    private final List<String> criticalPages;

    public PrecachePlan(
        String staticPartition,
        List<String> staticAssets,
        String apiPartition,
        List<String> essentialApis,
        String pagesPartition,
        List<String> criticalPages
    ) {
        this.staticPartition = staticPartition;
        this.staticAssets = staticAssets == null ? List.of() : List.copyOf(staticAssets);
        this.apiPartition = apiPartition;
        this.essentialApis = essentialApis == null ? List.of() : List.copyOf(essentialApis);
        this.pagesPartition = pagesPartition;
        this.criticalPages = criticalPages == null ? List.of() : List.copyOf(criticalPages);
    }

    public static PrecachePlan empty() {
        return new PrecachePlan(null, List.of(), null, List.of(), null, List.of());
    }

    public String getStaticPartition() {
        return staticPartition;
    }

    public List<String> getStaticAssets() {
        return staticAssets;
    }

    public String getApiPartition() {
        return apiPartition;
    }

    public List<String> getEssentialApis() {
        return essentialApis;
    }

    public String getPagesPartition() {
        return pagesPartition;
    }

    public List<String> getCriticalPages() {
        return criticalPages;
    }
}
