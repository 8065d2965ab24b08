package it.aw.regmetrics.model;

/**
 * Statistiche aggregate sulla cache locale dei documenti.
 */
public record CacheStats(
        int totalTitles,
        long totalBytes,
        boolean referenceFeedPresent,
        String storeType
) {}
