package it.aw.regmetrics.model;

/**
 * Variazione tra due date: {@code fine - inizio}.
 * {@code complexityChange} è null se la complessità manca in una delle due date.
 */
public record MetricsDelta(long wordCount, Double complexityChange) {}
