package it.aw.regmetrics.model;

/**
 * Metriche calcolate su un aggregato di testo.
 * {@code complexity} è null quando la formula di leggibilità non è applicabile.
 */
public record MetricsRecord(
        long    wordCount,
        String  checksum,    // SHA-256 esadecimale del testo concatenato
        Double  complexity   // Flesch-Kincaid grade level, null se non definito
) {}
