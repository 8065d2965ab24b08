package it.aw.regmetrics.model;

/**
 * Associazione (agenzia, titolo, capitolo) letta dal feed agencies.json.
 * {@code chapter} null significa "tutto il titolo è rilevante".
 */
public record ReferenceEntry(
        String  agencyName,
        int     titleNumber,
        String  chapter      // codice capitolo (es. "II"), null se non specificato
) {}
