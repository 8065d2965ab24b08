package it.aw.regmetrics.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Risultato dell'analisi di una singola agenzia a una data.
 * <p>
 * Prodotto solo se almeno un titolo ha contribuito testo non vuoto.
 */
public record AgencyMetrics(
        String         agencyName,
        MetricsRecord  metrics,
        List<Integer>  titlesAnalyzed   // titoli che hanno contribuito testo, in ordine di concatenazione
) {
    public AgencyMetrics {
        titlesAnalyzed = List.copyOf(titlesAnalyzed);
    }

    @JsonProperty("titlesCount")
    public int titlesCount() {
        return titlesAnalyzed.size();
    }
}
