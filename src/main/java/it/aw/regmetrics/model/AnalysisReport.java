package it.aw.regmetrics.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Risultato di un'esecuzione di analisi a una data: metriche per agenzia
 * e l'elenco completo degli esiti per titolo (inclusi quelli scartati).
 * <p>
 * Le agenzie senza testo alla data non compaiono in {@code agencies}.
 */
public record AnalysisReport(
        LocalDate                   date,
        Map<String, AgencyMetrics>  agencies,
        List<TitleOutcome>          outcomes
) {
    public AnalysisReport {
        agencies = Collections.unmodifiableMap(new LinkedHashMap<>(agencies));
        outcomes = List.copyOf(outcomes);
    }

    /** Esiti che non hanno contribuito all'aggregato. */
    public List<TitleOutcome> skipped() {
        return outcomes.stream().filter(o -> !o.contributed()).toList();
    }
}
