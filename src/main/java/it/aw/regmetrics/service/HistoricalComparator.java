package it.aw.regmetrics.service;

import it.aw.regmetrics.model.AgencyHistory;
import it.aw.regmetrics.model.AnalysisReport;
import it.aw.regmetrics.model.MetricsDelta;
import it.aw.regmetrics.model.MetricsRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Confronto delle metriche di agenzia tra più date.
 * <p>
 * Esegue un'analisi per ogni data richiesta. Con esattamente due date, alle agenzie
 * che hanno metriche in entrambe si aggiunge il delta {@code seconda - prima}
 * nell'ordine in cui le date sono state passate.
 */
@Service
public class HistoricalComparator {

    private static final Logger log = LoggerFactory.getLogger(HistoricalComparator.class);

    private final AgencyAnalyzer analyzer;

    public HistoricalComparator(AgencyAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public Map<String, AgencyHistory> compare(List<LocalDate> dates, Collection<String> agencyFilter) {
        if (dates == null || dates.isEmpty()) {
            throw new IllegalArgumentException("Serve almeno una data");
        }
        log.info("Confronto storico su date {} (filtro agenzie: {})", dates, agencyFilter);

        Map<String, Map<LocalDate, MetricsRecord>> byAgency = new LinkedHashMap<>();
        for (LocalDate date : dates) {
            AnalysisReport report = analyzer.analyze(date, agencyFilter);
            report.agencies().forEach((agency, result) ->
                    byAgency.computeIfAbsent(agency, k -> new LinkedHashMap<>()).put(date, result.metrics()));
        }

        Map<String, AgencyHistory> history = new LinkedHashMap<>();
        byAgency.forEach((agency, records) -> {
            MetricsDelta delta = null;
            if (dates.size() == 2) {
                delta = delta(records.get(dates.get(0)), records.get(dates.get(1)));
            }
            history.put(agency, new AgencyHistory(agency, records, delta));
        });
        return history;
    }

    /** Null se manca una delle due metriche. */
    static MetricsDelta delta(MetricsRecord start, MetricsRecord end) {
        if (start == null || end == null) return null;
        Double complexityChange = start.complexity() != null && end.complexity() != null
                ? end.complexity() - start.complexity()
                : null;
        return new MetricsDelta(end.wordCount() - start.wordCount(), complexityChange);
    }
}
