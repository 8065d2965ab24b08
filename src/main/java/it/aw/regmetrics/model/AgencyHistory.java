package it.aw.regmetrics.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Storico di un'agenzia: metriche per ciascuna data analizzata con successo,
 * più il delta quando sono state richieste esattamente due date ed entrambe
 * hanno prodotto metriche.
 */
public record AgencyHistory(
        String                          agencyName,
        Map<LocalDate, MetricsRecord>   byDate,   // solo le date con esito positivo, in ordine di richiesta
        MetricsDelta                    delta     // null se non calcolabile
) {
    public AgencyHistory {
        byDate = Collections.unmodifiableMap(new LinkedHashMap<>(byDate));
    }
}
