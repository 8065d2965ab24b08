package it.aw.regmetrics.controller;

import it.aw.regmetrics.model.AgencyHistory;
import it.aw.regmetrics.model.AgencyMetrics;
import it.aw.regmetrics.model.AnalysisReport;
import it.aw.regmetrics.model.CacheStats;
import it.aw.regmetrics.model.CachedTitle;
import it.aw.regmetrics.registry.AgencyNotFoundException;
import it.aw.regmetrics.registry.ReferenceFeedException;
import it.aw.regmetrics.registry.TitleCache;
import it.aw.regmetrics.service.AgencyAnalyzer;
import it.aw.regmetrics.service.HistoricalComparator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Espone le metriche per agenzia calcolate sul testo dell'eCFR.
 *
 * Endpoint disponibili:
 *   GET /api/agencies                                  : nomi agenzie ordinati
 *   GET /api/agency_sections?agency=&date=             : testo per capitolo
 *   GET /api/historical?agency=&dates=&dates=          : metriche su 1 o 2 date con delta
 *   GET /api/wordcount|checksums|complexity?date=&agency= : singola metrica per agenzia
 *   GET /api/analysis?date=&agency=                    : metriche complete e titoli scartati
 *   GET /api/cache                                     : statistiche della cache locale
 *   GET /api/cache/titles                              : titoli presenti in cache
 *
 * Se {@code date} è omessa si usa {@code analysis.default-date}.
 */
@RestController
@RequestMapping("/api")
public class AgencyController {

    private static final Logger log = LoggerFactory.getLogger(AgencyController.class);

    private final AgencyAnalyzer analyzer;
    private final HistoricalComparator comparator;
    private final TitleCache cache;
    private final LocalDate defaultDate;

    public AgencyController(AgencyAnalyzer analyzer,
                            HistoricalComparator comparator,
                            TitleCache cache,
                            @Value("${analysis.default-date}") String defaultDate) {
        this.analyzer = analyzer;
        this.comparator = comparator;
        this.cache = cache;
        this.defaultDate = LocalDate.parse(defaultDate);
    }

    @GetMapping("/agencies")
    public List<String> agencies() {
        return analyzer.listAgencies();
    }

    @GetMapping("/agency_sections")
    public ResponseEntity<Map<String, Object>> agencySections(
            @RequestParam("agency") String agency,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        Map<String, String> sections = analyzer.sections(agency, date);
        if (sections.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("agency", agency);
        body.put("sections", sections);
        return ResponseEntity.ok(body);
    }

    /**
     * Esempio:
     *   curl "http://localhost:8890/api/historical?agency=Department+of+Energy&dates=2023-07-01&dates=2024-07-01"
     */
    @GetMapping("/historical")
    public ResponseEntity<Map<String, AgencyHistory>> historical(
            @RequestParam("agency") String agency,
            @RequestParam("dates") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) List<LocalDate> dates) {
        if (agency.isBlank() || dates.isEmpty() || dates.size() > 2) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(comparator.compare(dates, List.of(agency)));
    }

    @GetMapping("/wordcount")
    public Map<String, Long> wordCount(
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(value = "agency", required = false) String agency) {
        return project(date, agency, m -> m.metrics().wordCount());
    }

    @GetMapping("/checksums")
    public Map<String, String> checksums(
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(value = "agency", required = false) String agency) {
        return project(date, agency, m -> m.metrics().checksum());
    }

    @GetMapping("/complexity")
    public Map<String, Double> complexity(
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(value = "agency", required = false) String agency) {
        return project(date, agency, m -> m.metrics().complexity());
    }

    @GetMapping("/analysis")
    public AnalysisReport analysis(
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(value = "agency", required = false) String agency) {
        return runAnalysis(date, agency);
    }

    @GetMapping("/cache")
    public CacheStats cacheStats() {
        return cache.stats();
    }

    @GetMapping("/cache/titles")
    public List<CachedTitle> cachedTitles() {
        return cache.listTitles();
    }

    // -------------------------------------------------------------------------

    @ExceptionHandler(AgencyNotFoundException.class)
    public ResponseEntity<Map<String, String>> agencyNotFound(AgencyNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                "detail", e.getMessage(),
                "agency", String.valueOf(e.getAgencyName())));
    }

    @ExceptionHandler(ReferenceFeedException.class)
    public ResponseEntity<Map<String, String>> feedUnavailable(ReferenceFeedException e) {
        log.error("Feed di riferimento non disponibile", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("detail", e.getMessage()));
    }

    private <T> Map<String, T> project(LocalDate date, String agency, Function<AgencyMetrics, T> metric) {
        Map<String, T> result = new LinkedHashMap<>();
        runAnalysis(date, agency).agencies().forEach((name, metrics) -> result.put(name, metric.apply(metrics)));
        return result;
    }

    private AnalysisReport runAnalysis(LocalDate date, String agency) {
        LocalDate effective = date != null ? date : defaultDate;
        List<String> filter = agency == null || agency.isBlank() ? List.of() : List.of(agency);
        return analyzer.analyze(effective, filter);
    }
}
