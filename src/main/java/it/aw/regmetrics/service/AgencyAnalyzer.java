package it.aw.regmetrics.service;

import it.aw.regmetrics.model.AgencyMetrics;
import it.aw.regmetrics.model.AgencyReferences;
import it.aw.regmetrics.model.AnalysisReport;
import it.aw.regmetrics.model.DocumentNode;
import it.aw.regmetrics.model.MetricsRecord;
import it.aw.regmetrics.model.TitleOutcome;
import it.aw.regmetrics.model.TitleOutcome.Status;
import it.aw.regmetrics.registry.AgencyReferenceIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Calcola le metriche per agenzia a una data.
 * <p>
 * Pipeline per ogni agenzia:
 * <ol>
 *   <li>Titoli dell'agenzia dall'indice dei riferimenti, in ordine crescente</li>
 *   <li>XML del titolo dalla sorgente, con download se assente</li>
 *   <li>Filtro capitoli dall'indice; estrazione piatta del testo</li>
 *   <li>Concatenazione con uno spazio davanti a ogni blocco, somma dei word count per titolo</li>
 *   <li>Checksum e complessità sul testo concatenato</li>
 * </ol>
 *
 * Download falliti, XML non valido e testo vuoto escludono il titolo dall'aggregato
 * e sono registrati come {@link TitleOutcome}; non interrompono l'analisi.
 * Un'agenzia senza testo alla data non compare nel risultato.
 * <p>
 * Ogni titolo viene scaricato al più una volta per esecuzione, anche se è condiviso
 * da più agenzie. Gli alberi parsati non sono trattenuti tra un'agenzia e l'altra;
 * un titolo fallito resta escluso per tutta l'esecuzione.
 */
@Service
public class AgencyAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(AgencyAnalyzer.class);

    private final RegulationSource source;

    public AgencyAnalyzer(RegulationSource source) {
        this.source = source;
    }

    /** Nomi di tutte le agenzie del feed, ordinati. */
    public List<String> listAgencies() {
        return loadIndex().listedNames();
    }

    /**
     * @param date          data di validità dei titoli
     * @param agencyFilter  agenzie da analizzare; null o vuoto = tutte quelle con titoli
     * @throws it.aw.regmetrics.registry.AgencyNotFoundException se un'agenzia del filtro non è nell'indice
     */
    public AnalysisReport analyze(LocalDate date, Collection<String> agencyFilter) {
        AgencyReferenceIndex index = loadIndex();
        Set<String> targets = resolveTargets(index, agencyFilter);
        Map<Integer, LoadedTitle> failures = new HashMap<>();

        Map<String, AgencyMetrics> results = new LinkedHashMap<>();
        List<TitleOutcome> outcomes = new ArrayList<>();
        for (String agency : targets) {
            log.info("Analisi agenzia: {} ({})", agency, date);
            analyzeAgency(index, agency, date, failures, outcomes)
                    .ifPresent(metrics -> results.put(agency, metrics));
        }

        log.info("Analisi al {} completata: {} agenzie con metriche su {} richieste",
                date, results.size(), targets.size());
        return new AnalysisReport(date, results, outcomes);
    }

    /**
     * Testo per capitolo rilevante per l'agenzia alla data: heading → testo.
     * I capitoli con testo vuoto sono omessi; i titoli non disponibili sono saltati.
     *
     * @throws it.aw.regmetrics.registry.AgencyNotFoundException se l'agenzia non è nell'indice
     */
    public Map<String, String> sections(String agencyName, LocalDate date) {
        AgencyReferenceIndex index = loadIndex();
        AgencyReferences agency = index.require(agencyName);

        Map<String, String> sections = new LinkedHashMap<>();
        for (int title : agency.titles()) {
            LoadedTitle loaded = load(title, date);
            if (loaded.failure() != null) {
                log.warn("  Titolo {} escluso dalle sezioni: {}", title, loaded.detail());
                continue;
            }
            Set<String> chapters = index.chaptersFor(agencyName, title).orElse(null);
            TitleXmlParser.extractSections(loaded.root(), chapters).forEach((heading, text) -> {
                if (!text.isEmpty()) sections.put(heading, text);
            });
        }
        return sections;
    }

    // -------------------------------------------------------------------------

    private Optional<AgencyMetrics> analyzeAgency(AgencyReferenceIndex index,
                                                  String agency,
                                                  LocalDate date,
                                                  Map<Integer, LoadedTitle> failures,
                                                  List<TitleOutcome> outcomes) {
        List<String> blocks = new ArrayList<>();
        List<Integer> analyzed = new ArrayList<>();
        long totalWords = 0;

        for (int title : index.titlesFor(agency)) {
            // solo gli esiti negativi restano in memoria: un titolo scaricato è in cache,
            // l'albero si riparsa per ogni agenzia e viene rilasciato subito dopo
            LoadedTitle loaded = failures.containsKey(title) ? failures.get(title) : load(title, date);
            if (loaded.failure() != null) {
                failures.putIfAbsent(title, loaded);
                log.warn("  Titolo {} saltato: {}", title, loaded.detail());
                outcomes.add(TitleOutcome.skipped(agency, title, loaded.failure(), loaded.detail()));
                continue;
            }

            Set<String> chapters = index.chaptersFor(agency, title).orElse(null);
            log.debug("  Titolo {}: capitoli rilevanti {}", title, chapters == null ? "tutti" : chapters);

            String text = TitleXmlParser.extractText(loaded.root(), chapters);
            log.debug("  Titolo {}: testo estratto {} caratteri", title, text.length());
            if (text.isEmpty()) {
                outcomes.add(TitleOutcome.skipped(agency, title, Status.EMPTY,
                        "nessun testo per i capitoli " + chapters));
                continue;
            }

            long words = MetricsCalculator.wordCount(text);
            totalWords += words;
            blocks.add(text);
            analyzed.add(title);
            outcomes.add(TitleOutcome.analyzed(agency, title, words));
        }

        if (blocks.isEmpty()) {
            log.info("Nessun dato per {} al {}", agency, date);
            return Optional.empty();
        }

        // ogni blocco è preceduto da uno spazio, anche il primo
        String combined = " " + String.join(" ", blocks);
        MetricsRecord metrics = new MetricsRecord(
                totalWords,
                MetricsCalculator.checksum(combined),
                MetricsCalculator.complexity(combined));
        return Optional.of(new AgencyMetrics(agency, metrics, analyzed));
    }

    private LoadedTitle load(int title, LocalDate date) {
        Optional<byte[]> xml = source.getDocument(title, date);
        if (xml.isEmpty()) {
            log.info("XML del titolo {} al {} non presente in cache, download dall'eCFR...", title, date);
            if (!source.fetchDocument(title, date)) {
                return LoadedTitle.failed(Status.FETCH_FAILED, "download fallito");
            }
            xml = source.getDocument(title, date);
            if (xml.isEmpty()) {
                return LoadedTitle.failed(Status.FETCH_FAILED, "documento assente dopo il download");
            }
        }
        try {
            return LoadedTitle.ok(TitleXmlParser.parse(xml.get()));
        } catch (TitleParseException e) {
            return LoadedTitle.failed(Status.PARSE_FAILED, e.getMessage());
        }
    }

    private AgencyReferenceIndex loadIndex() {
        return AgencyReferenceIndex.build(source.getReferenceMetadata());
    }

    private static Set<String> resolveTargets(AgencyReferenceIndex index, Collection<String> agencyFilter) {
        if (agencyFilter == null || agencyFilter.isEmpty()) {
            return index.agencyNames();
        }
        Set<String> targets = new LinkedHashSet<>();
        for (String name : agencyFilter) {
            targets.add(index.require(name).name());
        }
        return targets;
    }

    /** Titolo caricato: radice parsata oppure motivo del fallimento. */
    private record LoadedTitle(DocumentNode root, Status failure, String detail) {

        static LoadedTitle ok(DocumentNode root) {
            return new LoadedTitle(root, null, null);
        }

        static LoadedTitle failed(Status failure, String detail) {
            return new LoadedTitle(null, failure, detail);
        }
    }
}
