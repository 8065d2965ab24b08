package it.aw.regmetrics.registry;

import com.fasterxml.jackson.databind.JsonNode;
import it.aw.regmetrics.model.AgencyReferences;
import it.aw.regmetrics.model.ReferenceEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Indice agenzia → riferimenti CFR costruito dal feed agencies.json dell'eCFR.
 * <p>
 * Il nome di un'agenzia è {@code display_name} se presente, altrimenti {@code name},
 * ed è la chiave di de-duplicazione: voci del feed con lo stesso nome vengono fuse
 * (le voci successive aggiungono riferimenti, non sostituiscono).
 * Le agenzie senza alcun titolo associato non entrano nell'indice.
 * <p>
 * Costruito una volta per esecuzione e non più modificato.
 */
public class AgencyReferenceIndex {

    private static final Logger log = LoggerFactory.getLogger(AgencyReferenceIndex.class);

    private final Map<String, AgencyReferences> agencies;
    private final SortedSet<String> listedNames;

    private AgencyReferenceIndex(Map<String, AgencyReferences> agencies, SortedSet<String> listedNames) {
        this.agencies = Collections.unmodifiableMap(agencies);
        this.listedNames = Collections.unmodifiableSortedSet(listedNames);
    }

    /**
     * Appiattisce il feed nell'indice.
     *
     * @throws ReferenceFeedException se il feed non contiene l'array {@code agencies}
     */
    public static AgencyReferenceIndex build(JsonNode feed) {
        if (feed == null || !feed.path("agencies").isArray()) {
            throw new ReferenceFeedException("Feed agenzie non valido: array 'agencies' assente");
        }

        Map<String, List<ReferenceEntry>> merged = new LinkedHashMap<>();
        SortedSet<String> listed = new TreeSet<>();
        for (JsonNode agency : feed.path("agencies")) {
            String name = displayName(agency);
            if (name == null) continue;
            listed.add(name);

            List<ReferenceEntry> refs = new ArrayList<>();
            for (JsonNode ref : agency.path("cfr_references")) {
                JsonNode title = ref.get("title");
                if (title == null || !title.canConvertToInt()) continue;
                refs.add(new ReferenceEntry(name, title.asInt(), textOrNull(ref.get("chapter"))));
            }
            if (!refs.isEmpty()) {
                merged.computeIfAbsent(name, k -> new ArrayList<>()).addAll(refs);
            }
        }

        Map<String, AgencyReferences> agencies = new LinkedHashMap<>();
        merged.forEach((name, refs) -> agencies.put(name, new AgencyReferences(name, refs)));
        log.info("AgencyReferenceIndex: {} agenzie nel feed, {} con titoli associati",
                listed.size(), agencies.size());
        return new AgencyReferenceIndex(agencies, listed);
    }

    /** Tutte le agenzie del feed, ordinate, incluse quelle senza titoli. */
    public List<String> listedNames() {
        return new ArrayList<>(listedNames);
    }

    /** Agenzie con almeno un titolo, nell'ordine del feed. */
    public Set<String> agencyNames() {
        return new LinkedHashSet<>(agencies.keySet());
    }

    /** @throws AgencyNotFoundException se l'agenzia non è nell'indice */
    public AgencyReferences require(String agencyName) {
        AgencyReferences refs = agencies.get(agencyName);
        if (refs == null) throw new AgencyNotFoundException(agencyName);
        return refs;
    }

    /** Titoli dell'agenzia in ordine crescente. */
    public SortedSet<Integer> titlesFor(String agencyName) {
        return require(agencyName).titles();
    }

    /**
     * Capitoli a cui l'agenzia è esplicitamente limitata nel titolo dato.
     *
     * @return vuoto ("tutto il titolo") se nessun riferimento specifica un capitolo
     *         o se almeno un riferimento al titolo ne è privo
     */
    public Optional<Set<String>> chaptersFor(String agencyName, int titleNumber) {
        Set<String> chapters = new LinkedHashSet<>();
        for (ReferenceEntry ref : require(agencyName).references()) {
            if (ref.titleNumber() != titleNumber) continue;
            if (ref.chapter() == null) return Optional.empty();
            chapters.add(ref.chapter());
        }
        return chapters.isEmpty() ? Optional.empty() : Optional.of(chapters);
    }

    private static String displayName(JsonNode agency) {
        String display = textOrNull(agency.get("display_name"));
        return display != null ? display : textOrNull(agency.get("name"));
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) return null;
        String text = node.asText().strip();
        return text.isEmpty() ? null : text;
    }
}
