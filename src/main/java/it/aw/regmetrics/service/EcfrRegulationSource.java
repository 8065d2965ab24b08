package it.aw.regmetrics.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.regmetrics.registry.ReferenceFeedException;
import it.aw.regmetrics.registry.TitleCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Optional;

/**
 * {@link RegulationSource} di produzione: legge dalla cache DuckDB e, quando
 * richiesto, scarica dall'eCFR salvando il risultato in cache.
 */
@Service
public class EcfrRegulationSource implements RegulationSource {

    private static final Logger log = LoggerFactory.getLogger(EcfrRegulationSource.class);

    private final TitleCache cache;
    private final EcfrClient client;
    private final ObjectMapper objectMapper;

    public EcfrRegulationSource(TitleCache cache, EcfrClient client, ObjectMapper objectMapper) {
        this.cache = cache;
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<byte[]> getDocument(int titleNumber, LocalDate date) {
        return cache.findTitle(titleNumber, date);
    }

    @Override
    public boolean fetchDocument(int titleNumber, LocalDate date) {
        Optional<byte[]> xml = client.downloadTitle(titleNumber, date);
        xml.ifPresent(bytes -> cache.storeTitle(titleNumber, date, bytes));
        return xml.isPresent();
    }

    @Override
    public JsonNode getReferenceMetadata() {
        Optional<String> json = cache.findFeed(TitleCache.AGENCIES_FEED);
        if (json.isEmpty()) {
            log.info("{} non presente in cache, tentativo di download...", TitleCache.AGENCIES_FEED);
            json = client.downloadAgencies();
            json.ifPresent(body -> cache.storeFeed(TitleCache.AGENCIES_FEED, body));
        }
        if (json.isEmpty()) {
            throw new ReferenceFeedException("Impossibile ottenere il feed " + TitleCache.AGENCIES_FEED);
        }
        try {
            return objectMapper.readTree(json.get());
        } catch (JsonProcessingException e) {
            throw new ReferenceFeedException("Feed " + TitleCache.AGENCIES_FEED + " non è JSON valido", e);
        }
    }
}
