package it.aw.regmetrics.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Sorgente dei documenti e dei metadati di riferimento usata dall'analisi.
 * <p>
 * Separa il motore di analisi dal recupero di rete e dalla persistenza: in produzione
 * è {@link EcfrRegulationSource} (cache DuckDB + download eCFR), nei test un fake in memoria.
 */
public interface RegulationSource {

    /** XML grezzo del titolo alla data, se già disponibile localmente. */
    Optional<byte[]> getDocument(int titleNumber, LocalDate date);

    /**
     * Scarica e memorizza il titolo alla data.
     *
     * @return false se il download fallisce
     */
    boolean fetchDocument(int titleNumber, LocalDate date);

    /**
     * Feed agencies.json; viene scaricato automaticamente se assente.
     *
     * @throws it.aw.regmetrics.registry.ReferenceFeedException se il feed resta indisponibile o non è JSON valido
     */
    JsonNode getReferenceMetadata();
}
