package it.aw.regmetrics.model;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Vista leggera di un titolo in cache, senza il contenuto XML.
 */
public record CachedTitle(
        int            titleNumber,
        LocalDate      date,
        int            sizeBytes,
        LocalDateTime  fetchedAt
) {}
