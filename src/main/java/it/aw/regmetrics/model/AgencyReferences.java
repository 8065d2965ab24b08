package it.aw.regmetrics.model;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Un'agenzia con tutti i riferimenti CFR che le appartengono.
 * I titoli sono ordinati in modo crescente: è l'ordine di concatenazione del testo.
 */
public record AgencyReferences(String name, List<ReferenceEntry> references) {

    public AgencyReferences {
        references = List.copyOf(references);
    }

    public SortedSet<Integer> titles() {
        SortedSet<Integer> titles = new TreeSet<>();
        for (ReferenceEntry ref : references) {
            titles.add(ref.titleNumber());
        }
        return titles;
    }
}
