package it.aw.regmetrics.model;

/**
 * Esito dell'elaborazione di un titolo per un'agenzia.
 * <p>
 * I fallimenti per documento (download, parsing, testo vuoto) non interrompono
 * l'analisi: vengono registrati come esiti e il titolo è escluso dall'aggregato.
 */
public record TitleOutcome(
        String  agencyName,
        int     titleNumber,
        Status  status,
        long    wordCount,   // 0 se il titolo non ha contribuito
        String  detail       // messaggio diagnostico, null per ANALYZED
) {

    public enum Status { ANALYZED, EMPTY, FETCH_FAILED, PARSE_FAILED }

    public static TitleOutcome analyzed(String agency, int title, long wordCount) {
        return new TitleOutcome(agency, title, Status.ANALYZED, wordCount, null);
    }

    public static TitleOutcome skipped(String agency, int title, Status status, String detail) {
        return new TitleOutcome(agency, title, status, 0, detail);
    }

    public boolean contributed() {
        return status == Status.ANALYZED;
    }
}
