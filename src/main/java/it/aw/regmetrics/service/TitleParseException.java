package it.aw.regmetrics.service;

/**
 * Contenuto XML di un titolo non parsabile. Il parser non tenta recuperi parziali.
 */
public class TitleParseException extends Exception {

    public TitleParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
