package it.aw.regmetrics.registry;

/**
 * Nome agenzia assente dall'indice dei riferimenti.
 */
public class AgencyNotFoundException extends RuntimeException {

    private final String agencyName;

    public AgencyNotFoundException(String agencyName) {
        super("Agenzia non trovata: " + agencyName);
        this.agencyName = agencyName;
    }

    public String getAgencyName() {
        return agencyName;
    }
}
