package it.aw.regmetrics.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Client HTTP verso le API pubbliche dell'eCFR.
 * <p>
 * Endpoint usati:
 *   GET /api/versioner/v1/full/{date}/title-{n}.xml : XML completo di un titolo a una data
 *   GET /api/admin/v1/agencies.json                 : agenzie e relativi riferimenti CFR
 *
 * Un errore HTTP o di rete produce un risultato vuoto e un log di warning:
 * la decisione se proseguire spetta al chiamante.
 */
@Component
public class EcfrClient {

    private static final Logger log = LoggerFactory.getLogger(EcfrClient.class);

    static final String TITLE_PATH    = "/api/versioner/v1/full/{date}/title-{title}.xml";
    static final String AGENCIES_PATH = "/api/admin/v1/agencies.json";

    private final RestClient restClient;

    public EcfrClient(RestClient ecfrRestClient) {
        this.restClient = ecfrRestClient;
    }

    public Optional<byte[]> downloadTitle(int titleNumber, LocalDate date) {
        try {
            byte[] body = restClient.get()
                    .uri(TITLE_PATH, date.toString(), titleNumber)
                    .retrieve()
                    .body(byte[].class);
            if (body == null || body.length == 0) {
                log.warn("Download titolo {} ({}): risposta vuota", titleNumber, date);
                return Optional.empty();
            }
            log.info("Scaricato XML del titolo {} al {} ({} byte)", titleNumber, date, body.length);
            return Optional.of(body);
        } catch (RestClientResponseException e) {
            log.warn("Download titolo {} ({}) fallito: HTTP {}", titleNumber, date, e.getStatusCode().value());
        } catch (RestClientException e) {
            log.warn("Download titolo {} ({}) fallito: {}", titleNumber, date, e.getMessage());
        }
        return Optional.empty();
    }

    public Optional<String> downloadAgencies() {
        try {
            String body = restClient.get()
                    .uri(AGENCIES_PATH)
                    .retrieve()
                    .body(String.class);
            if (body == null || body.isBlank()) {
                log.warn("Download agencies.json: risposta vuota");
                return Optional.empty();
            }
            log.info("Scaricato feed agencies.json ({} caratteri)", body.length());
            return Optional.of(body);
        } catch (RestClientResponseException e) {
            log.warn("Download agencies.json fallito: HTTP {}", e.getStatusCode().value());
        } catch (RestClientException e) {
            log.warn("Download agencies.json fallito: {}", e.getMessage());
        }
        return Optional.empty();
    }
}
