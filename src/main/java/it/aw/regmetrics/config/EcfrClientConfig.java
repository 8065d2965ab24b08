package it.aw.regmetrics.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Configura il RestClient verso l'eCFR.
 *
 * I titoli completi possono superare le decine di MB: il timeout di lettura
 * è configurabile con {@code ecfr.timeout-seconds}.
 */
@Configuration
public class EcfrClientConfig {

    private static final Logger log = LoggerFactory.getLogger(EcfrClientConfig.class);

    @Value("${ecfr.base-url}")
    private String baseUrl;

    @Value("${ecfr.timeout-seconds:60}")
    private int timeoutSeconds;

    @Bean
    public RestClient ecfrRestClient(RestClient.Builder builder) {
        log.info("Inizializzazione RestClient eCFR: {} (timeout {}s)", baseUrl, timeoutSeconds);
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMillis = (int) Duration.ofSeconds(timeoutSeconds).toMillis();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);
        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
