package it.aw.regmetrics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegMetricsApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegMetricsApplication.class, args);
    }
}
