package eu.nebulouscloud.ensembleforecaster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EnsembleForecasterApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnsembleForecasterApplication.class, args);
    }
}
