package com.example.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Application entry point for the statement analyzer.
 * This class only wires the application context; callers obtain
 * {@link com.example.analyzer.application.service.StatementAnalysisService} from it.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class StatementAnalyzerApplication {

	/**
	 * Boots the Spring container with the bank schema registry and analysis services.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(StatementAnalyzerApplication.class, args);
	}

}
