package com.example.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Application entry point for the document ingestion service.
 * This class only wires the application context and hands over control to Spring.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class DocumentIngestionApplication {

	/**
	 * Boots the Spring container and exposes the upload endpoint defined under the interfaces layer.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(DocumentIngestionApplication.class, args);
	}

}
