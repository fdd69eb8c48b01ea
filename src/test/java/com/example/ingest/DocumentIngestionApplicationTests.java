package com.example.ingest;

import com.example.ingest.application.service.ExtractionStrategyFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest
class DocumentIngestionApplicationTests {

	@Autowired
	private ExtractionStrategyFactory strategyFactory;

	/**
	 * Ensures the application context loads and every format tag resolves to a strategy.
	 */
	@Test
	void contextLoads() {
		assertThat(strategyFactory.supportedTags())
				.containsExactlyInAnyOrder("PDF", "IMAGE", "DOCX", "DOC", "DXF", "DWG", "CSV", "XLSX", "TXT");
	}

}
