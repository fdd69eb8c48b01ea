package com.example.ingest.config;

import com.example.ingest.application.service.ExtractionStrategyFactory;
import com.example.ingest.domain.extraction.ExtractionStrategy;
import com.example.ingest.domain.model.DocumentFormat;
import com.example.ingest.infrastructure.cad.CadExtractionStrategy;
import com.example.ingest.infrastructure.image.ImageExtractionStrategy;
import com.example.ingest.infrastructure.office.DocxExtractionStrategy;
import com.example.ingest.infrastructure.pdf.PdfExtractionStrategy;
import com.example.ingest.infrastructure.text.PlainTextExtractionStrategy;
import com.example.ingest.infrastructure.text.TabularExtractionStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires the format tag to strategy bindings.
 */
@Configuration
public class ExtractionConfiguration {

    /**
     * @return factory with one strategy per primary format and the default alias table
     */
    @Bean
    public ExtractionStrategyFactory extractionStrategyFactory(PdfExtractionStrategy pdf,
                                                               ImageExtractionStrategy image,
                                                               DocxExtractionStrategy docx,
                                                               CadExtractionStrategy cad,
                                                               TabularExtractionStrategy tabular,
                                                               PlainTextExtractionStrategy plainText) {
        Map<String, ExtractionStrategy> bindings = new LinkedHashMap<>();
        bindings.put(DocumentFormat.PDF.tag(), pdf);
        bindings.put(DocumentFormat.IMAGE.tag(), image);
        bindings.put(DocumentFormat.DOCX.tag(), docx);
        bindings.put(DocumentFormat.DXF.tag(), cad);
        bindings.put(DocumentFormat.CSV.tag(), tabular);
        bindings.put(DocumentFormat.TXT.tag(), plainText);
        return new ExtractionStrategyFactory(bindings, ExtractionStrategyFactory.DEFAULT_ALIASES);
    }
}
