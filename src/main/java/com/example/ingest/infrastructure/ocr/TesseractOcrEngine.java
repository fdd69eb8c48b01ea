package com.example.ingest.infrastructure.ocr;

import com.example.ingest.config.ExtractionProperties;
import com.example.ingest.infrastructure.exception.OcrException;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;

/**
 * Tess4J backed {@link OcrEngine} using the configured dual-language model.
 * A fresh {@link Tesseract} handle is created per call so concurrent extractions share nothing.
 */
@Component
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);
    public static final String ENGINE_NAME = "tesseract";

    private final String language;
    private final String datapath;

    /**
     * @param properties extraction settings holding the language list and tessdata location
     */
    public TesseractOcrEngine(ExtractionProperties properties) {
        this.language = properties.getOcr().getLanguage();
        this.datapath = properties.getOcr().getDatapath();
    }

    @Override
    public String recognize(BufferedImage image) {
        ITesseract tesseract = newEngine();
        try {
            String result = tesseract.doOCR(image);
            log.debug("Tesseract recognised {} characters ({}x{}, lang={})",
                    result == null ? 0 : result.length(), image.getWidth(), image.getHeight(), language);
            return result == null ? "" : result;
        } catch (TesseractException e) {
            throw new OcrException("Tesseract failed to recognise the image", e);
        } catch (LinkageError e) {
            // native libtesseract or JNA missing on this host
            throw new OcrException("Tesseract native library is not available", e);
        }
    }

    @Override
    public String engineName() {
        return ENGINE_NAME;
    }

    private ITesseract newEngine() {
        Tesseract engine = new Tesseract();
        if (datapath != null && !datapath.isBlank()) {
            engine.setDatapath(datapath);
        }
        if (language != null && !language.isBlank()) {
            engine.setLanguage(language);
        }
        return engine;
    }
}
