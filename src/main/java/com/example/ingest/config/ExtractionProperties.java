package com.example.ingest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalised settings for the extraction core, bound from the {@code extraction.*} prefix.
 * Every value has a documented default so strategies can also be built without Spring.
 */
@ConfigurationProperties(prefix = "extraction")
public class ExtractionProperties {

    /** Minimum trimmed length of a page's direct text before OCR is skipped. */
    public static final int DEFAULT_SIGNIFICANCE_THRESHOLD = 30;
    /** English plus Malayalam Tesseract models. */
    public static final String DEFAULT_OCR_LANGUAGE = "eng+mal";
    public static final float DEFAULT_RENDER_DPI = 300f;
    public static final int DEFAULT_PREVIEW_ROWS = 10;
    public static final List<String> DEFAULT_ENCODINGS = List.of("UTF-8", "windows-1252", "ISO-8859-1");

    private final Ocr ocr = new Ocr();
    private final Pdf pdf = new Pdf();
    private final Text text = new Text();

    /**
     * Upper bound for a single extraction; zero or negative disables the bound.
     */
    private Duration timeout = Duration.ZERO;

    public Ocr getOcr() {
        return ocr;
    }

    public Pdf getPdf() {
        return pdf;
    }

    public Text getText() {
        return text;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout == null ? Duration.ZERO : timeout;
    }

    /**
     * OCR engine settings.
     */
    public static class Ocr {
        private String language = DEFAULT_OCR_LANGUAGE;
        private String datapath = "";

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public String getDatapath() {
            return datapath;
        }

        public void setDatapath(String datapath) {
            this.datapath = datapath;
        }
    }

    /**
     * PDF strategy settings.
     */
    public static class Pdf {
        private int significanceThreshold = DEFAULT_SIGNIFICANCE_THRESHOLD;
        private float renderDpi = DEFAULT_RENDER_DPI;

        public int getSignificanceThreshold() {
            return significanceThreshold;
        }

        public void setSignificanceThreshold(int significanceThreshold) {
            this.significanceThreshold = significanceThreshold;
        }

        public float getRenderDpi() {
            return renderDpi;
        }

        public void setRenderDpi(float renderDpi) {
            this.renderDpi = renderDpi;
        }
    }

    /**
     * Settings shared by the plain-text and tabular strategies.
     */
    public static class Text {
        private List<String> encodings = new ArrayList<>(DEFAULT_ENCODINGS);
        private int previewRows = DEFAULT_PREVIEW_ROWS;

        public List<String> getEncodings() {
            return encodings;
        }

        public void setEncodings(List<String> encodings) {
            this.encodings = encodings;
        }

        public int getPreviewRows() {
            return previewRows;
        }

        public void setPreviewRows(int previewRows) {
            this.previewRows = previewRows;
        }
    }
}
