package com.example.ingest.infrastructure.text;

import com.example.ingest.config.ExtractionProperties;
import com.example.ingest.domain.model.ExtractionResult;
import com.example.ingest.domain.model.MetadataKeys;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the plain-text strategy and charset resolution.
 */
class PlainTextExtractionStrategyTest {

    @TempDir
    Path tempDir;

    @Test
    void trailingNewlineCountsAsExtraLine() throws Exception {
        Path txt = tempDir.resolve("notes.txt");
        Files.writeString(txt, "one\ntwo\n", StandardCharsets.UTF_8);

        ExtractionResult result = new PlainTextExtractionStrategy(new CharsetResolver(List.of("UTF-8"))).extract(txt);

        assertThat(result.text()).isEqualTo("one\ntwo\n");
        assertThat(result.metadata())
                .containsEntry(MetadataKeys.LINES, 3)
                .containsEntry(MetadataKeys.ENCODING, "UTF-8");
    }

    @Test
    void carriageReturnLineEndingsAreCounted() throws Exception {
        Path mac = tempDir.resolve("classic-mac.txt");
        Files.writeString(mac, "one\rtwo\rthree", StandardCharsets.UTF_8);
        Path windows = tempDir.resolve("windows.txt");
        Files.writeString(windows, "one\r\ntwo\r\n", StandardCharsets.UTF_8);
        PlainTextExtractionStrategy strategy = new PlainTextExtractionStrategy(new CharsetResolver(List.of("UTF-8")));

        ExtractionResult macResult = strategy.extract(mac);
        ExtractionResult windowsResult = strategy.extract(windows);

        assertThat(macResult.text()).isEqualTo("one\rtwo\rthree");
        assertThat(macResult.metadata()).containsEntry(MetadataKeys.LINES, 3);
        assertThat(windowsResult.text()).isEqualTo("one\r\ntwo\r\n");
        assertThat(windowsResult.metadata()).containsEntry(MetadataKeys.LINES, 3);
    }

    @Test
    void windowsEncodedFileIsReadAsCp1252() throws Exception {
        Path txt = tempDir.resolve("menu.txt");
        Files.write(txt, "Crème brûlée – 5 €\nCafé\n".getBytes(Charset.forName("windows-1252")));

        ExtractionResult result = new PlainTextExtractionStrategy(
                new CharsetResolver(new ExtractionProperties())).extract(txt);

        assertThat(result.hasError()).isFalse();
        assertThat(result.text()).isEqualTo("Crème brûlée – 5 €\nCafé\n");
        assertThat(result.metadata())
                .containsEntry(MetadataKeys.ENCODING, "windows-1252")
                .containsEntry(MetadataKeys.LINES, 3);
    }

    @Test
    void emptyFileHasOneLine() throws Exception {
        Path txt = tempDir.resolve("empty.txt");
        Files.writeString(txt, "");

        ExtractionResult result = new PlainTextExtractionStrategy(new CharsetResolver(List.of("UTF-8"))).extract(txt);

        assertThat(result.text()).isEmpty();
        assertThat(result.metadata()).containsEntry(MetadataKeys.LINES, 1);
    }

    @Test
    void undecodableContentYieldsError() throws Exception {
        Path txt = tempDir.resolve("latin.txt");
        Files.write(txt, new byte[]{'c', 'a', 'f', (byte) 0xE9});

        ExtractionResult result = new PlainTextExtractionStrategy(new CharsetResolver(List.of("UTF-8"))).extract(txt);

        assertThat(result.text()).isEmpty();
        assertThat(result.error()).hasValueSatisfying(error -> assertThat(error).contains("UTF-8"));
        assertThat(result.metadata()).containsEntry(MetadataKeys.LINES, 0);
    }

    @Test
    void resolverUsesFirstCharsetThatAcceptsEveryByte() {
        CharsetResolver resolver = new CharsetResolver(List.of("UTF-8", "windows-1252", "ISO-8859-1"));

        CharsetResolver.DecodedText decoded = resolver.decode(new byte[]{'c', 'a', 'f', (byte) 0xE9}).value();

        assertThat(decoded.text()).isEqualTo("café");
        assertThat(decoded.encoding()).isEqualTo("windows-1252");
        assertThat(resolver.primaryEncoding()).isEqualTo("UTF-8");
    }

    @Test
    void undefinedCp1252ByteFallsThroughToLatin1() {
        CharsetResolver resolver = new CharsetResolver(List.of("UTF-8", "windows-1252", "ISO-8859-1"));

        assertThat(resolver.decode(new byte[]{'x', (byte) 0x81}).value().encoding()).isEqualTo("ISO-8859-1");
    }
}
