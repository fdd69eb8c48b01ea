package com.example.ingest.application.service;

import com.example.ingest.domain.exception.UnsupportedFormatException;
import com.example.ingest.domain.extraction.ExtractionStrategy;
import com.example.ingest.domain.model.DocumentFormat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry mapping format tags to extraction strategies.
 *
 * <p>Primary bindings are registered per tag; aliases are explicit data pointing one tag at the
 * strategy of another (a legacy office format reusing the newer office strategy, a spreadsheet
 * reusing the tabular strategy). Tags are matched case-insensitively. An unknown tag is the only
 * condition in the extraction core that raises to the caller.</p>
 */
public class ExtractionStrategyFactory {

    /** Legacy or reduced-fidelity formats served by another format's strategy. */
    public static final Map<String, String> DEFAULT_ALIASES = defaultAliases();

    private final Map<String, ExtractionStrategy> strategies = new ConcurrentHashMap<>();
    private final Map<String, String> aliases;

    /**
     * @param bindings primary tag to strategy bindings
     * @param aliases  alias tag to primary tag; every target must be bound
     * @throws IllegalArgumentException when an alias points at an unbound tag
     */
    public ExtractionStrategyFactory(Map<String, ExtractionStrategy> bindings, Map<String, String> aliases) {
        bindings.forEach(this::register);
        Map<String, String> normalized = new LinkedHashMap<>();
        aliases.forEach((alias, target) -> {
            String key = normalize(target);
            if (!strategies.containsKey(key)) {
                throw new IllegalArgumentException("Alias " + alias + " points at unbound format " + target);
            }
            normalized.put(normalize(alias), key);
        });
        this.aliases = Collections.unmodifiableMap(normalized);
    }

    /**
     * Resolves the strategy for a tag, following one alias hop.
     *
     * @param formatTag tag produced by format detection
     * @return ready-to-use strategy
     * @throws UnsupportedFormatException when no strategy is bound to the tag
     */
    public ExtractionStrategy getStrategy(String formatTag) {
        String key = normalize(formatTag);
        ExtractionStrategy strategy = strategies.get(key);
        if (strategy == null && aliases.containsKey(key)) {
            strategy = strategies.get(aliases.get(key));
        }
        if (strategy == null) {
            throw new UnsupportedFormatException(formatTag);
        }
        return strategy;
    }

    /**
     * Binds a strategy to a tag without touching existing bindings for other tags.
     *
     * @param formatTag tag to bind
     * @param strategy  strategy serving the tag
     */
    public void register(String formatTag, ExtractionStrategy strategy) {
        strategies.put(normalize(Objects.requireNonNull(formatTag, "formatTag")),
                Objects.requireNonNull(strategy, "strategy"));
    }

    /**
     * @return alias tag to primary tag, in declaration order
     */
    public Map<String, String> aliases() {
        return aliases;
    }

    /**
     * @return every tag the factory resolves, primary and alias
     */
    public Set<String> supportedTags() {
        Set<String> tags = new TreeSet<>(strategies.keySet());
        tags.addAll(aliases.keySet());
        return tags;
    }

    private static Map<String, String> defaultAliases() {
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put(DocumentFormat.DOC.tag(), DocumentFormat.DOCX.tag());
        aliases.put(DocumentFormat.DWG.tag(), DocumentFormat.DXF.tag());
        aliases.put(DocumentFormat.XLSX.tag(), DocumentFormat.CSV.tag());
        return Collections.unmodifiableMap(aliases);
    }

    private static String normalize(String formatTag) {
        return formatTag == null ? "" : formatTag.trim().toUpperCase(Locale.ROOT);
    }
}
