package com.example.ingest.infrastructure.cad;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal reader for ASCII DXF drawings.
 *
 * <p>A DXF file is a flat sequence of (group code, value) line pairs. Only the LAYER table and
 * the ENTITIES section are interpreted; every other section is skipped. Binary DXF and DWG
 * files are rejected by signature before any parsing.</p>
 */
@Component
public class DxfReader {

    private static final String BINARY_DXF_SENTINEL = "AutoCAD Binary DXF";
    private static final Pattern DWG_SIGNATURE = Pattern.compile("^(AC\\d{4})");
    /** Entities owned by a preceding POLYLINE or INSERT rather than by model space. */
    private static final Set<String> SUBORDINATE_TYPES = Set.of("VERTEX", "SEQEND", "ATTRIB");
    private static final Charset ANSI_CODE_PAGE = Charset.forName("windows-1252");

    /**
     * Reads and parses a drawing.
     *
     * @param file DXF file
     * @return layers and model-space entities
     * @throws IOException       when the file cannot be read
     * @throws DxfParseException when the file is binary, truncated or structurally invalid
     */
    public DxfDrawing read(Path file) throws IOException, DxfParseException {
        byte[] bytes = Files.readAllBytes(file);
        rejectBinary(bytes);
        return parse(decode(bytes).lines().toList());
    }

    /**
     * Parses the text lines of an ASCII DXF file.
     *
     * @param lines file content split into lines
     * @return parsed drawing
     * @throws DxfParseException when the group structure is invalid
     */
    DxfDrawing parse(List<String> lines) throws DxfParseException {
        List<Group> groups = toGroups(lines);
        List<String> layers = new ArrayList<>();
        List<DxfEntity> entities = new ArrayList<>();

        String section = null;
        String table = null;
        boolean inLayerEntry = false;
        boolean sawSection = false;
        boolean sawEof = false;
        EntityBuilder entity = null;

        for (int i = 0; i < groups.size(); i++) {
            Group group = groups.get(i);
            if (group.code() != 0) {
                if (entity != null) {
                    entity.accept(group);
                } else if (inLayerEntry && group.code() == 2) {
                    layers.add(group.value().trim());
                }
                continue;
            }

            if (entity != null) {
                entity.build().ifPresent(entities::add);
                entity = null;
            }
            inLayerEntry = false;
            String value = group.value().trim();
            switch (value) {
                case "SECTION" -> {
                    section = requireName(groups, ++i, "SECTION");
                    sawSection = true;
                }
                case "ENDSEC" -> {
                    section = null;
                    table = null;
                }
                case "TABLE" -> table = "TABLES".equals(section) ? requireName(groups, ++i, "TABLE") : null;
                case "ENDTAB" -> table = null;
                case "EOF" -> sawEof = true;
                default -> {
                    if ("ENTITIES".equals(section)) {
                        entity = new EntityBuilder(value);
                    } else if ("LAYER".equals(table) && "LAYER".equals(value)) {
                        inLayerEntry = true;
                    }
                }
            }
            if (sawEof) {
                break;
            }
        }

        if (!sawSection) {
            throw new DxfParseException("No DXF sections found");
        }
        if (entity != null || (section != null && !sawEof)) {
            throw new DxfParseException("Unexpected end of file inside section " + section);
        }
        return new DxfDrawing(layers, entities);
    }

    private void rejectBinary(byte[] bytes) throws DxfParseException {
        String head = new String(bytes, 0, Math.min(bytes.length, 32), StandardCharsets.ISO_8859_1);
        if (head.startsWith(BINARY_DXF_SENTINEL)) {
            throw new DxfParseException("Binary DXF files are not supported");
        }
        Matcher dwg = DWG_SIGNATURE.matcher(head);
        if (dwg.find()) {
            throw new DxfParseException("Legacy binary drawing format " + dwg.group(1) + " (DWG) is not supported");
        }
        int probe = Math.min(bytes.length, 1024);
        for (int i = 0; i < probe; i++) {
            if (bytes[i] == 0) {
                throw new DxfParseException("Not an ASCII DXF file");
            }
        }
    }

    /**
     * Drawings from AutoCAD 2007 on are UTF-8; older ones use the ANSI code page.
     */
    private String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return new String(bytes, ANSI_CODE_PAGE);
        }
    }

    private List<Group> toGroups(List<String> lines) throws DxfParseException {
        int usable = lines.size();
        while (usable > 0 && lines.get(usable - 1).isBlank()) {
            usable--;
        }
        if (usable % 2 != 0) {
            throw new DxfParseException("Truncated group at line " + usable);
        }
        List<Group> groups = new ArrayList<>(usable / 2);
        for (int i = 0; i < usable; i += 2) {
            String rawCode = lines.get(i).trim();
            try {
                groups.add(new Group(Integer.parseInt(rawCode), lines.get(i + 1)));
            } catch (NumberFormatException e) {
                throw new DxfParseException("Invalid group code '" + rawCode + "' at line " + (i + 1));
            }
        }
        return groups;
    }

    private String requireName(List<Group> groups, int index, String owner) throws DxfParseException {
        if (index >= groups.size() || groups.get(index).code() != 2) {
            throw new DxfParseException(owner + " without a name group");
        }
        return groups.get(index).value().trim();
    }

    private record Group(int code, String value) {
    }

    /**
     * Collects the groups of the entity currently being read.
     */
    private static final class EntityBuilder {
        private final String type;
        private final List<String> chunks = new ArrayList<>();
        private String layer = "";
        private String primaryText;
        private boolean paperSpace;

        EntityBuilder(String type) {
            this.type = type;
        }

        void accept(Group group) {
            switch (group.code()) {
                case 1 -> primaryText = group.value();
                case 3 -> chunks.add(group.value());
                case 8 -> layer = group.value().trim();
                case 67 -> paperSpace = "1".equals(group.value().trim());
                default -> {
                    // geometry and styling groups are not needed
                }
            }
        }

        Optional<DxfEntity> build() {
            if (paperSpace || SUBORDINATE_TYPES.contains(type)) {
                return Optional.empty();
            }
            return Optional.of(new DxfEntity(type, layer, primaryText, chunks));
        }
    }
}
