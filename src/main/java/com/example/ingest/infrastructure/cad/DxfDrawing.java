package com.example.ingest.infrastructure.cad;

import java.util.List;

/**
 * Parsed view of a DXF file: every layer defined in the LAYER table and the model-space entities
 * in file order.
 */
public record DxfDrawing(
        List<String> layers,
        List<DxfEntity> entities
) {

    public DxfDrawing {
        layers = List.copyOf(layers);
        entities = List.copyOf(entities);
    }
}
