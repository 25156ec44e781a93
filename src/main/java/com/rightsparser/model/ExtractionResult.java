package com.rightsparser.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Validated structured payload returned by the extraction orchestrator.
 * The payload always carries every required top-level key, possibly null-valued.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionResult {
    private ObjectNode payload;
    private String modelUsed;
    private int attempts;
}
