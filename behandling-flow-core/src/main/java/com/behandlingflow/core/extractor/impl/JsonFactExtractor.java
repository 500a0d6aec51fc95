package com.behandlingflow.core.extractor.impl;

import java.util.Set;

import com.behandlingflow.core.extractor.base.AbstractJacksonFactExtractor;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads fact documents written as JSON ({@code *.facts.json}).
 */
public class JsonFactExtractor extends AbstractJacksonFactExtractor {

    private static final String EXTRACTOR_ID = "json-facts";
    private static final String EXTRACTOR_DISPLAY_NAME = "JSON Fact Document";

    public JsonFactExtractor() {
        super(new ObjectMapper());
    }

    @Override
    public String getId() {
        return EXTRACTOR_ID;
    }

    @Override
    public String getDisplayName() {
        return EXTRACTOR_DISPLAY_NAME;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("*.facts.json", "**/*.facts.json");
    }

    @Override
    public int getPriority() {
        return 10;
    }
}
