package com.behandlingflow.core.extractor.impl;

import java.util.Set;

import com.behandlingflow.core.extractor.base.AbstractJacksonFactExtractor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads fact documents written as YAML ({@code *.facts.yaml}, {@code *.facts.yml}).
 */
public class YamlFactExtractor extends AbstractJacksonFactExtractor {

    private static final String EXTRACTOR_ID = "yaml-facts";
    private static final String EXTRACTOR_DISPLAY_NAME = "YAML Fact Document";

    public YamlFactExtractor() {
        super(new ObjectMapper(new YAMLFactory()));
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
        return Set.of("*.facts.yaml", "**/*.facts.yaml", "*.facts.yml", "**/*.facts.yml");
    }

    @Override
    public int getPriority() {
        return 20;
    }
}
