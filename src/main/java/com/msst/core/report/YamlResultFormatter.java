package com.msst.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.msst.core.model.TestRun;

/**
 * Structured record as block-style YAML.
 */
public class YamlResultFormatter implements ResultFormatter {

    private final ObjectMapper mapper = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            // keep padded IDs such as "005" strings when read back
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
            .build());

    @Override
    public OutputFormat outputFormat() {
        return OutputFormat.YAML;
    }

    @Override
    public String format(TestRun run) {
        try {
            return mapper.writeValueAsString(ResultDocument.of(run));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize results to YAML", e);
        }
    }
}
