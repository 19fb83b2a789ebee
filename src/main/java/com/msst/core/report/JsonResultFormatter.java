package com.msst.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.msst.core.model.TestRun;

/**
 * Structured record as pretty-printed JSON.
 */
public class JsonResultFormatter implements ResultFormatter {

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public OutputFormat outputFormat() {
        return OutputFormat.JSON;
    }

    @Override
    public String format(TestRun run) {
        try {
            return mapper.writeValueAsString(ResultDocument.of(run));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize results to JSON", e);
        }
    }

    /** Reads a document written by {@link #format}. */
    public ResultDocument parse(String json) throws JsonProcessingException {
        return mapper.readValue(json, ResultDocument.class);
    }
}
