package com.example.pipeline.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Writes {@link CandidateStatus} map keys as display labels, matching how status values are written. */
public class StatusKeySerializer extends JsonSerializer<CandidateStatus> {

    @Override
    public void serialize(CandidateStatus value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeFieldName(value.label());
    }
}
