package com.java.vidigal.deepl.glossary;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The body of a glossary listing.
 */
public final class GlossaryListResponse {

    private final List<Glossary> glossaries;

    @JsonCreator
    public GlossaryListResponse(@JsonProperty("glossaries") List<Glossary> glossaries) {
        this.glossaries = glossaries == null ? List.of() : List.copyOf(glossaries);
    }

    public List<Glossary> getGlossaries() {
        return glossaries;
    }
}
