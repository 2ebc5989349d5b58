package com.java.vidigal.deepl.glossary;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * A glossary stored by DeepL. Instances are snapshots: the service may change readiness or entry
 * count at any time, and the client never caches them.
 *
 * @author Vidigal
 */
public final class Glossary {

    private final String glossaryId;
    private final String name;
    private final boolean ready;
    private final String sourceLang;
    private final String targetLang;
    private final Instant creationTime;
    private final int entryCount;

    @JsonCreator
    public Glossary(@JsonProperty("glossary_id") String glossaryId,
                    @JsonProperty("name") String name,
                    @JsonProperty("ready") boolean ready,
                    @JsonProperty("source_lang") String sourceLang,
                    @JsonProperty("target_lang") String targetLang,
                    @JsonProperty("creation_time") Instant creationTime,
                    @JsonProperty("entry_count") int entryCount) {
        this.glossaryId = glossaryId;
        this.name = name;
        this.ready = ready;
        this.sourceLang = sourceLang;
        this.targetLang = targetLang;
        this.creationTime = creationTime;
        this.entryCount = entryCount;
    }

    public String getGlossaryId() {
        return glossaryId;
    }

    public String getName() {
        return name;
    }

    /**
     * Tells whether the glossary can already be used in translations.
     *
     * @return true once DeepL has finished processing the glossary
     */
    public boolean isReady() {
        return ready;
    }

    public String getSourceLang() {
        return sourceLang;
    }

    public String getTargetLang() {
        return targetLang;
    }

    public Instant getCreationTime() {
        return creationTime;
    }

    public int getEntryCount() {
        return entryCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Glossary other)) {
            return false;
        }
        return ready == other.ready
                && entryCount == other.entryCount
                && Objects.equals(glossaryId, other.glossaryId)
                && Objects.equals(name, other.name)
                && Objects.equals(sourceLang, other.sourceLang)
                && Objects.equals(targetLang, other.targetLang)
                && Objects.equals(creationTime, other.creationTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(glossaryId, name, ready, sourceLang, targetLang, creationTime, entryCount);
    }

    @Override
    public String toString() {
        return "Glossary{glossaryId='" + glossaryId + "', name='" + name + "', ready=" + ready
                + ", sourceLang='" + sourceLang + "', targetLang='" + targetLang
                + "', creationTime=" + creationTime + ", entryCount=" + entryCount + "}";
    }
}
