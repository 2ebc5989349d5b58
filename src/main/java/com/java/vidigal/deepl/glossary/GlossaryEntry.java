package com.java.vidigal.deepl.glossary;

/**
 * One source to target term mapping of a glossary.
 *
 * @param source the source phrase
 * @param target the target phrase
 */
public record GlossaryEntry(String source, String target) {

    public GlossaryEntry {
        if (source == null || target == null) {
            throw new IllegalArgumentException("Glossary entry phrases cannot be null");
        }
    }
}
