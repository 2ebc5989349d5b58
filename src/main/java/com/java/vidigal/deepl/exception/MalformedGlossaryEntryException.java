package com.java.vidigal.deepl.exception;

/**
 * Thrown when a line of tab-separated glossary entries does not hold exactly one source and one
 * target phrase.
 */
public class MalformedGlossaryEntryException extends DeepLDecodeException {

    private final int lineNumber;
    private final String line;

    /**
     * Constructs a new MalformedGlossaryEntryException.
     *
     * @param lineNumber the 1-based number of the offending line
     * @param line       the offending line
     */
    public MalformedGlossaryEntryException(int lineNumber, String line) {
        super("Expected 2 tab-separated values at line " + lineNumber + ", got \"" + line + "\"");
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
