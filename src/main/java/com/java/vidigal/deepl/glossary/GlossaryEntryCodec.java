package com.java.vidigal.deepl.glossary;

import com.java.vidigal.deepl.exception.MalformedGlossaryEntryException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Tab-separated encoding of glossary entries: one entry per line, source and target separated by a
 * single tab. There is no escaping, so phrases cannot contain tabs or line breaks.
 *
 * @author Vidigal
 */
public final class GlossaryEntryCodec {

    /**
     * Value of the {@code entries_format} parameter for this encoding.
     */
    public static final String FORMAT = "tsv";

    /**
     * Media type DeepL answers with when asked for entries in this encoding.
     */
    public static final String MEDIA_TYPE = "text/tab-separated-values";

    private static final char SEPARATOR = '\t';

    private GlossaryEntryCodec() {
    }

    /**
     * Encodes entries, newline-joined in the given order, without a trailing newline.
     *
     * @param entries the entries
     * @return the TSV text
     * @throws IllegalArgumentException if a phrase contains a tab or a line break
     */
    public static String encode(List<GlossaryEntry> entries) {
        StringJoiner joiner = new StringJoiner("\n");
        for (GlossaryEntry entry : entries) {
            requireEncodable(entry.source());
            requireEncodable(entry.target());
            joiner.add(entry.source() + SEPARATOR + entry.target());
        }
        return joiner.toString();
    }

    /**
     * Decodes TSV text.
     *
     * @param tsv the TSV text
     * @return the entries, in line order
     * @throws MalformedGlossaryEntryException if a non-empty line does not hold exactly two fields
     */
    public static List<GlossaryEntry> decode(String tsv) throws MalformedGlossaryEntryException {
        try {
            return decode(new StringReader(tsv));
        } catch (IOException e) {
            // StringReader does not fail
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Decodes TSV text from a reader. Empty lines are skipped, "\r\n" line endings are accepted. The
     * first malformed line aborts decoding; no partial result is returned.
     *
     * @param reader the source of TSV text; not closed by this method
     * @return the entries, in line order
     * @throws MalformedGlossaryEntryException if a non-empty line does not hold exactly two fields
     * @throws IOException                     if reading fails
     */
    public static List<GlossaryEntry> decode(Reader reader) throws IOException, MalformedGlossaryEntryException {
        BufferedReader lines = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
        List<GlossaryEntry> entries = new ArrayList<>();
        int lineNumber = 0;
        String line;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            if (line.isEmpty()) {
                continue;
            }
            int tab = line.indexOf(SEPARATOR);
            if (tab < 0 || line.indexOf(SEPARATOR, tab + 1) >= 0) {
                throw new MalformedGlossaryEntryException(lineNumber, line);
            }
            entries.add(new GlossaryEntry(line.substring(0, tab), line.substring(tab + 1)));
        }
        return entries;
    }

    private static void requireEncodable(String phrase) {
        if (phrase.indexOf(SEPARATOR) >= 0 || phrase.indexOf('\n') >= 0 || phrase.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Glossary phrase cannot contain tabs or line breaks: \"" + phrase + "\"");
        }
    }
}
