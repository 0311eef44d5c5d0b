package ai.proofmine.heuristic.config;

import java.util.Locale;

/**
 * How parsed documents are written to standard output.
 */
public enum OutputFormat {
    /** Per-sentence statistics table followed by a summary. */
    TEXT,
    /** Statistics as one JSON object per document. */
    JSON,
    /** The parsed sentence stream, one sentence or glommed proof per line. */
    SENTENCES;

    public static OutputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Output format must be provided");
        }
        try {
            return OutputFormat.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported output format: " + raw, ex);
        }
    }
}
