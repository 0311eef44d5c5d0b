package ai.proofmine.heuristic.sentence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default splitter removing nested comments and cutting the remainder at sentence-ending periods.
 *
 * <p>A sentence ends at a single period (or a three-period ellipsis) followed by whitespace. Runs of two or
 * more periods that are not an ellipsis never end a sentence, which keeps recursive notations such as
 * {@code [x ; .. ; y]} intact. Leading bullets and braces are emitted as sentences of their own.
 */
public class DefaultSentenceSplitter implements SentenceSplitter {

    private static final String COMMENT_OPEN = "(*";
    private static final String COMMENT_CLOSE = "*)";
    private static final Pattern SENTENCE_END = Pattern.compile("(?<![.])(\\.{3}|\\.)(?![.])\\s");
    private static final Pattern LEADING_BULLET = Pattern.compile("\\s*(-+|\\++|\\*+)");
    private static final Pattern LEADING_BRACE = Pattern.compile("\\s*([{}])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public SplitResult split(String source) {
        if (source == null || source.isBlank()) {
            return SplitResult.empty();
        }
        List<Comment> comments = new ArrayList<>();
        StrippedSource stripped = stripComments(source, comments);
        LineIndex lineIndex = LineIndex.of(source);

        List<Sentence> sentences = new ArrayList<>();
        String text = stripped.text();
        Matcher matcher = SENTENCE_END.matcher(text);
        int chunkStart = 0;
        while (matcher.find()) {
            addChunk(stripped, lineIndex, chunkStart, matcher.end(1), sentences);
            chunkStart = matcher.end();
        }
        addChunk(stripped, lineIndex, chunkStart, text.length(), sentences);
        return new SplitResult(sentences, comments);
    }

    private void addChunk(StrippedSource stripped, LineIndex lineIndex, int start, int end, List<Sentence> sentences) {
        String text = stripped.text();
        int cursor = start;
        while (cursor < end) {
            Matcher bullet = LEADING_BULLET.matcher(text).region(cursor, end);
            if (bullet.lookingAt()) {
                sentences.add(token(stripped, lineIndex, bullet.group(1), bullet.start(1), bullet.end(1)));
                cursor = bullet.end();
                continue;
            }
            Matcher brace = LEADING_BRACE.matcher(text).region(cursor, end);
            if (brace.lookingAt()) {
                sentences.add(token(stripped, lineIndex, brace.group(1), brace.start(1), brace.end(1)));
                cursor = brace.end();
                continue;
            }
            break;
        }

        int first = cursor;
        while (first < end && Character.isWhitespace(text.charAt(first))) {
            first++;
        }
        int last = end - 1;
        while (last >= first && Character.isWhitespace(text.charAt(last))) {
            last--;
        }
        if (first > last) {
            return;
        }
        String body = WHITESPACE.matcher(text.substring(first, last + 1)).replaceAll(" ");
        if (!body.endsWith(".")) {
            body = body + ".";
        }
        sentences.add(token(stripped, lineIndex, body, first, last + 1));
    }

    private Sentence token(StrippedSource stripped, LineIndex lineIndex, String value, int start, int endExclusive) {
        int begin = stripped.originOf(start);
        int end = stripped.originOf(endExclusive - 1) + 1;
        return new Sentence(value, begin, Math.max(begin, end), lineIndex.lineOf(begin));
    }

    /**
     * Removes comments, which may nest. A stray closing delimiter outside any comment is kept as text and an
     * unterminated comment swallows the remainder of the source.
     */
    static StrippedSource stripComments(String source, List<Comment> comments) {
        StringBuilder kept = new StringBuilder(source.length());
        int[] origin = new int[source.length() + 1];
        int depth = 0;
        int commentStart = -1;
        int index = 0;
        while (index < source.length()) {
            if (source.startsWith(COMMENT_OPEN, index)) {
                if (depth == 0) {
                    commentStart = index;
                }
                depth++;
                index += COMMENT_OPEN.length();
                continue;
            }
            if (depth > 0 && source.startsWith(COMMENT_CLOSE, index)) {
                depth--;
                index += COMMENT_CLOSE.length();
                if (depth == 0) {
                    comments.add(new Comment(source.substring(commentStart, index), commentStart, index));
                    // a comment still separates the tokens around it
                    origin[kept.length()] = commentStart;
                    kept.append(' ');
                }
                continue;
            }
            if (depth == 0) {
                origin[kept.length()] = index;
                kept.append(source.charAt(index));
            }
            index++;
        }
        if (depth > 0) {
            comments.add(new Comment(source.substring(commentStart), commentStart, source.length()));
        }
        return new StrippedSource(kept.toString(), Arrays.copyOf(origin, kept.length()));
    }

    record StrippedSource(String text, int[] origin) {

        int originOf(int strippedIndex) {
            if (origin.length == 0) {
                return 0;
            }
            return origin[Math.max(0, Math.min(strippedIndex, origin.length - 1))];
        }
    }

    private static final class LineIndex {

        private final int[] lineStarts;

        private LineIndex(int[] lineStarts) {
            this.lineStarts = lineStarts;
        }

        static LineIndex of(String source) {
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < source.length(); i++) {
                if (source.charAt(i) == '\n') {
                    starts.add(i + 1);
                }
            }
            return new LineIndex(starts.stream().mapToInt(Integer::intValue).toArray());
        }

        int lineOf(int offset) {
            int position = Arrays.binarySearch(lineStarts, offset);
            return position >= 0 ? position + 1 : -position - 1;
        }
    }
}
