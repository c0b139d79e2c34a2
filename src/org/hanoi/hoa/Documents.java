/* @LICENSE@
 */
package org.hanoi.hoa;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.hanoi.hoa.Token.Kind;

/**
 * Cuts a text into HOA documents. Each <code>HOA:</code> header starts a
 * new document, which extends up to the next one. Documents are found one at
 * a time, as the iterator is advanced.
 * <p>
 * When the text cannot be tokenized, the broken document extends to the
 * next line starting with <code>HOA:</code>.
 */
final class Documents implements Iterable<Documents.Range> {

    private static final Logger logger = Logger.getLogger("org.hanoi.hoa");
    private static final Level level = Level.FINER;

    private static final String MARKER = "HOA:";

    static final class Range {

        final CharSequence text;
        final int begin;
        final int end;
        final int line;
        final int column;

        Range(CharSequence text, int begin, int end, int line, int column) {
            this.text = text;
            this.begin = begin;
            this.end = end;
            this.line = line;
            this.column = column;
        }

        Lexer lexer() {
            return new Lexer(text, begin, end, line, column);
        }

        @Override
        public String toString() {
            return begin + ".." + end + " (line " + line + ")";
        }
    }

    private final CharSequence text;

    Documents(CharSequence text) {
        this.text = text;
    }

    public Iterator<Range> iterator() {

        return new Misc.ImmutableIterator<Range>() {

            private int pos = 0;
            private int line = 1;
            private int column = 1;
            private Range next = null;

            public boolean hasNext() {
                if (next == null) {
                    next = find();
                }
                return next != null;
            }

            public Range next() {
                if (!hasNext()) throw new NoSuchElementException();
                Range ret = next;
                next = null;
                return ret;
            }

            private Range find() {
                if (pos >= text.length()) return null;
                int end = text.length();
                Iterator<Token> tokens =
                        new Lexer(text, pos, text.length(), line, column).iterator();
                try {
                    Token first = tokens.next();
                    if (first.is(Kind.EOF)) {
                        pos = end;
                        return null;
                    }
                    for (Token t = tokens.next(); !t.is(Kind.EOF); t = tokens.next()) {
                        if (t.is(Kind.HEADER_NAME, "HOA")) {
                            end = t.offset;
                            break;
                        }
                    }
                } catch (HoaSyntaxException e) {
                    end = resync(e.offset + 1);
                    logger.log(level, "after " + e.problem() + ": next document at offset "
                        + end);
                }
                Range ret = new Range(text, pos, end, line, column);
                advanceTo(end);
                logger.log(level, "document " + ret);
                return ret;
            }

            private void advanceTo(int end) {
                for (; pos < end; ++pos) {
                    char c = text.charAt(pos);
                    if (c == '\n' || (c == '\r'
                            && (pos + 1 >= text.length() || text.charAt(pos + 1) != '\n'))) {
                        ++line;
                        column = 1;
                    } else {
                        ++column;
                    }
                }
            }
        };
    }

    /**
     * @return the offset of the first <code>HOA:</code> at the start of a
     *         line, at or after <code>from</code>; the end of the text if
     *         there is none.
     */
    int resync(int from) {
        for (int i = Math.max(from, 1); i + MARKER.length() <= text.length(); ++i) {
            char before = text.charAt(i - 1);
            if ((before == '\n' || before == '\r') && startsWith(i)) {
                return i;
            }
        }
        return text.length();
    }

    private boolean startsWith(int i) {
        for (int j = 0; j < MARKER.length(); ++j) {
            if (text.charAt(i + j) != MARKER.charAt(j)) return false;
        }
        return true;
    }
}
