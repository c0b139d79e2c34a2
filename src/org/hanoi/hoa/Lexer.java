/* @LICENSE@
 */
package org.hanoi.hoa;

import static org.hanoi.hoa.Misc.Esc.DIAG;
import static org.hanoi.hoa.Token.Kind.ABORT;
import static org.hanoi.hoa.Token.Kind.ALIAS;
import static org.hanoi.hoa.Token.Kind.AND;
import static org.hanoi.hoa.Token.Kind.BODY;
import static org.hanoi.hoa.Token.Kind.END;
import static org.hanoi.hoa.Token.Kind.EOF;
import static org.hanoi.hoa.Token.Kind.HEADER_NAME;
import static org.hanoi.hoa.Token.Kind.IDENTIFIER;
import static org.hanoi.hoa.Token.Kind.INT;
import static org.hanoi.hoa.Token.Kind.LBRACE;
import static org.hanoi.hoa.Token.Kind.LBRACKET;
import static org.hanoi.hoa.Token.Kind.LPAREN;
import static org.hanoi.hoa.Token.Kind.NOT;
import static org.hanoi.hoa.Token.Kind.OR;
import static org.hanoi.hoa.Token.Kind.RBRACE;
import static org.hanoi.hoa.Token.Kind.RBRACKET;
import static org.hanoi.hoa.Token.Kind.RPAREN;
import static org.hanoi.hoa.Token.Kind.STRING;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import org.hanoi.hoa.Misc.PushbackIterator;

/**
 * Turns a range of characters into HOA tokens.
 * <p>
 * A lexer holds no scanning state of its own: every call to
 * {@link #iterator()} starts over at the beginning of the range, and tokens
 * are produced on demand. Line breaks are not tokens, they only advance the
 * line counter. Comments (<code>/* ... *&#47;</code>, nested comments
 * allowed) and whitespace are skipped.
 * <p>
 * The iterator ends with exactly one {@link Token.Kind#EOF} token. Lexical
 * errors are thrown as {@link HoaSyntaxException}s from
 * {@link java.util.Iterator#next()}.
 */
final class Lexer implements Iterable<Token> {

    private final CharSequence text;
    private final int begin;
    private final int end;
    private final int firstLine;
    private final int firstColumn;

    Lexer(CharSequence text) {
        this(text, 0, text.length(), 1, 1);
    }

    /**
     * @param line
     *            the line number of the character at <code>begin</code>, so
     *            that tokens of a document cut out of a larger text carry
     *            positions within that text.
     */
    Lexer(CharSequence text, int begin, int end, int line, int column) {
        if (begin < 0 || end > text.length() || begin > end) {
            throw new IndexOutOfBoundsException(begin + ".." + end);
        }
        this.text = text;
        this.begin = begin;
        this.end = end;
        this.firstLine = line;
        this.firstColumn = column;
    }

    public PushbackIterator<Token> iterator() {
        return new Scanner();
    }

    /**
     * @return the line the range starts on.
     */
    int line() {
        return firstLine;
    }

    /**
     * @return all tokens of the range, without the final EOF.
     */
    List<Token> tokens() {
        List<Token> ret = new ArrayList<Token>();
        for (Token t : this) {
            if (t.kind != EOF) ret.add(t);
        }
        return ret;
    }

    /**
     * @return whether <code>s</code> reads as exactly one identifier, e.g.
     *         <code>state-acc</code> or <code>v1.1</code>.
     */
    static boolean isIdentifier(String s) {
        if (s.length() == 0 || !isIdentifierStart(s.charAt(0))) return false;
        for (int i = 1; i < s.length(); ++i) {
            char c = s.charAt(i);
            if (isIdentifierPart(c)) continue;
            if (c == '.' && isDigit(s.charAt(i - 1))
                    && i + 1 < s.length() && isDigit(s.charAt(i + 1))) continue;
            return false;
        }
        return true;
    }

    /**
     * @return whether <code>s</code> can follow the <code>@</code> of an
     *         alias.
     */
    static boolean isAliasName(String s) {
        if (s.length() == 0) return false;
        for (int i = 0; i < s.length(); ++i) {
            if (!isIdentifierPart(s.charAt(i))) return false;
        }
        return true;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '-';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private final class Scanner implements PushbackIterator<Token> {

        private int pos = begin;
        private int line = firstLine;
        private int column = firstColumn;

        // start of the token being scanned
        private int start;
        private int startLine;
        private int startColumn;

        private Token last = null;
        private boolean pushedBack = false;
        private boolean done = false;

        public boolean hasNext() {
            return pushedBack || !done;
        }

        public Token next() {
            if (pushedBack) {
                pushedBack = false;
                return last;
            }
            if (done) throw new NoSuchElementException();
            last = scan();
            done = last.kind == EOF;
            return last;
        }

        public void pushback() {
            if (last == null || pushedBack) {
                throw new IllegalStateException("nothing to push back");
            }
            pushedBack = true;
        }

        public void remove() {
            throw new UnsupportedOperationException("sorry!");
        }

        private boolean atEnd() {
            return pos >= end;
        }

        private char peek() {
            return text.charAt(pos);
        }

        private boolean lookingAt(String s) {
            if (end - pos < s.length()) return false;
            for (int i = 0; i < s.length(); ++i) {
                if (text.charAt(pos + i) != s.charAt(i)) return false;
            }
            return true;
        }

        private char advance() {
            char c = text.charAt(pos++);
            if (c == '\n' || (c == '\r' && (atEnd() || peek() != '\n'))) {
                ++line;
                column = 1;
            } else {
                ++column;
            }
            return c;
        }

        private void mark() {
            start = pos;
            startLine = line;
            startColumn = column;
        }

        private Token token(Token.Kind kind) {
            String s = text.subSequence(start, pos).toString();
            return token(kind, s);
        }

        private Token token(Token.Kind kind, String value) {
            String s = text.subSequence(start, pos).toString();
            return new Token(kind, s, value, startLine, startColumn, start);
        }

        private HoaSyntaxException error(Problem.Kind kind, String expected, String found) {
            return new HoaSyntaxException(new Problem.Syntax(kind, startLine,
                    startColumn, expected, found), start);
        }

        private Token scan() {
            skipBlanks();
            mark();
            if (atEnd()) return token(EOF, "");
            char c = peek();
            switch (c) {
            case '!':
                advance();
                return token(NOT);
            case '&':
                advance();
                return token(AND);
            case '|':
                advance();
                return token(OR);
            case '(':
                advance();
                return token(LPAREN);
            case ')':
                advance();
                return token(RPAREN);
            case '[':
                advance();
                return token(LBRACKET);
            case ']':
                advance();
                return token(RBRACKET);
            case '{':
                advance();
                return token(LBRACE);
            case '}':
                advance();
                return token(RBRACE);
            case '"':
                return string();
            case '@':
                return alias();
            case '-':
                return marker();
            default:
                if (isDigit(c)) return integer();
                if (isIdentifierStart(c)) return identifier();
                throw error(Problem.Kind.UNEXPECTED_CHAR, "a token",
                        "character '" + DIAG.esc(String.valueOf(c)) + "'");
            }
        }

        private void skipBlanks() {
            while (!atEnd()) {
                char c = peek();
                if (c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f') {
                    advance();
                } else if (lookingAt("/*")) {
                    comment();
                } else {
                    return;
                }
            }
        }

        private void comment() {
            mark();
            int depth = 0;
            do {
                if (atEnd()) {
                    throw error(Problem.Kind.UNTERMINATED_COMMENT,
                            "'*/' closing the comment", Token.Kind.EOF.description);
                }
                if (lookingAt("/*")) {
                    advance(); advance();
                    ++depth;
                } else if (lookingAt("*/")) {
                    advance(); advance();
                    --depth;
                } else {
                    advance();
                }
            } while (depth > 0);
        }

        private Token string() {
            StringBuilder sb = new StringBuilder();
            advance(); // "
            while (true) {
                if (atEnd()) {
                    throw error(Problem.Kind.UNTERMINATED_STRING,
                            "'\"' closing the string", Token.Kind.EOF.description);
                }
                char c = advance();
                if (c == '"') break;
                if (c == '\\') {
                    if (atEnd()) continue; // reported above
                    c = advance();
                }
                sb.append(c);
            }
            return token(STRING, sb.toString());
        }

        private Token alias() {
            advance(); // @
            while (!atEnd() && isIdentifierPart(peek())) {
                advance();
            }
            if (pos - start == 1) {
                throw error(Problem.Kind.UNEXPECTED_CHAR, "an alias name after '@'",
                        atEnd() ? Token.Kind.EOF.description : "character '"
                                + DIAG.esc(String.valueOf(peek())) + "'");
            }
            return token(ALIAS, text.subSequence(start + 1, pos).toString());
        }

        private Token marker() {
            if (lookingAt("--BODY--")) {
                for (int i = 0; i < 8; ++i) advance();
                return token(BODY);
            }
            if (lookingAt("--END--")) {
                for (int i = 0; i < 7; ++i) advance();
                return token(END);
            }
            if (lookingAt("--ABORT--")) {
                for (int i = 0; i < 9; ++i) advance();
                return token(ABORT);
            }
            throw error(Problem.Kind.UNEXPECTED_CHAR, "--BODY--, --END-- or --ABORT--",
                    "character '-'");
        }

        /*
         * a dot between digits, as in v1.1
         */
        private boolean minorVersionDot() {
            return peek() == '.' && pos > start && isDigit(text.charAt(pos - 1))
                    && pos + 1 < end && isDigit(text.charAt(pos + 1));
        }

        private Token integer() {
            long value = 0;
            boolean overflow = false;
            while (!atEnd() && isDigit(peek())) {
                value = 10 * value + (advance() - '0');
                overflow |= value > Integer.MAX_VALUE;
                if (overflow) value = Integer.MAX_VALUE;
            }
            String digits = text.subSequence(start, pos).toString();
            if (digits.length() > 1 && digits.charAt(0) == '0') {
                throw error(Problem.Kind.UNEXPECTED_CHAR,
                        "an integer without leading zeros", "'" + digits + "'");
            }
            if (overflow) {
                throw error(Problem.Kind.INTEGER_OVERFLOW,
                        "an integer of at most " + Integer.MAX_VALUE, "'" + digits + "'");
            }
            return token(INT);
        }

        private Token identifier() {
            while (!atEnd() && (isIdentifierPart(peek()) || minorVersionDot())) {
                advance();
            }
            if (!atEnd() && peek() == ':') {
                String name = text.subSequence(start, pos).toString();
                advance();
                return token(HEADER_NAME, name);
            }
            return token(IDENTIFIER);
        }
    }
}
