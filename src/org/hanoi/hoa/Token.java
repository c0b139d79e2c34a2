/* @LICENSE@
 */
package org.hanoi.hoa;

import static org.hanoi.hoa.Misc.Esc.DIAG;

/**
 * A lexical token of the HOA format. Tokens are created by the lexer and are
 * immutable. The position of a token (line, column and character offset) is
 * kept for diagnostics only; it is not part of the token's identity, so two
 * tokens with the same kind and text are equal wherever they were read.
 */
public final class Token {

    /**
     * The lexical classes of the HOA format.
     */
    public enum Kind {
        /** An identifier immediately followed by a colon, e.g. <code>States:</code>. */
        HEADER_NAME("header name"),
        IDENTIFIER("identifier"),
        /** An alias name, e.g. <code>@acc</code>. */
        ALIAS("alias name"),
        INT("integer"),
        STRING("string"),
        NOT("'!'"),
        AND("'&'"),
        OR("'|'"),
        LPAREN("'('"),
        RPAREN("')'"),
        LBRACKET("'['"),
        RBRACKET("']'"),
        LBRACE("'{'"),
        RBRACE("'}'"),
        BODY("--BODY--"),
        END("--END--"),
        ABORT("--ABORT--"),
        EOF("end of input");

        final String description;

        Kind(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    final Kind kind;
    final String text;
    final String value;
    final int line;
    final int column;
    final int offset;

    Token(Kind kind, String text, String value, int line, int column, int offset) {
        assert kind != null && text != null && value != null;
        this.kind = kind;
        this.text = text;
        this.value = value;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the token exactly as it appears in the input, quotes, colons
     *         and escape sequences included.
     */
    public String text() {
        return text;
    }

    /**
     * @return the decoded value: string contents with escapes resolved,
     *         header names without the colon, alias names without the
     *         <code>@</code>; the raw text for everything else.
     */
    public String value() {
        return value;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    int intValue() {
        assert kind == Kind.INT : this;
        return Integer.parseInt(text);
    }

    boolean is(Kind kind) {
        return this.kind == kind;
    }

    boolean is(Kind kind, String value) {
        return this.kind == kind && this.value.equals(value);
    }

    /**
     * @return a short description for error messages, e.g.
     *         <code>integer '12'</code>.
     */
    String describe() {
        if (kind == Kind.EOF) return kind.description;
        if (text.equals(kind.description) || kind.description.startsWith("'")) {
            return kind.description;
        }
        return kind.description + " '" + DIAG.esc(text) + '\'';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token t = (Token) o;
        return kind == t.kind && text.equals(t.text);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
