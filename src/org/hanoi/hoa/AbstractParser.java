/* @LICENSE@
 */
package org.hanoi.hoa;

import java.util.ArrayList;
import java.util.List;

import org.hanoi.hoa.Misc.PushbackIterator;
import org.hanoi.hoa.Token.Kind;

/**
 * Token handling shared by the formula, header and body parsers, which all
 * read from the same token stream of one document.
 */
abstract class AbstractParser {

    final PushbackIterator<Token> tokens;

    AbstractParser(PushbackIterator<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * @return the next token. <code>--ABORT--</code> ends the document
     *         wherever it appears.
     */
    final Token next() {
        Token t = tokens.next();
        if (t.kind == Kind.ABORT) {
            throw new HoaSyntaxException(new Problem(Problem.Kind.ABORTED, t,
                    "document aborted by --ABORT--"), t.offset);
        }
        return t;
    }

    final void pushback() {
        tokens.pushback();
    }

    /**
     * Consumes the next token if it is of the given kind.
     */
    final Token accept(Kind kind) {
        Token t = next();
        if (t.kind == kind) return t;
        tokens.pushback();
        return null;
    }

    final Token expect(Kind kind, String expected) {
        return expect(Problem.Kind.UNEXPECTED_TOKEN, kind, expected);
    }

    final Token expect(Problem.Kind error, Kind kind, String expected) {
        Token t = next();
        if (t.kind != kind) {
            throw syntaxError(error, t, expected);
        }
        return t;
    }

    /**
     * Reads <code>INT (&amp; INT)*</code>.
     */
    final List<Integer> conjunction() {
        List<Integer> ret = new ArrayList<Integer>();
        ret.add(expect(Kind.INT, "a state number").intValue());
        while (accept(Kind.AND) != null) {
            ret.add(expect(Kind.INT, "a state number").intValue());
        }
        return ret;
    }

    static HoaSyntaxException syntaxError(Problem.Kind kind, Token at, String expected) {
        return new HoaSyntaxException(new Problem.Syntax(kind, at, expected), at.offset);
    }

    static HoaSyntaxException error(Problem.Kind kind, Token at, String message) {
        return new HoaSyntaxException(new Problem(kind, at, message), at.offset);
    }
}
