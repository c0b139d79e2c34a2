/* @LICENSE@
 */
package org.hanoi.hoa;

/**
 * Thrown by the lexer and the parsers at the first error in a document. The
 * exception is converted into an {@link ErrorReport} before it reaches the
 * callers of {@link Automaton#parse(CharSequence)}; it escapes only from
 * {@link Automaton.Builder#item(String, CharSequence)}, whose argument is
 * lexed on the spot.
 */
public final class HoaSyntaxException extends IllegalArgumentException {

    private static final long serialVersionUID = 3021558391266547163L;

    private final Problem problem;
    final transient int offset;

    HoaSyntaxException(Problem problem, int offset) {
        super(problem.toString());
        this.problem = problem;
        this.offset = offset;
    }

    public Problem problem() {
        return problem;
    }
}
