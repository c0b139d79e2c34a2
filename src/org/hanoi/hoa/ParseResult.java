/* @LICENSE@
 */
package org.hanoi.hoa;

/**
 * The outcome of reading one document: either an automaton or the report
 * explaining why there is none.
 */
public final class ParseResult {

    private final Automaton automaton;
    private final ErrorReport report;
    private final int line;

    ParseResult(Automaton automaton, int line) {
        this.automaton = automaton;
        this.report = ErrorReport.EMPTY;
        this.line = line;
    }

    ParseResult(ErrorReport report, int line) {
        assert !report.isEmpty();
        this.automaton = null;
        this.report = report;
        this.line = line;
    }

    public boolean isValid() {
        return automaton != null;
    }

    /**
     * @throws InvalidAutomatonException
     *             if the document was not valid.
     */
    public Automaton automaton() {
        if (automaton == null) {
            throw new InvalidAutomatonException(report);
        }
        return automaton;
    }

    /**
     * @return the problems found, empty for a valid document.
     */
    public ErrorReport report() {
        return report;
    }

    /**
     * @return the line the document starts on.
     */
    public int line() {
        return line;
    }

    @Override
    public String toString() {
        return isValid() ? "valid automaton at line " + line
                : "invalid automaton at line " + line + ": " + report.first();
    }
}
