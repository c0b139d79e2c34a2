/* @LICENSE@
 */
package org.hanoi.hoa;

import static org.hanoi.hoa.Misc.LS;

/**
 * Thrown when a document does not describe a well-formed automaton, or when
 * {@link Automaton.Builder#build()} is handed inconsistent parts.
 */
public final class InvalidAutomatonException extends IllegalArgumentException {

    private static final long serialVersionUID = -6419011587208327419L;

    private final ErrorReport report;

    InvalidAutomatonException(ErrorReport report) {
        super(report.size() == 1 ? report.toString() : report.size()
                + " problems:" + LS + report);
        assert !report.isEmpty();
        this.report = report;
    }

    public ErrorReport report() {
        return report;
    }
}
