/* @LICENSE@
 */
package org.hanoi.hoa;

import static org.hanoi.hoa.Misc.LS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An immutable, ordered list of {@link Problem}s found in one document.
 * <code>toString()</code> gives one <code>line:column: message</code> per
 * problem.
 */
public final class ErrorReport implements Iterable<Problem> {

    static final ErrorReport EMPTY = new ErrorReport(Collections.<Problem> emptyList());

    private final List<Problem> problems;

    ErrorReport(List<? extends Problem> problems) {
        this.problems = Collections.unmodifiableList(new ArrayList<Problem>(problems));
    }

    static ErrorReport of(Problem problem) {
        return new ErrorReport(Collections.singletonList(problem));
    }

    public List<Problem> problems() {
        return problems;
    }

    public Iterator<Problem> iterator() {
        return problems.iterator();
    }

    public boolean isEmpty() {
        return problems.isEmpty();
    }

    public int size() {
        return problems.size();
    }

    /**
     * @return the first problem, or null if there is none.
     */
    public Problem first() {
        return problems.isEmpty() ? null : problems.get(0);
    }

    public boolean contains(Problem.Kind kind) {
        for (Problem p : problems) {
            if (p.kind == kind) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Problem p : problems) {
            if (sb.length() > 0) sb.append(LS);
            sb.append(p);
        }
        return sb.toString();
    }
}
