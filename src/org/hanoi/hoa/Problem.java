/* @LICENSE@
 */
package org.hanoi.hoa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single diagnostic produced while reading or validating a HOA document.
 * <p>
 * Every problem has a {@link Kind}, which in turn belongs to a
 * {@link Category}, a position (1-based line and column, or <code>-1</code>
 * when the problem is not tied to a place in the input, e.g. for automata
 * assembled through {@link Automaton.Builder}) and a human readable message.
 * Problems which carry structured details are represented by the nested
 * subclasses.
 */
public class Problem {

    public enum Category {
        LEX, PARSE, VALIDATION
    }

    public enum Kind {
        UNTERMINATED_STRING(Category.LEX),
        UNTERMINATED_COMMENT(Category.LEX),
        UNEXPECTED_CHAR(Category.LEX),
        INTEGER_OVERFLOW(Category.LEX),

        MISSING_REQUIRED_HEADER(Category.PARSE),
        DUPLICATE_EXCLUSIVE_HEADER(Category.PARSE),
        MALFORMED_FORMULA(Category.PARSE),
        EDGE_BEFORE_STATE(Category.PARSE),
        MISSING_END(Category.PARSE),
        UNEXPECTED_TOKEN(Category.PARSE),
        UNSUPPORTED_VERSION(Category.PARSE),
        ABORTED(Category.PARSE),

        RANGE_VIOLATION(Category.VALIDATION),
        UNRESOLVED_ALIAS(Category.VALIDATION),
        CYCLIC_ALIAS(Category.VALIDATION),
        INCONSISTENT_LABELING(Category.VALIDATION),
        UNKNOWN_PROPERTY(Category.VALIDATION),
        CARDINALITY_MISMATCH(Category.VALIDATION),
        DUPLICATE_STATE(Category.VALIDATION),
        DUPLICATE_PROPOSITION(Category.VALIDATION);

        final Category category;

        Kind(Category category) {
            this.category = category;
        }

        public Category category() {
            return category;
        }
    }

    /**
     * What a {@link RangeViolation} index was checked against.
     */
    public enum Range {
        PROPOSITION("atomic proposition", "AP"),
        ACCEPTANCE_SET("acceptance set", "Acceptance"),
        START_STATE("start state", "States"),
        EDGE_TARGET("edge target", "States"),
        STATE("state", "States");

        final String noun;
        final String header;

        Range(String noun, String header) {
            this.noun = noun;
            this.header = header;
        }
    }

    final Kind kind;
    final int line;
    final int column;
    final String message;

    Problem(Kind kind, int line, int column, String message) {
        assert kind != null && message != null;
        this.kind = kind;
        this.line = line;
        this.column = column;
        this.message = message;
    }

    Problem(Kind kind, Token at, String message) {
        this(kind, at.line, at.column, message);
    }

    public Kind kind() {
        return kind;
    }

    public Category category() {
        return kind.category;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public String message() {
        return message;
    }

    boolean hasPosition() {
        return line > 0;
    }

    @Override
    public String toString() {
        return hasPosition() ? line + ":" + column + ": " + message : message;
    }

    /**
     * A lexical or grammatical error: something was expected, something
     * else was found.
     */
    public static final class Syntax extends Problem {

        final String expected;
        final String found;

        Syntax(Kind kind, int line, int column, String expected, String found) {
            super(kind, line, column, found == null
                    ? expected
                    : "expected " + expected + ", found " + found);
            this.expected = expected;
            this.found = found;
        }

        Syntax(Kind kind, Token at, String expected) {
            this(kind, at.line, at.column, expected, at.describe());
        }

        /**
         * @return what the reader expected, or the whole complaint when
         *         there is nothing sensible to say about what was found.
         */
        public String expected() {
            return expected;
        }

        /**
         * @return a description of what was found instead, may be null.
         */
        public String found() {
            return found;
        }
    }

    public static final class RangeViolation extends Problem {

        final Range range;
        final int index;
        final int bound;

        RangeViolation(Range range, int index, int bound, int line, int column) {
            super(Kind.RANGE_VIOLATION, line, column, range.noun + " " + index
                    + " out of range (" + range.header + ": " + bound + ")");
            this.range = range;
            this.index = index;
            this.bound = bound;
        }

        public Range range() {
            return range;
        }

        public int index() {
            return index;
        }

        public int bound() {
            return bound;
        }
    }

    public static final class UnresolvedAlias extends Problem {

        final String name;

        UnresolvedAlias(String name, String message, int line, int column) {
            super(Kind.UNRESOLVED_ALIAS, line, column, message);
            this.name = name;
        }

        /**
         * @return the alias name, without <code>@</code>.
         */
        public String name() {
            return name;
        }
    }

    public static final class CyclicAlias extends Problem {

        final List<String> chain;

        CyclicAlias(List<String> chain, int line, int column) {
            super(Kind.CYCLIC_ALIAS, line, column, "cyclic alias definition: "
                    + render(chain));
            this.chain = Collections.unmodifiableList(new ArrayList<String>(chain));
        }

        private static String render(List<String> chain) {
            StringBuilder sb = new StringBuilder();
            for (String name : chain) {
                sb.append(sb.length() == 0 ? "@" : " -> @").append(name);
            }
            return sb.toString();
        }

        /**
         * @return the alias names along the cycle; the first name is repeated
         *         at the end.
         */
        public List<String> chain() {
            return chain;
        }
    }

    public static final class CardinalityMismatch extends Problem {

        final int declared;
        final int actual;

        CardinalityMismatch(String what, int declared, int actual, int line, int column) {
            super(Kind.CARDINALITY_MISMATCH, line, column, declared + " " + what
                    + " declared, " + actual + " found");
            this.declared = declared;
            this.actual = actual;
        }

        public int declared() {
            return declared;
        }

        public int actual() {
            return actual;
        }
    }
}
