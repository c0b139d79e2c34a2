/* @LICENSE@
 */
package org.hanoi.hoa;

import static org.hanoi.hoa.Misc.LS;
import static org.hanoi.hoa.Misc.clear;

import java.io.Flushable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.Stack;
import java.util.TreeSet;

import org.hanoi.hoa.Formula.Visitor.TraversalOrder;

/**
 * An immutable boolean formula over atomic propositions, alias references
 * and acceptance-set atoms. Formulas label states and edges, define aliases,
 * and express the acceptance condition of an automaton.
 * <p>
 * Formulas are values: two formulas are equal when they have the same shape.
 * Conjunctions and disjunctions are n-ary and flattened on construction, so
 * <code>a | b | c</code> and <code>(a | b) | c</code> are the same
 * {@link Or} of three operands. No other simplification is performed;
 * <code>!!0</code> and <code>t &amp; 0</code> are kept as written.
 * <p>
 * <code>toString()</code> gives HOA syntax which reads back as an equal
 * formula.
 */
public abstract class Formula {

    public static final Constant TRUE = new Constant(true);
    public static final Constant FALSE = new Constant(false);

    Formula() {} // closed hierarchy

    /**
     * @return the indices of all atomic propositions referenced, in
     *         ascending order. Aliases are not expanded.
     */
    public final SortedSet<Integer> propositions() {
        final SortedSet<Integer> ret = new TreeSet<Integer>();
        new Visitor(TraversalOrder.TOP_DOWN) {
            @Override
            protected void visit(Ap node) {
                ret.add(node.index);
            }
        }.visit(this);
        return Collections.unmodifiableSortedSet(ret);
    }

    /**
     * @return the acceptance sets referenced by <code>Inf</code> and
     *         <code>Fin</code> atoms, in ascending order.
     */
    public final SortedSet<Integer> acceptanceSets() {
        final SortedSet<Integer> ret = new TreeSet<Integer>();
        new Visitor(TraversalOrder.TOP_DOWN) {
            @Override
            protected void visit(AccSet node) {
                ret.add(node.set);
            }
        }.visit(this);
        return Collections.unmodifiableSortedSet(ret);
    }

    /**
     * @return the names of the aliases referenced, in order of first
     *         appearance.
     */
    public final Set<String> aliases() {
        final Set<String> ret = new LinkedHashSet<String>();
        new Visitor(TraversalOrder.TOP_DOWN) {
            @Override
            protected void visit(AliasRef node) {
                ret.add(node.name);
            }
        }.visit(this);
        return Collections.unmodifiableSet(ret);
    }

    /*
     * whether the formula can be written as an acceptance condition:
     * constants, Inf and Fin combined by & and |
     */
    final boolean isCondition() {
        final boolean[] ret = {true};
        new Visitor(TraversalOrder.TOP_DOWN) {
            @Override
            protected void visit(Not node) {
                ret[0] = false;
            }
            @Override
            protected void visit(Ap node) {
                ret[0] = false;
            }
            @Override
            protected void visit(AliasRef node) {
                ret[0] = false;
            }
        }.visit(this);
        return ret[0];
    }

    /**
     * Replaces every alias reference by the (recursively resolved) body of
     * the alias. The alias definitions must be acyclic and complete.
     */
    final Formula resolve(final Map<String, Formula> aliases) {
        return new CopyVisitor() {
            @Override
            protected void visit(AliasRef node) {
                Formula body = aliases.get(node.name);
                assert body != null : node;
                push(body.resolve(aliases));
            }
        }.copy(this);
    }

    /**
     * Walks this formula with <code>visitor</code>.
     */
    public final void accept(Visitor visitor) {
        visitor.visit(this);
    }

    /**
     * @return an indented rendering of the tree, one node per line.
     */
    public final String toTreeString() {
        StringBuilder sb = new StringBuilder();
        new TreePrinter(sb).print(this);
        return sb.toString();
    }

    @Override
    public final String toString() {

        return new Visitor(TraversalOrder.SUBCLASS_DEFINED) {

            private final StringBuilder sb = new StringBuilder();

            @Override
            public String toString() {
                clear(sb);
                visit(Formula.this);
                return sb.toString();
            }

            @Override
            protected void visit(Constant node) {
                sb.append(node.value ? 't' : 'f');
            }

            @Override
            protected void visit(Ap node) {
                sb.append(node.index);
            }

            @Override
            protected void visit(AliasRef node) {
                sb.append('@').append(node.name);
            }

            @Override
            protected void visit(AccSet node) {
                sb.append(node.qualifier.glyph).append('(')
                        .append(node.complemented ? "!" : "")
                        .append(node.set).append(')');
            }

            @Override
            protected void visit(Not node) {
                sb.append('!');
                visitOperand(node.operand, node.operand instanceof Junction);
            }

            @Override
            protected void visit(Junction node) {
                boolean first = true;
                for (Formula operand : node.operands) {
                    sb.append(first ? "" : node.glyph());
                    first = false;
                    // & binds tighter than |
                    visitOperand(operand, node instanceof And && operand instanceof Or);
                }
            }

            private void visitOperand(Formula operand, boolean paren) {
                sb.append(paren ? "(" : "");
                visit(operand);
                sb.append(paren ? ")" : "");
            }
        }.toString();
    }

    /**
     * <code>t</code> or <code>f</code>.
     */
    public static final class Constant extends Formula {

        final boolean value;

        private Constant(boolean value) {
            this.value = value;
        }

        public boolean value() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Constant && ((Constant) o).value == value;
        }

        @Override
        public int hashCode() {
            return value ? 1231 : 1237;
        }
    }

    /**
     * A reference to an atomic proposition by its index in the
     * <code>AP:</code> header.
     */
    public static final class Ap extends Formula {

        final int index;

        private Ap(int index) {
            this.index = index;
        }

        public int index() {
            return index;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Ap && ((Ap) o).index == index;
        }

        @Override
        public int hashCode() {
            return 31 + index;
        }
    }

    public static final class AliasRef extends Formula {

        final String name;

        private AliasRef(String name) {
            this.name = name;
        }

        /**
         * @return the alias name, without <code>@</code>.
         */
        public String name() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof AliasRef && ((AliasRef) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }
    }

    public enum Qualifier {

        INF("Inf"), FIN("Fin");

        final String glyph;

        Qualifier(String glyph) {
            this.glyph = glyph;
        }

        /**
         * @return the qualifier spelled <code>glyph</code>, or null.
         */
        static Qualifier forGlyph(String glyph) {
            for (Qualifier q : values()) {
                if (q.glyph.equals(glyph)) return q;
            }
            return null;
        }
    }

    /**
     * An acceptance-set atom of an acceptance condition:
     * <code>Inf(n)</code>, <code>Fin(n)</code>, <code>Inf(!n)</code> or
     * <code>Fin(!n)</code>.
     */
    public static final class AccSet extends Formula {

        final Qualifier qualifier;
        final int set;
        final boolean complemented;

        private AccSet(Qualifier qualifier, int set, boolean complemented) {
            this.qualifier = qualifier;
            this.set = set;
            this.complemented = complemented;
        }

        public Qualifier qualifier() {
            return qualifier;
        }

        public int set() {
            return set;
        }

        public boolean isComplemented() {
            return complemented;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof AccSet)) return false;
            AccSet other = (AccSet) o;
            return qualifier == other.qualifier && set == other.set
                    && complemented == other.complemented;
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            int result = 1;
            result = prime * result + qualifier.hashCode();
            result = prime * result + set;
            result = prime * result + (complemented ? 1231 : 1237);
            return result;
        }
    }

    public static abstract class Operator extends Formula {

        private Operator() {}

        public abstract List<Formula> operands();
    }

    public static final class Not extends Operator {

        final Formula operand;

        private Not(Formula operand) {
            this.operand = operand;
        }

        public Formula operand() {
            return operand;
        }

        @Override
        public List<Formula> operands() {
            return Collections.singletonList(operand);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Not && ((Not) o).operand.equals(operand);
        }

        @Override
        public int hashCode() {
            return 17 * operand.hashCode() + 1;
        }
    }

    /**
     * An n-ary conjunction or disjunction of at least two operands, none of
     * which is a junction of the same kind.
     */
    public static abstract class Junction extends Operator {

        final List<Formula> operands;

        private Junction(List<Formula> operands) {
            assert operands.size() > 1;
            this.operands = Collections.unmodifiableList(operands);
        }

        @Override
        public final List<Formula> operands() {
            return operands;
        }

        abstract String glyph();

        @Override
        public final boolean equals(Object o) {
            return o != null && o.getClass() == getClass()
                    && ((Junction) o).operands.equals(operands);
        }

        @Override
        public final int hashCode() {
            return getClass().hashCode() * 31 + operands.hashCode();
        }
    }

    public static final class And extends Junction {

        private And(List<Formula> operands) {
            super(operands);
        }

        @Override
        String glyph() {
            return " & ";
        }
    }

    public static final class Or extends Junction {

        private Or(List<Formula> operands) {
            super(operands);
        }

        @Override
        String glyph() {
            return " | ";
        }
    }

    /**
     * Walks a formula. Subclasses override the <code>visit</code> methods
     * for the node types they care about; traversal of operands follows the
     * order given at construction unless it is
     * {@link TraversalOrder#SUBCLASS_DEFINED}.
     */
    public static abstract class Visitor {

        public enum TraversalOrder {
            TOP_DOWN,
            BOTTOM_UP,
            SUBCLASS_DEFINED;
        }

        private final TraversalOrder order;

        protected Visitor(TraversalOrder order) {
            this.order = order;
        }

        /*
         * multi-dispatch; "instanceof" dispatch is ugly but it's only in one
         * place - here.
         */

        protected void visit(Formula node) {
            if (node instanceof Operator) {
                visit((Operator) node);
            } else if (node instanceof Ap) {
                visit((Ap) node);
            } else if (node instanceof AliasRef) {
                visit((AliasRef) node);
            } else if (node instanceof AccSet) {
                visit((AccSet) node);
            } else if (node instanceof Constant) {
                visit((Constant) node);
            } else {
                error(node);
            }
        }

        protected void visit(Operator node) {
            if (order == TraversalOrder.BOTTOM_UP) {
                for (Formula f : node.operands()) {
                    visit(f);
                }
            }
            if (node instanceof Junction) {
                visit((Junction) node);
            } else if (node instanceof Not) {
                visit((Not) node);
            } else {
                error(node);
            }
            if (order == TraversalOrder.TOP_DOWN) {
                for (Formula f : node.operands()) {
                    visit(f);
                }
            }
        }

        protected void visit(Junction node) {
            if (node instanceof And) {
                visit((And) node);
            } else if (node instanceof Or) {
                visit((Or) node);
            } else {
                error(node);
            }
        }

        protected void visit(And node) {}
        protected void visit(Or node) {}
        protected void visit(Not node) {}

        protected void visit(Constant node) {}
        protected void visit(Ap node) {}
        protected void visit(AliasRef node) {}
        protected void visit(AccSet node) {}

        private static void error(Formula node) {
            assert false : "unknown node type " + node.getClass();
        }
    }

    static class CopyVisitor extends Visitor {

        protected final Stack<Formula> kids = new Stack<Formula>();

        CopyVisitor() {
            super(TraversalOrder.BOTTOM_UP);
        }

        protected final void push(Formula node) {
            kids.push(node);
        }

        private List<Formula> pop(int n) {
            Formula[] ret = new Formula[n];
            for (int i = n - 1; i >= 0; --i) {
                ret[i] = kids.pop();
            }
            return Arrays.asList(ret);
        }

        Formula copy(Formula node) {
            assert node != null;
            visit(node);
            assert kids.size() == 1;
            return kids.pop();
        }

        @Override
        protected void visit(Constant node) {
            push(node);
        }
        @Override
        protected void visit(Ap node) {
            push(node);
        }
        @Override
        protected void visit(AliasRef node) {
            push(node);
        }
        @Override
        protected void visit(AccSet node) {
            push(node);
        }
        @Override
        protected void visit(Not node) {
            push(not(kids.pop()));
        }
        @Override
        protected void visit(And node) {
            push(and(pop(node.operands.size())));
        }
        @Override
        protected void visit(Or node) {
            push(or(pop(node.operands.size())));
        }
    }

    static final class TreePrinter extends Visitor {

        private final Appendable a;
        private int nspace = 0;

        TreePrinter(Appendable a) {
            super(TraversalOrder.TOP_DOWN);
            this.a = a;
        }

        void print(Formula root) {
            visit(root);
            if (a instanceof Flushable) {
                try {
                    ((Flushable) a).flush();
                } catch (IOException e) {
                    throw new RuntimeException(e);
                }
            }
        }

        private void line(String label) {
            try {
                for (int i = 0; i < nspace; ++i) {
                    a.append(' ');
                }
                a.append(label).append(LS);
            } catch (IOException e) {
                throw new RuntimeException(e);
            }
        }

        @Override
        protected void visit(Operator node) {
            super.visit(node);
            nspace -= 4;
        }
        @Override
        protected void visit(And node) {
            line("&");
            nspace += 4;
        }
        @Override
        protected void visit(Or node) {
            line("|");
            nspace += 4;
        }
        @Override
        protected void visit(Not node) {
            line("!");
            nspace += 4;
        }
        @Override
        protected void visit(Constant node) {
            line(node.toString());
        }
        @Override
        protected void visit(Ap node) {
            line(node.toString());
        }
        @Override
        protected void visit(AliasRef node) {
            line(node.toString());
        }
        @Override
        protected void visit(AccSet node) {
            line(node.toString());
        }
    }

    /*
     * static factories
     */

    public static Constant constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Ap ap(int index) {
        if (index < 0) throw new IllegalArgumentException("negative proposition " + index);
        return new Ap(index);
    }

    /**
     * @param name
     *            the alias name, with or without the leading <code>@</code>.
     */
    public static AliasRef alias(String name) {
        String s = name.startsWith("@") ? name.substring(1) : name;
        if (s.length() == 0) throw new IllegalArgumentException("empty alias name");
        if (!Lexer.isAliasName(s)) {
            throw new IllegalArgumentException("not an alias name: @" + Misc.Esc.DIAG.esc(s));
        }
        return new AliasRef(s);
    }

    public static AccSet inf(int set) {
        return acc(Qualifier.INF, set, false);
    }

    public static AccSet fin(int set) {
        return acc(Qualifier.FIN, set, false);
    }

    public static AccSet acc(Qualifier qualifier, int set, boolean complemented) {
        if (set < 0) throw new IllegalArgumentException("negative acceptance set " + set);
        if (qualifier == null) throw new NullPointerException("qualifier");
        return new AccSet(qualifier, set, complemented);
    }

    public static Not not(Formula operand) {
        if (operand == null) throw new NullPointerException("operand");
        return new Not(operand);
    }

    public static Formula and(Formula... operands) {
        return and(Arrays.asList(operands));
    }

    public static Formula and(List<? extends Formula> operands) {
        List<Formula> flat = flatten(And.class, operands);
        return flat.size() == 1 ? flat.get(0) : new And(flat);
    }

    public static Formula or(Formula... operands) {
        return or(Arrays.asList(operands));
    }

    public static Formula or(List<? extends Formula> operands) {
        List<Formula> flat = flatten(Or.class, operands);
        return flat.size() == 1 ? flat.get(0) : new Or(flat);
    }

    private static List<Formula> flatten(Class<? extends Junction> kind,
            List<? extends Formula> operands) {
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("no operands");
        }
        List<Formula> ret = new ArrayList<Formula>(operands.size());
        for (Formula f : operands) {
            if (f == null) throw new NullPointerException("operand");
            if (f.getClass() == kind) {
                ret.addAll(((Junction) f).operands);
            } else {
                ret.add(f);
            }
        }
        return ret;
    }
}
