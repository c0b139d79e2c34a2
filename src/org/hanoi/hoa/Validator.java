/* @LICENSE@
 */
package org.hanoi.hoa;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.hanoi.hoa.Automaton.Builder;
import org.hanoi.hoa.Automaton.Builder.EdgeDraft;
import org.hanoi.hoa.Automaton.Builder.Located;
import org.hanoi.hoa.Automaton.Builder.StateDraft;
import org.hanoi.hoa.Misc.DepthFirstVisitor;
import org.hanoi.hoa.Misc.Edge;
import org.hanoi.hoa.Misc.Vertex;
import org.hanoi.hoa.Problem.Range;

/**
 * Semantic checks on the parts gathered by a {@link Builder}.
 * <p>
 * The checks run in four groups: index ranges, aliases, labelling, and
 * cardinalities. Later groups assume the earlier ones passed, so checking
 * stops after the first group reporting anything; every problem of that
 * group is returned.
 */
final class Validator {

    private static final Logger logger = Logger.getLogger("org.hanoi.hoa");
    private static final Level level = Level.FINER;

    private final Builder b;
    private final int numStates;
    private final int numAps;
    private final int numAccSets;

    Validator(Builder b) {
        this.b = b;
        this.numStates = b.numStates != null ? b.numStates.value : b.states.size();
        this.numAps = b.numAps.value;
        this.numAccSets = b.numAccSets.value;
    }

    List<Problem> validate() {
        List<Problem> problems = new ArrayList<Problem>();
        String failed = null;
        if (!checkRanges(problems)) {
            failed = "ranges";
        } else if (!checkAliases(problems)) {
            failed = "aliases";
        } else if (!checkLabelling(problems)) {
            failed = "labelling";
        } else if (!checkCardinalities(problems)) {
            failed = "cardinalities";
        }
        if (logger.isLoggable(level)) {
            logger.log(level, failed == null ? "valid" : failed + ": " + problems);
        }
        return problems;
    }

    /*
     * (a) ranges
     */

    private boolean checkRanges(List<Problem> problems) {
        for (Located<Formula> alias : b.aliases.values()) {
            checkFormula(alias.value, alias.line, alias.column, problems);
        }
        checkFormula(b.acceptance, b.numAccSets.line, b.numAccSets.column, problems);
        for (Located<List<Integer>> s : b.start) {
            for (int target : s.value) {
                checkIndex(Range.START_STATE, target, numStates, s.line, s.column, problems);
            }
        }
        for (StateDraft sd : b.states) {
            checkIndex(Range.STATE, sd.index, numStates, sd.line, sd.column, problems);
            checkFormula(sd.label, sd.line, sd.column, problems);
            checkSets(sd.accSets, sd.line, sd.column, problems);
            for (EdgeDraft ed : sd.edges) {
                for (int target : ed.targets) {
                    checkIndex(Range.EDGE_TARGET, target, numStates, ed.line, ed.column,
                        problems);
                }
                checkFormula(ed.label, ed.line, ed.column, problems);
                checkSets(ed.accSets, ed.line, ed.column, problems);
            }
        }
        return problems.isEmpty();
    }

    private void checkFormula(Formula f, int line, int column, List<Problem> problems) {
        if (f == null) return;
        for (int ap : f.propositions()) {
            checkIndex(Range.PROPOSITION, ap, numAps, line, column, problems);
        }
        checkSets(f.acceptanceSets(), line, column, problems);
    }

    private void checkSets(Iterable<Integer> sets, int line, int column, List<Problem> problems) {
        if (sets == null) return;
        for (int set : sets) {
            checkIndex(Range.ACCEPTANCE_SET, set, numAccSets, line, column, problems);
        }
    }

    private static void checkIndex(Range range, int index, int bound, int line, int column,
            List<Problem> problems) {
        if (index < 0 || index >= bound) {
            problems.add(new Problem.RangeViolation(range, index, bound, line, column));
        }
    }

    /*
     * (b) aliases
     */

    private static final class AliasNode implements Vertex<AliasArc> {

        final String name;
        final int order;
        final Located<Formula> definition;
        final List<AliasArc> arcs = new ArrayList<AliasArc>();

        AliasNode(String name, int order, Located<Formula> definition) {
            this.name = name;
            this.order = order;
            this.definition = definition;
        }

        public Iterable<AliasArc> edges() {
            return arcs;
        }

        @Override
        public String toString() {
            return "@" + name;
        }
    }

    private static final class AliasArc implements Edge<AliasNode> {

        final AliasNode to;

        AliasArc(AliasNode to) {
            this.to = to;
        }

        public AliasNode vertex() {
            return to;
        }
    }

    private boolean checkAliases(final List<Problem> problems) {

        final Map<String, AliasNode> nodes = new LinkedHashMap<String, AliasNode>();
        for (Map.Entry<String, Located<Formula>> e : b.aliases.entrySet()) {
            nodes.put(e.getKey(), new AliasNode(e.getKey(), nodes.size(), e.getValue()));
        }

        for (AliasNode node : nodes.values()) {
            Located<Formula> def = node.definition;
            for (String ref : def.value.aliases()) {
                AliasNode to = nodes.get(ref);
                if (to == null) {
                    problems.add(undefined(ref, def.line, def.column));
                } else {
                    node.arcs.add(new AliasArc(to));
                }
            }
        }
        for (StateDraft sd : b.states) {
            checkReferences(sd.label, nodes, sd.line, sd.column, problems);
            for (EdgeDraft ed : sd.edges) {
                checkReferences(ed.label, nodes, ed.line, ed.column, problems);
            }
        }

        final Set<AliasNode> cyclic = new HashSet<AliasNode>();
        new DepthFirstVisitor<AliasNode, AliasArc>() {
            @Override
            protected boolean visit(AliasArc arc, boolean tree, boolean back) {
                if (back) {
                    List<AliasNode> path = path();
                    List<AliasNode> loop = path.subList(path.indexOf(arc.to), path.size());
                    List<String> chain = new ArrayList<String>();
                    for (AliasNode n : loop) {
                        chain.add(n.name);
                    }
                    chain.add(arc.to.name);
                    cyclic.addAll(loop);
                    AliasNode from = current();
                    problems.add(new Problem.CyclicAlias(chain,
                        from.definition.line, from.definition.column));
                }
                return true;
            }
        }.start(nodes.values());

        for (AliasNode node : nodes.values()) {
            if (cyclic.contains(node)) continue;
            for (AliasArc arc : node.arcs) {
                if (arc.to.order > node.order) {
                    problems.add(new Problem.UnresolvedAlias(arc.to.name, "alias @"
                        + arc.to.name + " used by @" + node.name + " before its definition",
                        node.definition.line, node.definition.column));
                }
            }
        }
        return problems.isEmpty();
    }

    private static void checkReferences(Formula label, Map<String, AliasNode> nodes,
            int line, int column, List<Problem> problems) {
        if (label == null) return;
        for (String ref : label.aliases()) {
            if (!nodes.containsKey(ref)) {
                problems.add(undefined(ref, line, column));
            }
        }
    }

    private static Problem undefined(String name, int line, int column) {
        return new Problem.UnresolvedAlias(name, "undefined alias @" + name, line, column);
    }

    /*
     * (c) labelling and acceptance placement
     */

    private boolean declared(Property p) {
        for (Located<String> s : b.properties) {
            if (p.name.equals(s.value)) return true;
        }
        return false;
    }

    private Located<String> declaration(Property p) {
        for (Located<String> s : b.properties) {
            if (p.name.equals(s.value)) return s;
        }
        return null;
    }

    private void inconsistent(String message, int line, int column, List<Problem> problems) {
        problems.add(new Problem(Problem.Kind.INCONSISTENT_LABELING, line, column, message));
    }

    private void contradicts(Property p, String what, List<Problem> problems) {
        Located<String> at = declaration(p);
        inconsistent("property " + p.name + " declared, but " + what, at.line, at.column,
            problems);
    }

    private boolean checkLabelling(List<Problem> problems) {

        StateDraft labelledState = null, unlabelledState = null;
        StateDraft stateWithAcc = null;
        EdgeDraft labelledEdge = null, edgeWithAcc = null;
        boolean universal = false;

        for (StateDraft sd : b.states) {
            if (sd.label != null) {
                if (labelledState == null) labelledState = sd;
            } else if (unlabelledState == null) {
                unlabelledState = sd;
            }
            if (sd.accSets != null && stateWithAcc == null) stateWithAcc = sd;
            for (EdgeDraft ed : sd.edges) {
                if (ed.label != null && labelledEdge == null) labelledEdge = ed;
                if (ed.accSets != null && edgeWithAcc == null) edgeWithAcc = ed;
                universal |= ed.targets.size() > 1;
            }
        }

        if (labelledState != null && labelledEdge != null) {
            inconsistent("edge labelled although state " + labelledState.index
                + " carries a label", labelledEdge.line, labelledEdge.column, problems);
        } else if (labelledState != null) {
            for (StateDraft sd : b.states) {
                if (sd.label == null) {
                    inconsistent("state " + sd.index + " has no label, but state "
                        + labelledState.index + " has", sd.line, sd.column, problems);
                }
            }
        } else if (labelledEdge != null) {
            for (StateDraft sd : b.states) {
                for (EdgeDraft ed : sd.edges) {
                    if (ed.label == null) {
                        inconsistent("unlabelled edge of state " + sd.index
                            + " in an automaton with labelled edges",
                            ed.line, ed.column, problems);
                    }
                }
            }
        } else if (numAps < 31) {
            int expected = 1 << numAps;
            for (StateDraft sd : b.states) {
                if (!sd.edges.isEmpty() && sd.edges.size() != expected) {
                    inconsistent("implicitly labelled state " + sd.index + " has "
                        + sd.edges.size() + " edges instead of " + expected,
                        sd.line, sd.column, problems);
                }
            }
        }
        boolean implicit = labelledState == null && labelledEdge == null;

        if (stateWithAcc != null && edgeWithAcc != null) {
            inconsistent("edge acceptance although state " + stateWithAcc.index
                + " carries acceptance sets", edgeWithAcc.line, edgeWithAcc.column, problems);
        }

        if (declared(Property.STATE_LABELS) && labelledEdge != null) {
            contradicts(Property.STATE_LABELS, "an edge is labelled", problems);
        }
        if (declared(Property.TRANS_LABELS) && labelledState != null) {
            contradicts(Property.TRANS_LABELS, "state " + labelledState.index
                + " is labelled", problems);
        }
        if (declared(Property.IMPLICIT_LABELS) && !implicit) {
            contradicts(Property.IMPLICIT_LABELS, "labels are explicit", problems);
        }
        if (declared(Property.EXPLICIT_LABELS) && implicit && hasEdges()) {
            contradicts(Property.EXPLICIT_LABELS, "no label is given", problems);
        }
        if (declared(Property.STATE_ACC) && edgeWithAcc != null) {
            contradicts(Property.STATE_ACC, "an edge carries acceptance sets", problems);
        }
        if (declared(Property.TRANS_ACC) && stateWithAcc != null) {
            contradicts(Property.TRANS_ACC, "state " + stateWithAcc.index
                + " carries acceptance sets", problems);
        }
        boolean universalStart = false;
        for (Located<List<Integer>> s : b.start) {
            universalStart |= s.value.size() > 1;
        }
        if (declared(Property.NO_UNIV_BRANCH) && (universal || universalStart)) {
            contradicts(Property.NO_UNIV_BRANCH, "the automaton branches universally",
                problems);
        }
        if (declared(Property.DETERMINISTIC)) {
            if (b.start.size() > 1 || universalStart || universal) {
                contradicts(Property.DETERMINISTIC, "the automaton has several initial "
                    + "states or universal branches", problems);
            }
        }

        if (Misc.isSet(b.flags, Automaton.STRICT_PROPERTIES)) {
            for (Located<String> p : b.properties) {
                if (Property.forName(p.value) == null) {
                    problems.add(new Problem(Problem.Kind.UNKNOWN_PROPERTY, p.line, p.column,
                        "unknown property " + p.value));
                }
            }
        }
        return problems.isEmpty();
    }

    private boolean hasEdges() {
        for (StateDraft sd : b.states) {
            if (!sd.edges.isEmpty()) return true;
        }
        return false;
    }

    /*
     * (d) cardinalities
     */

    private boolean checkCardinalities(List<Problem> problems) {
        Map<Integer, StateDraft> seen = new HashMap<Integer, StateDraft>();
        for (StateDraft sd : b.states) {
            if (seen.containsKey(sd.index)) {
                problems.add(new Problem(Problem.Kind.DUPLICATE_STATE, sd.line, sd.column,
                    "state " + sd.index + " defined twice"));
            } else {
                seen.put(sd.index, sd);
            }
        }
        Set<String> names = new HashSet<String>();
        for (String ap : b.aps) {
            if (!names.add(ap)) {
                problems.add(new Problem(Problem.Kind.DUPLICATE_PROPOSITION, b.numAps.line,
                    b.numAps.column, "atomic proposition \"" + ap + "\" declared twice"));
            }
        }
        if (b.numStates != null && b.numStates.value != b.states.size()) {
            problems.add(new Problem.CardinalityMismatch("states", b.numStates.value,
                b.states.size(), b.numStates.line, b.numStates.column));
        }
        if (numAps != b.aps.size()) {
            problems.add(new Problem.CardinalityMismatch("atomic propositions", numAps,
                b.aps.size(), b.numAps.line, b.numAps.column));
        }
        return problems.isEmpty();
    }
}
