/* @LICENSE@
 */
package org.hanoi.hoa;

import static org.hanoi.hoa.Misc.Esc.HOA;

import java.io.Flushable;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Writes automata as HOA documents. The output reads back as an equal
 * automaton; comments and layout of the original document are not kept.
 * Lines end with <code>\n</code> whatever the platform.
 */
public final class HoaPrinter {

    private static final char NL = '\n';

    private HoaPrinter() {} // uninstantiable

    /**
     * Prints <code>automaton</code> to <code>a</code>, and flushes
     * <code>a</code> if it is {@link Flushable}.
     */
    public static void print(Automaton automaton, Appendable a) throws IOException {
        StringBuilder sb = new StringBuilder();
        appendHeader(sb, automaton.header);
        a.append(sb).append("--BODY--").append(NL);
        for (State s : automaton.states) {
            Misc.clear(sb);
            appendState(sb, s);
            a.append(sb).append(NL);
            for (Edge e : s.edges) {
                Misc.clear(sb);
                appendEdge(sb, e);
                a.append(sb).append(NL);
            }
        }
        a.append("--END--").append(NL);
        if (a instanceof Flushable) {
            ((Flushable) a).flush();
        }
    }

    public static String toString(Automaton automaton) {
        StringBuilder sb = new StringBuilder();
        try {
            print(automaton, sb);
        } catch (IOException e) {
            throw new RuntimeException(e); // StringBuilder doesn't
        }
        return sb.toString();
    }

    static void appendHeader(StringBuilder sb, Header h) {
        sb.append("HOA: ").append(h.version).append(NL);
        sb.append("States: ").append(h.numStates).append(NL);
        for (List<Integer> conj : h.start) {
            sb.append("Start: ");
            appendConjunction(sb, conj);
            sb.append(NL);
        }
        sb.append("AP: ").append(h.aps.size());
        for (String ap : h.aps) {
            sb.append(' ').append(HOA.quote(ap));
        }
        sb.append(NL);
        for (Map.Entry<String, Formula> alias : h.aliases.entrySet()) {
            sb.append("Alias: @").append(alias.getKey()).append(' ')
                    .append(alias.getValue()).append(NL);
        }
        sb.append("Acceptance: ").append(h.numAccSets).append(' ')
                .append(h.acceptance).append(NL);
        if (h.accName != null) {
            sb.append("acc-name: ").append(h.accName).append(NL);
        }
        if (h.tool != null) {
            sb.append("tool: ").append(h.tool).append(NL);
        }
        if (h.name != null) {
            sb.append("name: ").append(HOA.quote(h.name)).append(NL);
        }
        if (!h.properties.isEmpty()) {
            sb.append("properties:");
            for (String p : h.properties) {
                sb.append(' ').append(p);
            }
            sb.append(NL);
        }
        for (Header.Item item : h.items) {
            sb.append(item).append(NL);
        }
    }

    static void appendState(StringBuilder sb, State s) {
        sb.append("State: ");
        appendLabel(sb, s.label);
        sb.append(s.index);
        if (s.name != null) {
            sb.append(' ').append(HOA.quote(s.name));
        }
        appendAccSets(sb, s.accSets);
    }

    static void appendEdge(StringBuilder sb, Edge e) {
        appendLabel(sb, e.label);
        appendConjunction(sb, e.targets);
        appendAccSets(sb, e.accSets);
    }

    private static void appendLabel(StringBuilder sb, Formula label) {
        if (label != null) {
            sb.append('[').append(label).append("] ");
        }
    }

    private static void appendConjunction(StringBuilder sb, List<Integer> states) {
        for (int i = 0; i < states.size(); ++i) {
            sb.append(i == 0 ? "" : "&").append(states.get(i));
        }
    }

    private static void appendAccSets(StringBuilder sb, List<Integer> sets) {
        if (sets == null) return;
        sb.append(" {");
        for (int i = 0; i < sets.size(); ++i) {
            sb.append(i == 0 ? "" : " ").append(sets.get(i));
        }
        sb.append('}');
    }
}
