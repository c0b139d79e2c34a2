/* @LICENSE@
 */
package org.hanoi.hoa;

import java.util.List;

/**
 * A state of an {@link Automaton} with its outgoing edges, in document
 * order.
 */
public final class State {

    final int index;
    final String name;
    final Formula label;
    final List<Integer> accSets;
    final List<Edge> edges;

    State(int index, String name, Formula label, List<Integer> accSets, List<Edge> edges) {
        this.index = index;
        this.name = name;
        this.label = label;
        this.accSets = accSets;
        this.edges = edges;
    }

    public int index() {
        return index;
    }

    /**
     * @return the name given in the document, or null.
     */
    public String name() {
        return name;
    }

    /**
     * @return the state label, or null when the automaton labels its edges
     *         or is implicitly labelled.
     */
    public Formula label() {
        return label;
    }

    /**
     * @return the acceptance sets the state belongs to; null when the state
     *         carries no acceptance signature at all, empty for
     *         <code>{}</code>.
     */
    public List<Integer> accSets() {
        return accSets;
    }

    public List<Edge> edges() {
        return edges;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + ((accSets == null) ? 0 : accSets.hashCode());
        result = prime * result + edges.hashCode();
        result = prime * result + index;
        result = prime * result + ((label == null) ? 0 : label.hashCode());
        result = prime * result + ((name == null) ? 0 : name.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof State))
            return false;
        State other = (State) obj;
        if (index != other.index)
            return false;
        if (accSets == null) {
            if (other.accSets != null)
                return false;
        } else if (!accSets.equals(other.accSets))
            return false;
        if (label == null) {
            if (other.label != null)
                return false;
        } else if (!label.equals(other.label))
            return false;
        if (name == null) {
            if (other.name != null)
                return false;
        } else if (!name.equals(other.name))
            return false;
        return edges.equals(other.edges);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        HoaPrinter.appendState(sb, this);
        return sb.toString();
    }
}
