/* @LICENSE@
 */
package org.hanoi.hoa;

import java.util.List;

/**
 * An outgoing edge of a {@link State}. An edge with more than one target is
 * a universal branch: all targets are entered at once.
 */
public final class Edge {

    final List<Integer> targets;
    final Formula label;
    final List<Integer> accSets;

    Edge(List<Integer> targets, Formula label, List<Integer> accSets) {
        assert !targets.isEmpty();
        this.targets = targets;
        this.label = label;
        this.accSets = accSets;
    }

    public List<Integer> targets() {
        return targets;
    }

    /**
     * @return the single target of an edge which does not branch
     *         universally.
     * @throws IllegalStateException
     *             if the edge has several targets.
     */
    public int target() {
        if (targets.size() != 1) {
            throw new IllegalStateException("universal edge: " + targets);
        }
        return targets.get(0);
    }

    public boolean isUniversal() {
        return targets.size() > 1;
    }

    /**
     * @return the label, or null for an unlabelled edge.
     */
    public Formula label() {
        return label;
    }

    /**
     * @return the acceptance sets the edge belongs to; null when the edge
     *         carries no acceptance signature at all, empty for
     *         <code>{}</code>.
     */
    public List<Integer> accSets() {
        return accSets;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + ((accSets == null) ? 0 : accSets.hashCode());
        result = prime * result + ((label == null) ? 0 : label.hashCode());
        result = prime * result + targets.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Edge))
            return false;
        Edge other = (Edge) obj;
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
        return targets.equals(other.targets);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        HoaPrinter.appendEdge(sb, this);
        return sb.toString();
    }
}
