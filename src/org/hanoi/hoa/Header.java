/* @LICENSE@
 */
package org.hanoi.hoa;

import static org.hanoi.hoa.Misc.Esc.HOA;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The header of a HOA automaton: everything between <code>HOA:</code> and
 * <code>--BODY--</code>.
 */
public final class Header {

    /**
     * The <code>acc-name:</code> header: a name and parameters, each of which
     * is a {@link Boolean} (<code>t</code>/<code>f</code>), an
     * {@link Integer} or an identifier {@link String}.
     */
    public static final class AccName {

        final String name;
        final List<Object> parameters;

        AccName(String name, List<Object> parameters) {
            this.name = name;
            this.parameters = Collections.unmodifiableList(new ArrayList<Object>(parameters));
        }

        public String name() {
            return name;
        }

        public List<Object> parameters() {
            return parameters;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof AccName)) return false;
            AccName other = (AccName) o;
            return name.equals(other.name) && parameters.equals(other.parameters);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + parameters.hashCode();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(name);
            for (Object p : parameters) {
                sb.append(' ');
                if (p instanceof Boolean) {
                    sb.append(((Boolean) p) ? 't' : 'f');
                } else {
                    sb.append(p);
                }
            }
            return sb.toString();
        }
    }

    public static final class Tool {

        final String name;
        final String version;

        Tool(String name, String version) {
            this.name = name;
            this.version = version;
        }

        public String name() {
            return name;
        }

        /**
         * @return the tool version, or null.
         */
        public String version() {
            return version;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Tool)) return false;
            Tool other = (Tool) o;
            return name.equals(other.name)
                    && (version == null ? other.version == null : version.equals(other.version));
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + (version == null ? 0 : version.hashCode());
        }

        @Override
        public String toString() {
            return HOA.quote(name) + (version == null ? "" : " " + HOA.quote(version));
        }
    }

    /**
     * A header this package has no model for, kept as its name and the
     * tokens which followed it.
     */
    public static final class Item {

        final String name;
        final List<Token> values;

        Item(String name, List<Token> values) {
            this.name = name;
            this.values = Collections.unmodifiableList(new ArrayList<Token>(values));
        }

        /**
         * @return the header name, without the colon.
         */
        public String name() {
            return name;
        }

        public List<Token> values() {
            return values;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Item)) return false;
            Item other = (Item) o;
            return name.equals(other.name) && values.equals(other.values);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + values.hashCode();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(name).append(':');
            for (Token t : values) {
                sb.append(' ').append(t.text);
            }
            return sb.toString();
        }
    }

    final String version;
    final int numStates;
    final List<List<Integer>> start;
    final List<String> aps;
    final Map<String, Formula> aliases;
    final int numAccSets;
    final Formula acceptance;
    final AccName accName;
    final Tool tool;
    final String name;
    final List<String> properties;
    final List<Item> items;
    private final Set<Property> known;

    Header(String version, int numStates, List<List<Integer>> start,
            List<String> aps, Map<String, Formula> aliases, int numAccSets,
            Formula acceptance, AccName accName, Tool tool, String name,
            List<String> properties, List<Item> items) {
        this.version = version;
        this.numStates = numStates;
        this.start = start;
        this.aps = aps;
        this.aliases = aliases;
        this.numAccSets = numAccSets;
        this.acceptance = acceptance;
        this.accName = accName;
        this.tool = tool;
        this.name = name;
        this.properties = properties;
        this.items = items;
        this.known = EnumSet.noneOf(Property.class);
        for (String p : properties) {
            Property prop = Property.forName(p);
            if (prop != null) known.add(prop);
        }
    }

    /**
     * @return the format version, e.g. <code>v1</code>.
     */
    public String version() {
        return version;
    }

    /**
     * @return the <code>States:</code> count.
     */
    public int numStates() {
        return numStates;
    }

    /**
     * @return the <code>Start:</code> lines; each inner list is a conjunction
     *         of states, of size one unless the automaton branches
     *         universally at the start.
     */
    public List<List<Integer>> start() {
        return start;
    }

    public int numAps() {
        return aps.size();
    }

    /**
     * @return the atomic proposition names; the position in the list is the
     *         index used in labels.
     */
    public List<String> aps() {
        return aps;
    }

    /**
     * @return alias names (without <code>@</code>) to their definitions, in
     *         definition order.
     */
    public Map<String, Formula> aliases() {
        return aliases;
    }

    public int numAccSets() {
        return numAccSets;
    }

    public Formula acceptance() {
        return acceptance;
    }

    public AccName accName() {
        return accName;
    }

    public Tool tool() {
        return tool;
    }

    public String name() {
        return name;
    }

    /**
     * @return the declared properties verbatim, in document order, unknown
     *         ones included.
     */
    public List<String> properties() {
        return properties;
    }

    public boolean has(Property property) {
        return known.contains(property);
    }

    /**
     * @return the headers without a dedicated accessor, in document order.
     */
    public List<Item> items() {
        return items;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + ((accName == null) ? 0 : accName.hashCode());
        result = prime * result + acceptance.hashCode();
        result = prime * result + aliases.hashCode();
        result = prime * result + aps.hashCode();
        result = prime * result + items.hashCode();
        result = prime * result + ((name == null) ? 0 : name.hashCode());
        result = prime * result + numAccSets;
        result = prime * result + numStates;
        result = prime * result + properties.hashCode();
        result = prime * result + start.hashCode();
        result = prime * result + ((tool == null) ? 0 : tool.hashCode());
        result = prime * result + version.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Header))
            return false;
        Header other = (Header) obj;
        return version.equals(other.version)
                && numStates == other.numStates
                && start.equals(other.start)
                && aps.equals(other.aps)
                && aliases.equals(other.aliases)
                && numAccSets == other.numAccSets
                && acceptance.equals(other.acceptance)
                && eq(accName, other.accName)
                && eq(tool, other.tool)
                && eq(name, other.name)
                && properties.equals(other.properties)
                && items.equals(other.items);
    }

    private static boolean eq(Object a, Object b) {
        return a == null ? b == null : a.equals(b);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        HoaPrinter.appendHeader(sb, this);
        return sb.toString();
    }
}
