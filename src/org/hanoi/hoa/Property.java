/* @LICENSE@
 */
package org.hanoi.hoa;

import java.util.HashMap;
import java.util.Map;

/**
 * The properties a HOA document may declare on its <code>properties:</code>
 * lines. Declared properties which are not listed here are kept verbatim in
 * the {@link Header} but have no meaning to this package.
 */
public enum Property {

    STATE_LABELS("state-labels"),
    TRANS_LABELS("trans-labels"),
    IMPLICIT_LABELS("implicit-labels"),
    EXPLICIT_LABELS("explicit-labels"),
    STATE_ACC("state-acc"),
    TRANS_ACC("trans-acc"),
    UNIV_BRANCH("univ-branch"),
    NO_UNIV_BRANCH("no-univ-branch"),
    DETERMINISTIC("deterministic"),
    COMPLETE("complete"),
    UNAMBIGUOUS("unambiguous"),
    STUTTER_INVARIANT("stutter-invariant"),
    WEAK("weak"),
    VERY_WEAK("very-weak"),
    INHERENTLY_WEAK("inherently-weak"),
    TERMINAL("terminal"),
    TIGHT("tight"),
    COLORED("colored");

    private static final Map<String, Property> byName = new HashMap<String, Property>();

    static {
        for (Property p : values()) {
            byName.put(p.name, p);
        }
    }

    final String name;

    Property(String name) {
        this.name = name;
    }

    /**
     * @return the spelling used in HOA documents, e.g.
     *         <code>state-labels</code>.
     */
    public String hoaName() {
        return name;
    }

    /**
     * @return the property spelled <code>name</code>, or null if it is not
     *         a known property.
     */
    public static Property forName(String name) {
        return byName.get(name);
    }
}
