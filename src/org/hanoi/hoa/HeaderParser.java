/* @LICENSE@
 */
package org.hanoi.hoa;

import static org.hanoi.hoa.Problem.Kind.DUPLICATE_EXCLUSIVE_HEADER;
import static org.hanoi.hoa.Problem.Kind.MISSING_REQUIRED_HEADER;
import static org.hanoi.hoa.Problem.Kind.UNEXPECTED_TOKEN;
import static org.hanoi.hoa.Problem.Kind.UNSUPPORTED_VERSION;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.hanoi.hoa.Misc.PushbackIterator;
import org.hanoi.hoa.Token.Kind;

/**
 * Reads the header of a document, from <code>HOA:</code> through
 * <code>--BODY--</code>, into an {@link Automaton.Builder}.
 * <p>
 * All header items are read first, in document order, and checked for
 * repeats as they come. A second pass checks that the mandatory headers are
 * present and hands the items to the builder.
 */
final class HeaderParser extends AbstractParser {

    private static final Logger logger = Logger.getLogger("org.hanoi.hoa");
    private static final Level level = Level.FINEST;

    /**
     * The headers with a meaning of their own.
     */
    enum Field {
        HOA("HOA", true, true),
        STATES("States", true, true),
        START("Start", false, false),
        AP("AP", true, true),
        ALIAS("Alias", false, false),
        ACCEPTANCE("Acceptance", true, true),
        ACC_NAME("acc-name", false, true),
        TOOL("tool", false, true),
        NAME("name", false, true),
        PROPERTIES("properties", false, false);

        private static final Map<String, Field> byName = new HashMap<String, Field>();

        static {
            for (Field f : values()) {
                byName.put(f.hoaName, f);
            }
        }

        final String hoaName;
        final boolean mandatory;
        final boolean exclusive;

        Field(String hoaName, boolean mandatory, boolean exclusive) {
            this.hoaName = hoaName;
            this.mandatory = mandatory;
            this.exclusive = exclusive;
        }

        static Field forName(String name) {
            return byName.get(name);
        }
    }

    /*
     * one header line, as read
     */
    private static final class Entry {
        final Token at;
        final Object value;

        Entry(Token at, Object value) {
            this.at = at;
            this.value = value;
        }
    }

    private static final class Ints {
        final int count;
        final List<String> strings;

        Ints(int count, List<String> strings) {
            this.count = count;
            this.strings = strings;
        }
    }

    private final Automaton.Builder builder;
    private final int flags;
    private final FormulaParser formulas;

    private final Map<Field, List<Entry>> fields = new EnumMap<Field, List<Entry>>(Field.class);
    private final List<Entry> others = new ArrayList<Entry>();
    private final Map<String, Token> aliasNames = new HashMap<String, Token>();

    HeaderParser(PushbackIterator<Token> tokens, Automaton.Builder builder, int flags) {
        super(tokens);
        this.builder = builder;
        this.flags = flags;
        this.formulas = new FormulaParser(tokens);
    }

    /**
     * Consumes the header including <code>--BODY--</code>.
     */
    void parse() {
        Token first = next();
        if (!first.is(Kind.HEADER_NAME, Field.HOA.hoaName)) {
            if (first.is(Kind.HEADER_NAME) || first.is(Kind.BODY) || first.is(Kind.EOF)) {
                throw error(MISSING_REQUIRED_HEADER, first, "document does not start with HOA:");
            }
            throw syntaxError(UNEXPECTED_TOKEN, first, "HOA:");
        }
        gather(first, Field.HOA);
        while (true) {
            Token t = next();
            if (t.is(Kind.BODY)) {
                check(t);
                return;
            }
            if (!t.is(Kind.HEADER_NAME)) {
                throw syntaxError(UNEXPECTED_TOKEN, t, "a header name or --BODY--");
            }
            Field f = Field.forName(t.value);
            if (f == null) {
                other(t);
            } else {
                gather(t, f);
            }
        }
    }

    private void gather(Token at, Field f) {
        List<Entry> entries = fields.get(f);
        if (entries == null) {
            fields.put(f, entries = new ArrayList<Entry>());
        } else if (f.exclusive) {
            throw error(DUPLICATE_EXCLUSIVE_HEADER, at, f.hoaName + ": given more than once");
        }
        entries.add(new Entry(at, read(f)));
    }

    private Object read(Field f) {
        switch (f) {
        case HOA:
            return expect(Kind.IDENTIFIER, "a format version");
        case STATES:
            return expect(Kind.INT, "the number of states").intValue();
        case START:
            return conjunction();
        case AP:
            int count = expect(Kind.INT, "the number of atomic propositions").intValue();
            return new Ints(count, strings());
        case ALIAS:
            Token name = expect(Kind.ALIAS, "an alias name");
            if (aliasNames.containsKey(name.value)) {
                throw error(DUPLICATE_EXCLUSIVE_HEADER, name, "alias @" + name.value
                    + " defined more than once");
            }
            aliasNames.put(name.value, name);
            return new Object[] {name, formulas.parse(FormulaParser.Context.LABEL)};
        case ACCEPTANCE:
            int sets = expect(Kind.INT, "the number of acceptance sets").intValue();
            return new Object[] {sets, formulas.parse(FormulaParser.Context.ACCEPTANCE)};
        case ACC_NAME:
            return accName();
        case TOOL:
            String tool = expect(Kind.STRING, "a tool name").value;
            Token version = accept(Kind.STRING);
            return new Header.Tool(tool, version == null ? null : version.value);
        case NAME:
            return expect(Kind.STRING, "an automaton name").value;
        case PROPERTIES:
            List<Token> props = new ArrayList<Token>();
            for (Token t; (t = accept(Kind.IDENTIFIER)) != null;) {
                props.add(t);
            }
            return props;
        default:
            throw new AssertionError(f);
        }
    }

    private List<String> strings() {
        List<String> ret = new ArrayList<String>();
        for (Token t; (t = accept(Kind.STRING)) != null;) {
            ret.add(t.value);
        }
        return ret;
    }

    private Header.AccName accName() {
        String name = expect(Kind.IDENTIFIER, "an acceptance name").value;
        List<Object> params = new ArrayList<Object>();
        while (true) {
            Token t = next();
            if (t.is(Kind.INT)) {
                params.add(t.intValue());
            } else if (t.is(Kind.IDENTIFIER, "t") || t.is(Kind.IDENTIFIER, "f")) {
                params.add(Boolean.valueOf(t.value.equals("t")));
            } else if (t.is(Kind.IDENTIFIER)) {
                params.add(t.value);
            } else {
                pushback();
                return new Header.AccName(name, params);
            }
        }
    }

    private void other(Token at) {
        List<Token> values = new ArrayList<Token>();
        while (true) {
            Token t = next();
            if (t.is(Kind.INT) || t.is(Kind.STRING) || t.is(Kind.IDENTIFIER)) {
                values.add(t);
            } else if (t.is(Kind.HEADER_NAME) || t.is(Kind.BODY) || t.is(Kind.EOF)) {
                pushback();
                break;
            } else {
                throw syntaxError(UNEXPECTED_TOKEN, t, "a header value");
            }
        }
        if (Character.isUpperCase(at.value.charAt(0))) {
            logger.warning(at.line + ":" + at.column + ": unsupported header " + at.value
                + ": may change the meaning of the automaton");
        } else {
            logger.log(level, "header kept as is: " + at.value);
        }
        others.add(new Entry(at, values));
    }

    /*
     * second pass
     */

    private Entry single(Field f) {
        List<Entry> entries = fields.get(f);
        return entries == null ? null : entries.get(0);
    }

    private List<Entry> all(Field f) {
        List<Entry> entries = fields.get(f);
        return entries == null ? new ArrayList<Entry>() : entries;
    }

    @SuppressWarnings("unchecked")
    private void check(Token body) {
        for (Field f : Field.values()) {
            if (f.mandatory && !fields.containsKey(f)) {
                throw error(MISSING_REQUIRED_HEADER, body, "missing mandatory header "
                    + f.hoaName + ":");
            }
        }

        Token version = (Token) single(Field.HOA).value;
        checkVersion(version);
        builder.version(version.value);

        Entry states = single(Field.STATES);
        builder.at(states.at).states((Integer) states.value);

        for (Entry e : all(Field.START)) {
            builder.at(e.at).start((List<Integer>) e.value);
        }

        Entry ap = single(Field.AP);
        Ints aps = (Ints) ap.value;
        builder.at(ap.at).aps(aps.count, aps.strings);

        for (Entry e : all(Field.ALIAS)) {
            Object[] alias = (Object[]) e.value;
            builder.at(e.at).alias(((Token) alias[0]).value, (Formula) alias[1]);
        }

        Entry acc = single(Field.ACCEPTANCE);
        Object[] condition = (Object[]) acc.value;
        builder.at(acc.at).acceptance((Integer) condition[0], (Formula) condition[1]);

        Entry accName = single(Field.ACC_NAME);
        if (accName != null) {
            Header.AccName an = (Header.AccName) accName.value;
            builder.accName(an.name, an.parameters.toArray());
        }
        Entry tool = single(Field.TOOL);
        if (tool != null) {
            Header.Tool t = (Header.Tool) tool.value;
            builder.tool(t.name, t.version);
        }
        Entry name = single(Field.NAME);
        if (name != null) {
            builder.name((String) name.value);
        }
        for (Entry e : all(Field.PROPERTIES)) {
            for (Token p : (List<Token>) e.value) {
                if (Property.forName(p.value) == null
                        && !Misc.isSet(flags, Automaton.STRICT_PROPERTIES)) {
                    logger.warning(p.line + ":" + p.column + ": unknown property "
                        + p.value + " ignored");
                }
                builder.at(p).properties(p.value);
            }
        }
        for (Entry e : others) {
            builder.item(e.at.value, (List<Token>) e.value);
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "header: " + fields.keySet() + ", " + others.size()
                + " other headers");
        }
    }

    private void checkVersion(Token version) {
        String v = version.value;
        if (v.equals("v1") || v.startsWith("v1.")) return;
        if (Misc.isSet(flags, Automaton.STRICT_VERSION)) {
            throw error(UNSUPPORTED_VERSION, version, "unsupported format version " + v);
        }
        logger.warning(version.line + ":" + version.column
            + ": unsupported format version " + v + ", reading it as v1");
    }
}
