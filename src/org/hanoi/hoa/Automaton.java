/* @LICENSE@
 */
package org.hanoi.hoa;

import static org.hanoi.hoa.Misc.isSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.hanoi.hoa.Misc.FlagMgr;

/**
 * An immutable omega-automaton read from, or printable as, a document in
 * the Hanoi Omega-Automata (HOA) format.
 * <p>
 * Automata are obtained from {@link #parse(CharSequence)} and
 * {@link #parseAll(CharSequence)}, or assembled with a {@link Builder}. In
 * either case they have been validated: every proposition, acceptance set
 * and state referenced is in range, every alias resolves, labelling is
 * consistent, and the states are exactly <code>0..n-1</code>, in order.
 * <p>
 * Automata are values; <code>toString()</code> prints HOA text which reads
 * back as an equal automaton.
 *
 * <h3>Flags</h3>
 * The parse methods accept a bitwise OR of {@link #STRICT_VERSION},
 * {@link #STRICT_PROPERTIES} and {@link #RESOLVE_ALIASES}; other bits are
 * rejected with an {@link IllegalArgumentException}.
 */
public final class Automaton {

    private static final Logger logger = Logger.getLogger("org.hanoi.hoa");
    private static final Level level = Level.FINEST;

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * Rejects documents whose version is not <code>v1</code> or
     * <code>v1.x</code>. Without this flag they are read with a warning.
     */
    public static final int STRICT_VERSION = flagMgr.next("STRICT_VERSION");

    /**
     * Rejects <code>properties:</code> this package does not know.
     */
    public static final int STRICT_PROPERTIES = flagMgr.next("STRICT_PROPERTIES");

    /**
     * Replaces alias references in state and edge labels by the alias
     * definitions. The aliases themselves remain in the header.
     */
    public static final int RESOLVE_ALIASES = flagMgr.next("RESOLVE_ALIASES");

    static final int FLAG_COUNT =
            flagMgr.setImplemented(
                STRICT_VERSION | STRICT_PROPERTIES | RESOLVE_ALIASES).freezeAndCount();

    final Header header;
    final List<State> states;

    private Automaton(Header header, List<State> states) {
        this.header = header;
        this.states = states;
    }

    public Header header() {
        return header;
    }

    /**
     * @return the states, indexed by state number.
     */
    public List<State> states() {
        return states;
    }

    public State state(int index) {
        return states.get(index);
    }

    public int numStates() {
        return states.size();
    }

    /**
     * Parses a text holding exactly one HOA document.
     *
     * @throws InvalidAutomatonException
     *             if the text is not a single valid automaton.
     */
    public static Automaton parse(CharSequence text) {
        return parse(text, 0);
    }

    public static Automaton parse(CharSequence text, int flags) {
        flagMgr.check(flags);
        assert flags >>> FLAG_COUNT == 0;
        logger.log(level, "flags: " + flagMgr.stringFrom(flags));
        return new DocumentParser(flags).parse(new Lexer(text)).automaton();
    }

    /**
     * Reads a text holding any number of HOA documents, one after the other.
     * Documents are found and parsed as the returned iterable is walked; a
     * broken document yields an invalid {@link ParseResult} and reading
     * resumes with the next <code>HOA:</code> header.
     */
    public static Iterable<ParseResult> parseAll(CharSequence text) {
        return parseAll(text, 0);
    }

    public static Iterable<ParseResult> parseAll(final CharSequence text, final int flags) {
        flagMgr.check(flags);
        return new Iterable<ParseResult>() {
            public Iterator<ParseResult> iterator() {
                final Iterator<Documents.Range> ranges = new Documents(text).iterator();
                final DocumentParser parser = new DocumentParser(flags);
                return new Misc.ImmutableIterator<ParseResult>() {
                    public boolean hasNext() {
                        return ranges.hasNext();
                    }
                    public ParseResult next() {
                        if (!hasNext()) throw new NoSuchElementException();
                        return parser.parse(ranges.next().lexer());
                    }
                };
            }
        };
    }

    /**
     * Like {@link #parseAll(CharSequence, int)}, but parses the documents
     * on the given executor. Results are returned in document order.
     *
     * @throws InterruptedException
     *             if interrupted while waiting for the results; the
     *             documents not parsed yet are then cancelled.
     */
    public static List<ParseResult> parseAll(CharSequence text, final int flags,
            ExecutorService executor) throws InterruptedException {
        flagMgr.check(flags);
        List<Future<ParseResult>> futures = new ArrayList<Future<ParseResult>>();
        for (final Documents.Range range : new Documents(text)) {
            futures.add(executor.submit(new Callable<ParseResult>() {
                public ParseResult call() {
                    return new DocumentParser(flags).parse(range.lexer());
                }
            }));
        }
        List<ParseResult> ret = new ArrayList<ParseResult>(futures.size());
        for (Future<ParseResult> f : futures) {
            try {
                ret.add(f.get());
            } catch (InterruptedException e) {
                for (Future<ParseResult> g : futures) {
                    g.cancel(true);
                }
                throw e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                if (cause instanceof Error) throw (Error) cause;
                throw new IllegalStateException(cause);
            }
        }
        return ret;
    }

    public static List<ParseResult> parseAll(CharSequence text, ExecutorService executor)
            throws InterruptedException {
        return parseAll(text, 0, executor);
    }

    @Override
    public int hashCode() {
        return 31 * header.hashCode() + states.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Automaton))
            return false;
        Automaton other = (Automaton) obj;
        return header.equals(other.header) && states.equals(other.states);
    }

    /**
     * @return the automaton as a HOA document.
     */
    @Override
    public String toString() {
        return HoaPrinter.toString(this);
    }

    /**
     * Assembles an automaton piece by piece, in the order of a HOA document:
     * header parts first, then each state followed by its edges.
     * {@link #build()} validates the whole and never returns an invalid
     * automaton.
     * <p>
     * Builders are not thread safe and are meant to be used once.
     */
    public static final class Builder {

        static final class Located<T> {
            final T value;
            final int line;
            final int column;

            Located(T value, int line, int column) {
                this.value = value;
                this.line = line;
                this.column = column;
            }
        }

        static final class StateDraft {
            final int index;
            final String name;
            final Formula label;
            final List<Integer> accSets;
            final List<EdgeDraft> edges = new ArrayList<EdgeDraft>();
            final int line;
            final int column;

            StateDraft(int index, String name, Formula label, List<Integer> accSets,
                    int line, int column) {
                this.index = index;
                this.name = name;
                this.label = label;
                this.accSets = accSets;
                this.line = line;
                this.column = column;
            }
        }

        static final class EdgeDraft {
            final List<Integer> targets;
            final Formula label;
            final List<Integer> accSets;
            final int line;
            final int column;

            EdgeDraft(List<Integer> targets, Formula label, List<Integer> accSets,
                    int line, int column) {
                this.targets = targets;
                this.label = label;
                this.accSets = accSets;
                this.line = line;
                this.column = column;
            }
        }

        final int flags;

        String version = "v1";
        Located<Integer> numStates = null;
        final List<Located<List<Integer>>> start = new ArrayList<Located<List<Integer>>>();
        Located<Integer> numAps = new Located<Integer>(0, -1, -1);
        List<String> aps = Collections.emptyList();
        final Map<String, Located<Formula>> aliases = new LinkedHashMap<String, Located<Formula>>();
        Located<Integer> numAccSets = new Located<Integer>(0, -1, -1);
        Formula acceptance = Formula.TRUE;
        Header.AccName accName = null;
        Header.Tool tool = null;
        String name = null;
        final List<Located<String>> properties = new ArrayList<Located<String>>();
        final List<Header.Item> items = new ArrayList<Header.Item>();
        final List<StateDraft> states = new ArrayList<StateDraft>();

        private StateDraft current = null;
        private int line = -1;
        private int column = -1;

        public Builder() {
            this(0);
        }

        /**
         * @param flags
         *            as for {@link Automaton#parse(CharSequence, int)}.
         */
        public Builder(int flags) {
            flagMgr.check(flags);
            assert flags >>> FLAG_COUNT == 0;
            this.flags = flags;
        }

        /*
         * the position recorded with the parts added next
         */
        Builder at(Token t) {
            line = t.line;
            column = t.column;
            return this;
        }

        private <T> Located<T> located(T value) {
            return new Located<T>(value, line, column);
        }

        private static List<Integer> copy(List<Integer> ints) {
            if (ints == null) return null;
            for (Integer i : ints) {
                if (i == null) throw new NullPointerException("null index");
            }
            return Collections.unmodifiableList(new ArrayList<Integer>(ints));
        }

        private static String identifier(String what, String s) {
            if (s == null) throw new NullPointerException(what);
            if (!Lexer.isIdentifier(s)) {
                throw new IllegalArgumentException(what + " is not an identifier: "
                    + Misc.Esc.DIAG.esc(s));
            }
            return s;
        }

        private static int count(String what, int n) {
            if (n < 0) throw new IllegalArgumentException("negative " + what + ": " + n);
            return n;
        }

        private static Formula label(Formula f) {
            if (f != null && !f.acceptanceSets().isEmpty()) {
                throw new IllegalArgumentException("Inf or Fin in a label: " + f);
            }
            return f;
        }

        /**
         * @param version
         *            an identifier such as <code>v1</code>.
         */
        public Builder version(String version) {
            this.version = identifier("version", version);
            return this;
        }

        /**
         * Declares the number of states. Without it, the number of states
         * added is declared.
         */
        public Builder states(int numStates) {
            this.numStates = located(count("number of states", numStates));
            return this;
        }

        /**
         * Adds a <code>Start:</code> line; several states make a universal
         * conjunction.
         */
        public Builder start(Integer... states) {
            return start(Arrays.asList(states));
        }

        public Builder start(List<Integer> conjunction) {
            if (conjunction.isEmpty()) throw new IllegalArgumentException("empty start");
            start.add(located(copy(conjunction)));
            return this;
        }

        public Builder aps(String... names) {
            return aps(names.length, Arrays.asList(names));
        }

        /**
         * @param count
         *            the declared number of propositions, which is checked
         *            against the number of names.
         */
        public Builder aps(int count, List<String> names) {
            for (String n : names) {
                if (n == null) throw new NullPointerException("null proposition name");
            }
            numAps = located(count("number of propositions", count));
            aps = Collections.unmodifiableList(new ArrayList<String>(names));
            return this;
        }

        boolean hasAlias(String name) {
            return aliases.containsKey(name);
        }

        /**
         * @param name
         *            with or without the leading <code>@</code>.
         * @throws IllegalArgumentException
         *             if the alias was defined before, or if the name or
         *             body cannot be written as HOA.
         */
        public Builder alias(String name, Formula body) {
            if (body == null) throw new NullPointerException("body");
            String key = Formula.alias(name).name;
            if (hasAlias(key)) {
                throw new IllegalArgumentException("alias @" + key + " defined twice");
            }
            aliases.put(key, located(label(body)));
            return this;
        }

        /**
         * @param condition
         *            constants and <code>Inf</code>/<code>Fin</code> atoms,
         *            combined with <code>and</code> and <code>or</code>.
         */
        public Builder acceptance(int numSets, Formula condition) {
            if (condition == null) throw new NullPointerException("condition");
            if (!condition.isCondition()) {
                throw new IllegalArgumentException("not an acceptance condition: " + condition);
            }
            numAccSets = located(count("number of acceptance sets", numSets));
            acceptance = condition;
            return this;
        }

        /**
         * @param parameters
         *            {@link Boolean}, non-negative {@link Integer} or
         *            identifier {@link String} values. <code>t</code>,
         *            <code>f</code> and numbers must be given as Booleans
         *            and Integers.
         */
        public Builder accName(String name, Object... parameters) {
            identifier("acc-name", name);
            for (Object p : parameters) {
                if (p instanceof Integer) {
                    count("acc-name parameter", (Integer) p);
                } else if (p instanceof String) {
                    String s = identifier("acc-name parameter", (String) p);
                    if (s.equals("t") || s.equals("f")) {
                        throw new IllegalArgumentException("acc-name parameter " + s
                            + " is a Boolean");
                    }
                } else if (!(p instanceof Boolean)) {
                    throw new IllegalArgumentException("acc-name parameter: " + p);
                }
            }
            accName = new Header.AccName(name, Arrays.asList(parameters));
            return this;
        }

        /**
         * @param version
         *            may be null.
         */
        public Builder tool(String name, String version) {
            if (name == null) throw new NullPointerException("tool");
            tool = new Header.Tool(name, version);
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder properties(String... names) {
            for (String p : names) {
                properties.add(located(identifier("property", p)));
            }
            return this;
        }

        /**
         * Adds a header this package has no model for.
         *
         * @param values
         *            the header's values in HOA syntax, e.g.
         *            <code>"1 \"x\" t"</code>.
         * @throws HoaSyntaxException
         *             if <code>values</code> cannot be tokenized.
         * @throws IllegalArgumentException
         *             if <code>name</code> is not an identifier or names a
         *             header with a meaning of its own, or if the values are
         *             not integers, strings and identifiers.
         */
        public Builder item(String name, CharSequence values) {
            return item(name, new Lexer(values).tokens());
        }

        Builder item(String name, List<Token> values) {
            identifier("header name", name);
            if (HeaderParser.Field.forName(name) != null) {
                throw new IllegalArgumentException(name + ": is not a free-form header");
            }
            for (Token t : values) {
                if (!(t.is(Token.Kind.INT) || t.is(Token.Kind.STRING)
                        || t.is(Token.Kind.IDENTIFIER))) {
                    throw new IllegalArgumentException(name + ": cannot hold " + t.describe());
                }
            }
            items.add(new Header.Item(name, values));
            return this;
        }

        /**
         * Starts a new state; edges added from now on leave it.
         *
         * @param name
         *            may be null.
         * @param label
         *            may be null.
         * @param accSets
         *            null for no acceptance signature.
         */
        public Builder state(int index, String name, Formula label, List<Integer> accSets) {
            current = new StateDraft(index, name, label(label), copy(accSets), line, column);
            states.add(current);
            return this;
        }

        public Builder state(int index) {
            return state(index, null, null, null);
        }

        boolean hasState() {
            return current != null;
        }

        /**
         * @throws IllegalStateException
         *             if no state was started yet.
         */
        public Builder edge(List<Integer> targets, Formula label, List<Integer> accSets) {
            if (current == null) throw new IllegalStateException("edge before any state");
            if (targets.isEmpty()) throw new IllegalArgumentException("edge without target");
            current.edges.add(new EdgeDraft(copy(targets), label(label), copy(accSets),
                line, column));
            return this;
        }

        public Builder edge(Formula label, int target) {
            return edge(Collections.singletonList(target), label, null);
        }

        public Builder edge(int target) {
            return edge(null, target);
        }

        List<Problem> validate() {
            return new Validator(this).validate();
        }

        /**
         * @throws InvalidAutomatonException
         *             listing every problem of the first failing kind of
         *             check.
         */
        public Automaton build() {
            List<Problem> problems = validate();
            if (!problems.isEmpty()) {
                throw new InvalidAutomatonException(new ErrorReport(problems));
            }
            return seal();
        }

        /*
         * assumes validate() found nothing
         */
        Automaton seal() {
            Map<String, Formula> aliasMap = new LinkedHashMap<String, Formula>();
            for (Map.Entry<String, Located<Formula>> e : aliases.entrySet()) {
                aliasMap.put(e.getKey(), e.getValue().value);
            }
            aliasMap = Collections.unmodifiableMap(aliasMap);
            boolean resolve = isSet(flags, RESOLVE_ALIASES);

            State[] dense = new State[states.size()];
            for (StateDraft sd : states) {
                List<Edge> edges = new ArrayList<Edge>(sd.edges.size());
                for (EdgeDraft ed : sd.edges) {
                    edges.add(new Edge(ed.targets,
                        resolve(ed.label, aliasMap, resolve), ed.accSets));
                }
                assert dense[sd.index] == null;
                dense[sd.index] = new State(sd.index, sd.name,
                    resolve(sd.label, aliasMap, resolve), sd.accSets,
                    Collections.unmodifiableList(edges));
            }

            List<List<Integer>> startList = new ArrayList<List<Integer>>();
            for (Located<List<Integer>> s : start) {
                startList.add(s.value);
            }
            List<String> props = new ArrayList<String>();
            for (Located<String> p : properties) {
                props.add(p.value);
            }
            Header header = new Header(version,
                numStates == null ? states.size() : numStates.value,
                Collections.unmodifiableList(startList),
                aps,
                aliasMap,
                numAccSets.value,
                acceptance,
                accName,
                tool,
                name,
                Collections.unmodifiableList(props),
                Collections.unmodifiableList(new ArrayList<Header.Item>(items)));
            Automaton ret = new Automaton(header,
                Collections.unmodifiableList(Arrays.asList(dense)));
            if (logger.isLoggable(level)) {
                logger.log(level, "sealed: " + dense.length + " states, "
                    + aps.size() + " APs, " + numAccSets.value + " acceptance sets");
            }
            return ret;
        }

        private static Formula resolve(Formula label, Map<String, Formula> aliases,
                boolean resolve) {
            return label == null || !resolve ? label : label.resolve(aliases);
        }
    }
}
