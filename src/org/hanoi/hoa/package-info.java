/*
 * @LICENSE@
 */

/**
 * <h3><b>hanoi</b> - A reader, validator and printer for the Hanoi
 * Omega-Automata format.</h3>
 * <p>
 * <h4>The format.</h4>
 * <p>
 * The Hanoi Omega-Automata (HOA) format is a textual exchange format for
 * automata over infinite words: Büchi, co-Büchi, Rabin, Streett, parity and
 * generalized variants thereof, with state-based or transition-based
 * acceptance, explicit or implicit labels, and optionally universal
 * branching. Acceptance is expressed generically, as a boolean combination of
 * <code>Inf</code> and <code>Fin</code> conditions over numbered acceptance
 * sets.
 * <p>
 * A document has a header, with the number of states, the initial states,
 * the atomic propositions, aliases for label expressions and the acceptance
 * condition, followed by a body listing each state and its outgoing edges:
 *
 * <pre>
 * HOA: v1
 * States: 2
 * Start: 0
 * AP: 1 "a"
 * Acceptance: 1 Inf(0)
 * --BODY--
 * State: 0
 * [0] 1
 * State: 1 {0}
 * [t] 1
 * --END--
 * </pre>
 *
 * <h4>Usage.</h4>
 * <p>
 * {@link org.hanoi.hoa.Automaton#parse(CharSequence)} reads a single
 * document, and throws an {@link org.hanoi.hoa.InvalidAutomatonException}
 * carrying an {@link org.hanoi.hoa.ErrorReport} when the document is not a
 * valid automaton. {@link org.hanoi.hoa.Automaton#parseAll(CharSequence)}
 * reads a text of several documents, one {@link org.hanoi.hoa.ParseResult}
 * per document; a broken document does not keep the following ones from
 * being read. Automata can also be assembled with an
 * {@link org.hanoi.hoa.Automaton.Builder}, which applies the same checks.
 * <p>
 * Automata, their {@link org.hanoi.hoa.Header headers},
 * {@link org.hanoi.hoa.State states}, {@link org.hanoi.hoa.Edge edges} and
 * {@link org.hanoi.hoa.Formula formulas} are immutable values and may be
 * shared freely between threads. {@link org.hanoi.hoa.HoaPrinter} writes
 * them back as HOA text.
 * <p>
 * <h4>What is checked.</h4>
 * <p>
 * Beyond the grammar, a document must reference only declared propositions,
 * acceptance sets and states, define every alias it uses (without cycles),
 * label consistently (states or edges, not both) and agree with the
 * labelling and branching properties it declares. The number of
 * <code>State:</code> entries and of proposition names must match the
 * declared counts.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * The package logs to the <code>java.util.logging</code> logger
 * <code>org.hanoi.hoa</code>: parse tracing at <code>FINER</code> and
 * <code>FINEST</code>, and tolerated oddities (an unsupported format version,
 * an unknown header which may change the meaning of the automaton, an
 * unknown property) at <code>WARNING</code>.
 */
package org.hanoi.hoa;
