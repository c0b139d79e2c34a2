/* @LICENSE@
 */
package org.hanoi.hoa;

import static org.hanoi.hoa.Problem.Kind.EDGE_BEFORE_STATE;
import static org.hanoi.hoa.Problem.Kind.MISSING_END;
import static org.hanoi.hoa.Problem.Kind.UNEXPECTED_TOKEN;

import java.util.ArrayList;
import java.util.List;

import org.hanoi.hoa.Misc.PushbackIterator;
import org.hanoi.hoa.Token.Kind;

/**
 * Reads the body of a document, after <code>--BODY--</code> and through
 * <code>--END--</code>, into an {@link Automaton.Builder}.
 */
final class BodyParser extends AbstractParser {

    private static final String STATE = "State";

    private final Automaton.Builder builder;
    private final FormulaParser formulas;

    BodyParser(PushbackIterator<Token> tokens, Automaton.Builder builder) {
        super(tokens);
        this.builder = builder;
        this.formulas = new FormulaParser(tokens);
    }

    void parse() {
        while (true) {
            Token t = next();
            switch (t.kind) {
            case END:
                return;
            case HEADER_NAME:
                if (t.value.equals(STATE)) {
                    state(t);
                    break;
                }
                if (t.value.equals(HeaderParser.Field.HOA.hoaName)) {
                    throw syntaxError(MISSING_END, t, "--END--");
                }
                throw syntaxError(UNEXPECTED_TOKEN, t, "State:, an edge or --END--");
            case LBRACKET:
            case INT:
                if (!builder.hasState()) {
                    throw error(EDGE_BEFORE_STATE, t, "edge before the first State:");
                }
                pushback();
                edge(t);
                break;
            case EOF:
                throw syntaxError(MISSING_END, t, "--END--");
            default:
                throw syntaxError(UNEXPECTED_TOKEN, t, "State:, an edge or --END--");
            }
        }
    }

    private void state(Token at) {
        Formula label = label();
        int index = expect(Kind.INT, "a state number").intValue();
        Token name = accept(Kind.STRING);
        List<Integer> accSets = accSignature();
        builder.at(at).state(index, name == null ? null : name.value, label, accSets);
    }

    private void edge(Token at) {
        Formula label = label();
        List<Integer> targets = conjunction();
        List<Integer> accSets = accSignature();
        builder.at(at).edge(targets, label, accSets);
    }

    private Formula label() {
        if (accept(Kind.LBRACKET) == null) return null;
        Formula ret = formulas.parse(FormulaParser.Context.LABEL);
        expect(Problem.Kind.MALFORMED_FORMULA, Kind.RBRACKET, "']'");
        return ret;
    }

    /*
     * { INT* } or nothing
     */
    private List<Integer> accSignature() {
        if (accept(Kind.LBRACE) == null) return null;
        List<Integer> ret = new ArrayList<Integer>();
        for (Token t; (t = accept(Kind.INT)) != null;) {
            ret.add(t.intValue());
        }
        expect(Kind.RBRACE, "an acceptance set number or '}'");
        return ret;
    }
}
