/* @LICENSE@
 */
package org.hanoi.hoa;

import static org.hanoi.hoa.Problem.Kind.MALFORMED_FORMULA;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.hanoi.hoa.Misc.PushbackIterator;
import org.hanoi.hoa.Token.Kind;

/**
 * Precedence climbing parser for label expressions and acceptance
 * conditions. <code>|</code> binds loosest, then <code>&amp;</code>, then
 * <code>!</code>. Both contexts produce {@link Formula} trees; they differ in
 * their atoms only. Alias references are kept as they are.
 * <p>
 * A formula ends at the first token which cannot continue it; that token is
 * left in the stream.
 */
final class FormulaParser extends AbstractParser {

    private static final Logger logger = Logger.getLogger("org.hanoi.hoa");
    private static final Level level = Level.FINEST;

    enum Context {
        /** state and edge labels, alias bodies */
        LABEL("an atomic proposition, an alias, 't', 'f', '!' or '('"),
        /** the <code>Acceptance:</code> condition */
        ACCEPTANCE("'Inf', 'Fin', 't', 'f' or '('");

        final String expected;

        Context(String expected) {
            this.expected = expected;
        }
    }

    private enum Operator {
        OR(Kind.OR, 1),
        AND(Kind.AND, 2);

        final Kind kind;
        final int precedence;

        Operator(Kind kind, int precedence) {
            this.kind = kind;
            this.precedence = precedence;
        }

        static Operator of(Token t) {
            for (Operator op : values()) {
                if (op.kind == t.kind) return op;
            }
            return null;
        }

        Formula combine(Formula lhs, Formula rhs) {
            return this == AND ? Formula.and(lhs, rhs) : Formula.or(lhs, rhs);
        }
    }

    /** how deeply parentheses and negations may nest */
    static final int MAX_DEPTH = 1000;

    private Context context;
    private int depth;

    FormulaParser(PushbackIterator<Token> tokens) {
        super(tokens);
    }

    Formula parse(Context context) {
        this.context = context;
        this.depth = 0;
        Formula ret = expression(0);
        if (logger.isLoggable(level)) {
            logger.log(level, context + ": " + ret + Misc.LS + ret.toTreeString());
        }
        return ret;
    }

    private Formula expression(int minPrecedence) {
        Formula lhs = unary();
        while (true) {
            Token t = next();
            Operator op = Operator.of(t);
            if (op == null || op.precedence < minPrecedence) {
                pushback();
                return lhs;
            }
            lhs = op.combine(lhs, expression(op.precedence + 1));
        }
    }

    private Formula unary() {
        Token t = next();
        if (t.is(Kind.NOT)) {
            if (context == Context.ACCEPTANCE) {
                throw syntaxError(MALFORMED_FORMULA, t, context.expected);
            }
            enter(t);
            Formula operand = unary();
            --depth;
            return Formula.not(operand);
        }
        pushback();
        return atom();
    }

    private Formula atom() {
        Token t = next();
        switch (t.kind) {
        case LPAREN:
            enter(t);
            Formula ret = expression(0);
            expect(MALFORMED_FORMULA, Kind.RPAREN, "')'");
            --depth;
            return ret;
        case IDENTIFIER:
            if (t.text.equals("t")) return Formula.TRUE;
            if (t.text.equals("f")) return Formula.FALSE;
            if (context == Context.ACCEPTANCE) {
                Formula.Qualifier q = Formula.Qualifier.forGlyph(t.text);
                if (q != null) return accSet(q);
            }
            break;
        case INT:
            if (context == Context.LABEL) return Formula.ap(t.intValue());
            break;
        case ALIAS:
            if (context == Context.LABEL) return Formula.alias(t.value);
            break;
        default:
            break;
        }
        throw syntaxError(MALFORMED_FORMULA, t, context.expected);
    }

    private void enter(Token t) {
        if (++depth > MAX_DEPTH) {
            throw error(MALFORMED_FORMULA, t,
                "formula nested deeper than " + MAX_DEPTH + " levels");
        }
    }

    private Formula accSet(Formula.Qualifier q) {
        expect(MALFORMED_FORMULA, Kind.LPAREN, "'(' after " + q.glyph);
        boolean complemented = accept(Kind.NOT) != null;
        Token set = expect(MALFORMED_FORMULA, Kind.INT, "an acceptance set number");
        expect(MALFORMED_FORMULA, Kind.RPAREN, "')'");
        return Formula.acc(q, set.intValue(), complemented);
    }
}
