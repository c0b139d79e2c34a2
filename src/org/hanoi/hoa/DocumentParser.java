/* @LICENSE@
 */
package org.hanoi.hoa;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.hanoi.hoa.Misc.PushbackIterator;
import org.hanoi.hoa.Token.Kind;

/**
 * Drives the header and body parsers and the validator over one document.
 * Every failure, lexical, grammatical or semantic, ends up in the
 * {@link ParseResult}; nothing is thrown.
 */
final class DocumentParser {

    private static final Logger logger = Logger.getLogger("org.hanoi.hoa");
    private static final Level level = Level.FINER;

    private final int flags;

    DocumentParser(int flags) {
        this.flags = flags;
    }

    ParseResult parse(Lexer lexer) {
        ParseResult ret;
        try {
            PushbackIterator<Token> tokens = lexer.iterator();
            Automaton.Builder builder = new Automaton.Builder(flags);
            new HeaderParser(tokens, builder, flags).parse();
            BodyParser body = new BodyParser(tokens, builder);
            body.parse();
            body.expect(Kind.EOF, "end of input after --END--");
            List<Problem> problems = builder.validate();
            ret = problems.isEmpty()
                    ? new ParseResult(builder.seal(), lexer.line())
                    : new ParseResult(new ErrorReport(problems), lexer.line());
        } catch (HoaSyntaxException e) {
            ret = new ParseResult(ErrorReport.of(e.problem()), lexer.line());
        }
        if (logger.isLoggable(level)) {
            logger.log(level, ret.toString());
        }
        return ret;
    }
}
