/* @LICENSE@
 */

package org.hanoi.hoa;

import static org.hanoi.hoa.Formula.ap;
import static org.hanoi.hoa.Formula.not;
import static org.hanoi.hoa.HoaAssert.assertInvalid;
import static org.hanoi.hoa.HoaAssert.assertPosition;
import static org.hanoi.hoa.HoaAssert.assertValid;

import java.util.Arrays;
import java.util.Collections;

public class BodyParserTestCase extends AbstractHoaTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(BodyParserTestCase.class);
    }

    public BodyParserTestCase(String name) {
        super(name);
    }

    private static final String HEADER =
            "HOA: v1\n" +
            "States: 1\n" +
            "Start: 0\n" +
            "AP: 1 \"a\"\n" +
            "Acceptance: 1 Inf(0)\n" +
            "--BODY--\n";

    public void testSingleStateBuchi() {
        Automaton a = assertValid(HEADER +
            "State: 0 {0}\n" +
            "[0] 0\n" +
            "--END--\n");
        assertEquals(1, a.numStates());
        assertEquals(Collections.singletonList(Collections.singletonList(0)),
            a.header().start());
        State s = a.state(0);
        assertEquals(0, s.index());
        assertEquals(Collections.singletonList(0), s.accSets());
        assertNull(s.label());
        assertNull(s.name());
        assertEquals(1, s.edges().size());
        Edge e = s.edges().get(0);
        assertEquals(0, e.target());
        assertFalse(e.isUniversal());
        assertEquals(ap(0), e.label());
        assertNull(e.accSets());
    }

    public void testMissingEnd() {
        Problem p = assertInvalid(HEADER + "State: 0 {0}\n[0] 0\n", Problem.Kind.MISSING_END);
        assertPosition(p, 9, 1);
        assertEquals("expected --END--, found end of input", p.message());
    }

    public void testNextDocumentBeforeEnd() {
        Problem p = assertInvalid(HEADER + "State: 0\n[0] 0 {0}\n[!0] 0\n" + HEADER,
            Problem.Kind.MISSING_END);
        assertPosition(p, 10, 1);
    }

    public void testTrailingTokens() {
        Problem p = assertInvalid(MINIMAL + "0\n", Problem.Kind.UNEXPECTED_TOKEN);
        assertEquals("end of input after --END--", ((Problem.Syntax) p).expected());
        assertValid(MINIMAL + "/* trailing comment */\n\n");
    }

    public void testEdgeBeforeState() {
        Problem p = assertInvalid(HEADER + "[0] 0\nState: 0\n--END--\n",
            Problem.Kind.EDGE_BEFORE_STATE);
        assertPosition(p, 7, 1);
        assertInvalid(HEADER + "0\n--END--\n", Problem.Kind.EDGE_BEFORE_STATE);
    }

    public void testStateDetails() {
        Automaton a = assertValid(
            "HOA: v1\nStates: 2\nStart: 0\nAP: 1 \"a\"\nAcceptance: 2 Inf(0) | Inf(1)\n" +
            "--BODY--\n" +
            "State: [0] 0 \"first \\\"one\\\"\" {0 1}\n" +
            "1\n" +
            "State: [!0] 1 \"\" {}\n" +
            "0&1\n" +
            "--END--\n");
        State s0 = a.state(0);
        assertEquals("first \"one\"", s0.name());
        assertEquals(ap(0), s0.label());
        assertEquals(Arrays.asList(0, 1), s0.accSets());
        assertNull(s0.edges().get(0).label());

        State s1 = a.state(1);
        assertEquals("", s1.name());
        assertEquals(not(ap(0)), s1.label());
        assertEquals(Collections.<Integer> emptyList(), s1.accSets());

        Edge universal = s1.edges().get(0);
        assertTrue(universal.isUniversal());
        assertEquals(Arrays.asList(0, 1), universal.targets());
        try {
            universal.target();
            fail();
        } catch (IllegalStateException e) {
            // expected
        }
    }

    public void testStatesInAnyOrder() {
        Automaton a = assertValid(
            "HOA: v1\nStates: 3\nStart: 2\nAP: 0\nAcceptance: 0 t\n" +
            "--BODY--\n" +
            "State: 2\n1\n" +
            "State: 0\n0\n" +
            "State: 1\n0\n" +
            "--END--\n");
        for (int i = 0; i < 3; ++i) {
            assertEquals(i, a.state(i).index());
        }
        assertEquals(1, a.state(2).edges().get(0).target());
    }

    public void testEdgeAcceptance() {
        Automaton a = assertValid(HEADER + "State: 0\n[0] 0 {0}\n[!0] 0\n--END--\n");
        assertEquals(Collections.singletonList(0), a.state(0).edges().get(0).accSets());
        assertNull(a.state(0).edges().get(1).accSets());
    }

    public void testMalformedBody() {
        assertInvalid(HEADER + "State: 0\n[0 0\n--END--\n", Problem.Kind.MALFORMED_FORMULA);
        assertInvalid(HEADER + "State: 0\n[] 0\n--END--\n", Problem.Kind.MALFORMED_FORMULA);
        assertInvalid(HEADER + "State: \"s\" 0\n--END--\n", Problem.Kind.UNEXPECTED_TOKEN);
        assertInvalid(HEADER + "State: 0\n[0] 0 {0\n--END--\n", Problem.Kind.UNEXPECTED_TOKEN);
        assertInvalid(HEADER + "State: 0\n[0] 0&\n--END--\n", Problem.Kind.UNEXPECTED_TOKEN);
        assertInvalid(HEADER + "State: 0\nfoo: 1\n--END--\n", Problem.Kind.UNEXPECTED_TOKEN);
        // a second acceptance signature
        Problem p = assertInvalid(HEADER + "State: 0 {0}\n{1}\n--END--\n",
            Problem.Kind.UNEXPECTED_TOKEN);
        assertPosition(p, 8, 1);
    }

    public void testSignatureOnNextLine() {
        // newlines carry no meaning, so this is the signature of state 0
        Automaton a = assertValid(HEADER + "State: 0\n{0}\n[0] 0\n--END--\n");
        assertEquals(Collections.singletonList(0), a.state(0).accSets());
        assertNull(a.state(0).edges().get(0).accSets());
    }

    public void testAbortInBody() {
        Problem p = assertInvalid(HEADER + "State: 0\n[0] --ABORT--\n",
            Problem.Kind.ABORTED);
        assertPosition(p, 8, 5);
    }

    public void testEmptyBody() {
        Automaton a = assertValid("HOA: v1\nStates: 0\nAP: 0\nAcceptance: 0 t\n"
            + "--BODY--\n--END--\n");
        assertEquals(0, a.numStates());
        assertTrue(a.states().isEmpty());
    }
}
