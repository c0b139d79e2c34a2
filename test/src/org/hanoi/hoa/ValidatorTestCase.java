/* @LICENSE@
 */

package org.hanoi.hoa;

import static org.hanoi.hoa.HoaAssert.assertInvalid;
import static org.hanoi.hoa.HoaAssert.assertPosition;
import static org.hanoi.hoa.HoaAssert.assertRange;
import static org.hanoi.hoa.HoaAssert.assertValid;
import static org.hanoi.hoa.HoaAssert.reportOf;

import java.util.Arrays;

import org.hanoi.hoa.Problem.Range;

public class ValidatorTestCase extends AbstractHoaTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(ValidatorTestCase.class);
    }

    public ValidatorTestCase(String name) {
        super(name);
    }

    /*
     * header with two propositions and two acceptance sets
     */
    private static String doc(int states, String extraHeaders, String body) {
        return "HOA: v1\n" +
            "States: " + states + "\n" +
            "Start: 0\n" +
            "AP: 2 \"a\" \"b\"\n" +
            "Acceptance: 2 Inf(0) & Inf(1)\n" +
            extraHeaders +
            "--BODY--\n" +
            body +
            "--END--\n";
    }

    /*
     * ranges
     */

    public void testStartOutOfRange() {
        Problem p = assertInvalid(MINIMAL.replace("Start: 0", "Start: 1"),
            Problem.Kind.RANGE_VIOLATION);
        assertRange(p, Range.START_STATE, 1, 1);
        assertPosition(p, 3, 1);
        assertEquals("3:1: start state 1 out of range (States: 1)", p.toString());
    }

    public void testPropositionOutOfRange() {
        Problem p = assertInvalid(MINIMAL.replace("[!0]", "[!1]"),
            Problem.Kind.RANGE_VIOLATION);
        assertRange(p, Range.PROPOSITION, 1, 1);
        assertPosition(p, 9, 1);
    }

    public void testAcceptanceOutOfRange() {
        assertRange(assertInvalid(MINIMAL.replace("Inf(0)", "Inf(1)"),
            Problem.Kind.RANGE_VIOLATION), Range.ACCEPTANCE_SET, 1, 1);
        assertRange(assertInvalid(MINIMAL.replace("{0}", "{3}"),
            Problem.Kind.RANGE_VIOLATION), Range.ACCEPTANCE_SET, 3, 1);
    }

    public void testTargetAndStateOutOfRange() {
        assertRange(assertInvalid(MINIMAL.replace("[0] 0", "[0] 5"),
            Problem.Kind.RANGE_VIOLATION), Range.EDGE_TARGET, 5, 1);
        assertRange(assertInvalid(MINIMAL.replace("State: 0", "State: 1"),
            Problem.Kind.RANGE_VIOLATION), Range.STATE, 1, 1);
    }

    public void testAliasBodyOutOfRange() {
        Problem p = assertInvalid(doc(1, "Alias: @x 0 & 2\n", "State: 0\n[@x] 0 {0 1}\n"),
            Problem.Kind.RANGE_VIOLATION);
        assertRange(p, Range.PROPOSITION, 2, 2);
        assertPosition(p, 6, 1);
    }

    public void testAllRangeProblemsReported() {
        ErrorReport report = reportOf(doc(1, "", "State: 0\n[0 & 7] 3 {9}\n"));
        assertEquals(report.toString(), 3, report.size());
        assertRange(report.problems().get(0), Range.EDGE_TARGET, 3, 1);
        assertRange(report.problems().get(1), Range.PROPOSITION, 7, 2);
        assertRange(report.problems().get(2), Range.ACCEPTANCE_SET, 9, 2);
    }

    /*
     * aliases
     */

    public void testUndefinedAlias() {
        Problem p = assertInvalid(doc(1, "Alias: @x 0 & 1\n", "State: 0\n[@y] 0 {0 1}\n"),
            Problem.Kind.UNRESOLVED_ALIAS);
        assertEquals("y", ((Problem.UnresolvedAlias) p).name());
        assertPosition(p, 9, 1);
        assertEquals("undefined alias @y", p.message());
    }

    public void testUndefinedAliasInAlias() {
        Problem p = assertInvalid(doc(1, "Alias: @x @z | 1\n", "State: 0\n[@x] 0 {0 1}\n"),
            Problem.Kind.UNRESOLVED_ALIAS);
        assertEquals("z", ((Problem.UnresolvedAlias) p).name());
        assertPosition(p, 6, 1);
    }

    public void testAliasesUsedInOrder() {
        Automaton a = assertValid(doc(1,
            "Alias: @a 0\nAlias: @b !@a & 1\n",
            "State: 0\n[@b] 0 {0 1}\n[!@b] 0\n"));
        assertEquals(Formula.alias("b"), a.state(0).edges().get(0).label());
    }

    public void testForwardReference() {
        Problem p = assertInvalid(doc(1,
            "Alias: @a @b\nAlias: @b 0\n",
            "State: 0\n[@a] 0 {0 1}\n"),
            Problem.Kind.UNRESOLVED_ALIAS);
        assertEquals("b", ((Problem.UnresolvedAlias) p).name());
        assertPosition(p, 6, 1);
    }

    public void testSelfReference() {
        Problem p = assertInvalid(doc(1, "Alias: @a @a\n", "State: 0\n[0] 0 {0 1}\n"),
            Problem.Kind.CYCLIC_ALIAS);
        assertEquals(Arrays.asList("a", "a"), ((Problem.CyclicAlias) p).chain());
    }

    public void testCycle() {
        ErrorReport report = reportOf(doc(1,
            "Alias: @a 0 | @b\nAlias: @b @c & 1\nAlias: @c !@a\n",
            "State: 0\n[@a] 0 {0 1}\n"));
        assertEquals(report.toString(), 1, report.size());
        Problem.CyclicAlias p = (Problem.CyclicAlias) report.first();
        assertEquals(Arrays.asList("a", "b", "c", "a"), p.chain());
        assertEquals("cyclic alias definition: @a -> @b -> @c -> @a", p.message());
        assertPosition(p, 8, 1);
    }

    /*
     * labelling
     */

    public void testMixedLabels() {
        Problem p = assertInvalid(doc(1, "", "State: [0] 0\n[1] 0 {0 1}\n"),
            Problem.Kind.INCONSISTENT_LABELING);
        assertPosition(p, 8, 1);
    }

    public void testUnlabelledState() {
        ErrorReport report = reportOf(doc(2, "",
            "State: [0] 0\n1 {0}\nState: 1\n0 {1}\n"));
        assertEquals(1, report.size());
        assertEquals(Problem.Kind.INCONSISTENT_LABELING, report.first().kind());
        assertPosition(report.first(), 9, 1);
    }

    public void testUnlabelledEdge() {
        Problem p = assertInvalid(doc(1, "", "State: 0\n[0] 0 {0 1}\n0\n"),
            Problem.Kind.INCONSISTENT_LABELING);
        assertPosition(p, 9, 1);
    }

    public void testImplicitLabels() {
        Automaton a = assertValid(doc(1, "properties: implicit-labels\n",
            "State: 0 {0 1}\n0\n0\n0\n0\n"));
        assertEquals(4, a.state(0).edges().size());
        assertNull(a.state(0).edges().get(3).label());

        Problem p = assertInvalid(doc(1, "", "State: 0 {0 1}\n0\n0\n0\n"),
            Problem.Kind.INCONSISTENT_LABELING);
        assertPosition(p, 7, 1);
    }

    public void testMixedAcceptance() {
        assertInvalid(doc(1, "", "State: 0 {0}\n[t] 0 {1}\n"),
            Problem.Kind.INCONSISTENT_LABELING);
    }

    public void testPropertyContradictions() {
        String stateLabels = "State: [t] 0 {0 1}\n0\n";
        String transLabels = "State: 0\n[t] 0 {0 1}\n";
        assertValid(doc(1, "properties: state-labels state-acc\n", stateLabels));
        assertValid(doc(1, "properties: trans-labels trans-acc explicit-labels\n",
            transLabels));

        assertInvalid(doc(1, "properties: state-labels\n", transLabels),
            Problem.Kind.INCONSISTENT_LABELING);
        assertInvalid(doc(1, "properties: trans-labels\n", stateLabels),
            Problem.Kind.INCONSISTENT_LABELING);
        assertInvalid(doc(1, "properties: implicit-labels\n", stateLabels),
            Problem.Kind.INCONSISTENT_LABELING);
        assertInvalid(doc(1, "properties: state-acc\n", transLabels),
            Problem.Kind.INCONSISTENT_LABELING);
        assertInvalid(doc(1, "properties: trans-acc\n", stateLabels),
            Problem.Kind.INCONSISTENT_LABELING);

        Problem p = assertInvalid(doc(1, "properties: explicit-labels\n",
            "State: 0 {0 1}\n0\n0\n0\n0\n"), Problem.Kind.INCONSISTENT_LABELING);
        assertPosition(p, 6, 13);
    }

    public void testBranchingProperties() {
        String universal = "State: 0\n[t] 0&0 {0 1}\n";
        assertValid(doc(1, "properties: univ-branch\n", universal));
        assertInvalid(doc(1, "properties: no-univ-branch\n", universal),
            Problem.Kind.INCONSISTENT_LABELING);
        assertInvalid(doc(1, "properties: deterministic\n", universal),
            Problem.Kind.INCONSISTENT_LABELING);
        assertInvalid(doc(1, "Start: 0\nproperties: deterministic\n",
            "State: 0\n[t] 0 {0 1}\n"), Problem.Kind.INCONSISTENT_LABELING);
    }

    /*
     * cardinalities
     */

    public void testStateCountMismatch() {
        Problem p = assertInvalid(doc(2, "", "State: 0\n[t] 0 {0 1}\n"),
            Problem.Kind.CARDINALITY_MISMATCH);
        assertEquals(2, ((Problem.CardinalityMismatch) p).declared());
        assertEquals(1, ((Problem.CardinalityMismatch) p).actual());
        assertEquals("2 states declared, 1 found", p.message());
        assertPosition(p, 2, 1);
    }

    public void testPropositionCountMismatch() {
        Problem p = assertInvalid(MINIMAL.replace("AP: 1 \"a\"", "AP: 1 \"a\" \"b\""),
            Problem.Kind.CARDINALITY_MISMATCH);
        assertEquals(1, ((Problem.CardinalityMismatch) p).declared());
        assertEquals(2, ((Problem.CardinalityMismatch) p).actual());
        assertPosition(p, 4, 1);
    }

    public void testDuplicateState() {
        ErrorReport report = reportOf(doc(2, "",
            "State: 0\n[t] 0 {0 1}\nState: 0\n[t] 0\n"));
        assertTrue(report.contains(Problem.Kind.DUPLICATE_STATE));
        assertEquals(Problem.Kind.DUPLICATE_STATE, report.first().kind());
        assertPosition(report.first(), 9, 1);
    }

    public void testDuplicateProposition() {
        Problem p = assertInvalid(MINIMAL.replace("AP: 1 \"a\"", "AP: 2 \"a\" \"a\""),
            Problem.Kind.DUPLICATE_PROPOSITION);
        assertPosition(p, 4, 1);
    }

    public void testGroupsInOrder() {
        // a range problem hides the labelling and cardinality ones
        ErrorReport report = reportOf(doc(3, "", "State: [0] 0\n[1] 4 {0 1}\n"));
        assertEquals(1, report.size());
        assertEquals(Problem.Kind.RANGE_VIOLATION, report.first().kind());
    }
}
