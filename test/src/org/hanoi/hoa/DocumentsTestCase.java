/* @LICENSE@
 */

package org.hanoi.hoa;

import java.util.ArrayList;
import java.util.List;

public class DocumentsTestCase extends AbstractHoaTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(DocumentsTestCase.class);
    }

    public DocumentsTestCase(String name) {
        super(name);
    }

    private static List<Documents.Range> split(String text) {
        List<Documents.Range> ret = new ArrayList<Documents.Range>();
        for (Documents.Range r : new Documents(text)) {
            ret.add(r);
        }
        return ret;
    }

    private static String textOf(Documents.Range r) {
        return r.text.subSequence(r.begin, r.end).toString();
    }

    public void testSingle() {
        List<Documents.Range> ranges = split(MINIMAL);
        assertEquals(1, ranges.size());
        assertEquals(MINIMAL, textOf(ranges.get(0)));
        assertEquals(1, ranges.get(0).line);
    }

    public void testEmpty() {
        assertTrue(split("").isEmpty());
        assertTrue(split(" \n /* only a comment */\n").isEmpty());
    }

    public void testSeveral() {
        String text = MINIMAL + "\n" + MINIMAL + MINIMAL;
        List<Documents.Range> ranges = split(text);
        assertEquals(3, ranges.size());
        assertEquals(MINIMAL + "\n", textOf(ranges.get(0)));
        assertEquals(MINIMAL, textOf(ranges.get(1)));
        assertEquals(MINIMAL, textOf(ranges.get(2)));
        assertEquals(12, ranges.get(1).line);
        assertEquals(1, ranges.get(1).column);
        assertEquals(22, ranges.get(2).line);
    }

    public void testSameLine() {
        String text = "HOA: v1 States: 0 HOA: v1";
        List<Documents.Range> ranges = split(text);
        assertEquals(2, ranges.size());
        assertEquals("HOA: v1 States: 0 ", textOf(ranges.get(0)));
        assertEquals(1, ranges.get(1).line);
        assertEquals(19, ranges.get(1).column);
    }

    public void testTokensAfterRangeStart() {
        // tokens of the second document start counting where it begins
        String text = MINIMAL + MINIMAL;
        Documents.Range second = split(text).get(1);
        Token first = second.lexer().iterator().next();
        assertEquals(11, first.line());
        assertEquals(1, first.column());
        assertEquals(MINIMAL.length(), first.offset);
    }

    public void testResyncAfterLexError() {
        String broken = "HOA: v1\nStates: #\n/* HOA: v1 */\n";
        String text = broken + MINIMAL;
        List<Documents.Range> ranges = split(text);
        assertEquals(2, ranges.size());
        assertEquals(broken, textOf(ranges.get(0)));
        assertEquals(MINIMAL, textOf(ranges.get(1)));
        assertEquals(4, ranges.get(1).line);
    }

    public void testLexErrorWithoutRecovery() {
        String text = "HOA: v1\nStates: #\n  HOA: v1\n";
        List<Documents.Range> ranges = split(text);
        assertEquals(1, ranges.size());
        assertEquals(text, textOf(ranges.get(0)));
    }

    public void testResync() {
        Documents d = new Documents("x\nHOA:\r\nHOA: HOA:");
        assertEquals(2, d.resync(0));
        assertEquals(2, d.resync(2));
        assertEquals(8, d.resync(3));
        assertEquals(17, d.resync(9));
    }

    public void testLazy() {
        // the broken tail is only looked at when asked for
        String text = MINIMAL + "HOA: v1 \"";
        java.util.Iterator<Documents.Range> it = new Documents(text).iterator();
        assertTrue(it.hasNext());
        assertEquals(MINIMAL, textOf(it.next()));
        assertTrue(it.hasNext());
        assertEquals("HOA: v1 \"", textOf(it.next()));
        assertFalse(it.hasNext());
    }
}
