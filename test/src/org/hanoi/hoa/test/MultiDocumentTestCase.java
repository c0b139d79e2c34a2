/* @LICENSE@
 */

package org.hanoi.hoa.test;

import static org.hanoi.hoa.HoaAssert.assertInvalid;
import static org.hanoi.hoa.HoaAssert.assertPosition;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.hanoi.hoa.AbstractHoaTestCase;
import org.hanoi.hoa.Automaton;
import org.hanoi.hoa.InvalidAutomatonException;
import org.hanoi.hoa.ParseResult;
import org.hanoi.hoa.Problem;

public class MultiDocumentTestCase extends AbstractHoaTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(MultiDocumentTestCase.class);
    }

    public MultiDocumentTestCase(String name) {
        super(name);
    }

    private static List<ParseResult> all(CharSequence text) {
        List<ParseResult> ret = new ArrayList<ParseResult>();
        for (ParseResult r : Automaton.parseAll(text)) {
            ret.add(r);
        }
        return ret;
    }

    /*
     * checks the results of several.hoa
     */
    private static void checkSeveral(List<ParseResult> results) {
        assertEquals(5, results.size());

        ParseResult r = results.get(0);
        assertTrue(r.isValid());
        assertTrue(r.report().isEmpty());
        assertEquals(1, r.line());
        assertEquals(1, r.automaton().numStates());

        r = results.get(1);
        assertFalse(r.isValid());
        assertEquals(10, r.line());
        assertEquals(Problem.Kind.RANGE_VIOLATION, r.report().first().kind());
        assertPosition(r.report().first(), 16, 1);

        r = results.get(2);
        assertEquals(18, r.line());
        assertEquals(Problem.Kind.ABORTED, r.report().first().kind());
        assertPosition(r.report().first(), 20, 1);

        r = results.get(3);
        assertEquals(21, r.line());
        assertEquals(Problem.Kind.UNEXPECTED_CHAR, r.report().first().kind());
        assertPosition(r.report().first(), 22, 11);

        r = results.get(4);
        assertTrue(r.isValid());
        assertEquals(23, r.line());
        assertEquals(Automaton.parse(MINIMAL.replace("State: 0\n[0] 0 {0}\n[!0] 0",
            "State: 0 {0}\n[0] 0\n[!0] 0")), r.automaton());
    }

    public void testRecovery() {
        checkSeveral(all(fixture("several.hoa")));
    }

    public void testInvalidResult() {
        ParseResult r = all(fixture("several.hoa")).get(1);
        try {
            r.automaton();
            fail();
        } catch (InvalidAutomatonException e) {
            assertSame(r.report(), e.report());
        }
        assertTrue(r.toString().startsWith("invalid automaton at line 10: 16:1:"));
    }

    public void testSingleDocumentOnly() {
        Problem p = assertInvalid(fixture("several.hoa"), Problem.Kind.UNEXPECTED_TOKEN);
        assertPosition(p, 10, 1);
    }

    public void testEmptyInput() {
        assertTrue(all("").isEmpty());
        assertTrue(all("\n  /* nothing here */\n").isEmpty());
    }

    public void testLazy() {
        // a lexical error in the second document is only seen when it is read
        Iterator<ParseResult> it = Automaton.parseAll(MINIMAL + "HOA: v1 \"").iterator();
        assertTrue(it.next().isValid());
        ParseResult broken = it.next();
        assertEquals(Problem.Kind.UNTERMINATED_STRING, broken.report().first().kind());
        assertFalse(it.hasNext());
    }

    public void testRestartable() {
        Iterable<ParseResult> results = Automaton.parseAll(MINIMAL + MINIMAL);
        int n = 0;
        for (ParseResult r : results) {
            assertTrue(r.isValid());
            ++n;
        }
        for (ParseResult r : results) {
            assertTrue(r.isValid());
            ++n;
        }
        assertEquals(4, n);
    }

    public void testFlagsApplyToEveryDocument() {
        String v2 = MINIMAL.replace("v1", "v2");
        List<ParseResult> results = new ArrayList<ParseResult>();
        for (ParseResult r : Automaton.parseAll(MINIMAL + v2, Automaton.STRICT_VERSION)) {
            results.add(r);
        }
        assertTrue(results.get(0).isValid());
        assertEquals(Problem.Kind.UNSUPPORTED_VERSION, results.get(1).report().first().kind());
    }

    public void testExecutor() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            checkSeveral(Automaton.parseAll(fixture("several.hoa"), executor));

            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 100; ++i) {
                sb.append(MINIMAL.replace("\"a\"", quote("a" + i)));
            }
            List<ParseResult> results = Automaton.parseAll(sb, executor);
            assertEquals(100, results.size());
            for (int i = 0; i < results.size(); ++i) {
                ParseResult r = results.get(i);
                assertEquals("a" + i, r.automaton().header().aps().get(0));
                assertEquals(1 + 10 * i, r.line());
            }
        } finally {
            executor.shutdown();
        }
    }

    private static String deeplyNested() {
        StringBuilder sb = new StringBuilder(MINIMAL.substring(0, MINIMAL.indexOf("[0]")));
        sb.append('[');
        for (int i = 0; i < 200000; ++i) {
            sb.append('(');
        }
        sb.append('0');
        for (int i = 0; i < 200000; ++i) {
            sb.append(')');
        }
        sb.append("] 0\n--END--\n");
        return sb.toString();
    }

    public void testDeepNestingDoesNotStopReading() throws Exception {
        String text = deeplyNested() + MINIMAL;
        List<ParseResult> results = all(text);
        assertEquals(2, results.size());
        assertEquals(Problem.Kind.MALFORMED_FORMULA, results.get(0).report().first().kind());
        assertTrue(results.get(1).isValid());

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            results = Automaton.parseAll(text, executor);
            assertEquals(Problem.Kind.MALFORMED_FORMULA, results.get(0).report().first().kind());
            assertTrue(results.get(1).isValid());
        } finally {
            executor.shutdown();
        }
    }

    public void testInterruptCancelsPendingDocuments() {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<Runnable>());
        final CountDownLatch release = new CountDownLatch(1);
        try {
            // keeps the only worker busy, so the documents stay queued
            executor.execute(new Runnable() {
                public void run() {
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            });
            Thread.currentThread().interrupt();
            try {
                Automaton.parseAll(MINIMAL + MINIMAL, executor);
                fail();
            } catch (InterruptedException e) {
                // expected
            }
            assertEquals(2, executor.getQueue().size());
            for (Runnable r : executor.getQueue()) {
                assertTrue(((Future<?>) r).isCancelled());
            }
        } finally {
            Thread.interrupted();
            release.countDown();
            executor.shutdown();
        }
    }
}
