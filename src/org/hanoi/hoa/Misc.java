/*
 * @LICENSE@
 */

package org.hanoi.hoa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    /*
     * So many iterators don't suport remove()
     */
    public static abstract class ImmutableIterator<E> implements Iterator<E> {
        public final void remove() {
            throw new UnsupportedOperationException("sorry!");
        }
    }

    /**
     * An iterator which can hand back the element most recently returned by
     * {@link #next()}; a single element of lookahead is all the HOA grammar
     * needs.
     */
    interface PushbackIterator<E> extends Iterator<E> {
        void pushback();
    }

    static final class FlagMgr {

        private List<String> labels = new ArrayList<String>(4);
        private int defined = 0;
        private Integer implemented = null;
        boolean frozen = false;

        private boolean contains(int f, int g) {
            return (g | f) == f;
        }

        int next(String label) {
            if (frozen)
                throw new IllegalStateException("frozen FlagGen");
            labels.add(label);
            int flag = 1 << (labels.size() - 1);
            defined |= flag;
            return flag;
        };

        int freezeAndCount() {
            frozen = true;
            return labels.size();
        }

        FlagMgr setImplemented(int implemented) {
            if (!contains(defined, implemented)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (implemented & ~defined));
            }
            this.implemented = implemented;
            return this;
        }

        void check(int flags) {
            if (!contains(defined, flags)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (flags & ~defined));
            } else if (!contains(implemented, flags)) {
                throw new IllegalArgumentException(
                    "unimplemented flags: " + stringFrom(flags & ~implemented));
            }
        }

        String stringFrom(int flags) {
            assert (((1 << freezeAndCount()) - 1) | flags) == ((1 << freezeAndCount()) - 1);
            StringBuilder sb = new StringBuilder();
            int n = 0;
            while (flags != 0) {
                for (; (flags & 1) == 0; flags >>= 1, ++n)
                    ;
                sb.append(sb.length() == 0 ? "" : ", ").append(labels.get(n));
                flags &= ~1;
            }
            return sb.toString();
        }
    };

    static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        public boolean esc(StringBuilder sb, int c) {
            boolean ret = (c == (char) c) ? map.containsKey((char) c) : false;
            if (ret)
                sb.append(map.get((char) c));
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }
    }

    private static final MapEscaper hoaEscaper =
            new MapEscaper().map('\\', "\\\\").map('"', "\\\"");
    private static final MapEscaper ctlEscaper =
            new MapEscaper().map('\r', "\\r").map('\n', "\\n").map('\t', "\\t");

    /**
     * Singleton objects which create Strings where certain characters are
     * replaced by escape sequences.
     */
    enum Esc {

        /**
         * HOA string escaper - escapes " and \ only; everything else is
         * legal inside a HOA string.
         */
        HOA(hoaEscaper),
        /**
         * Diagnostic escaper - as HOA, plus line breaks and tabs, so that a
         * token always shows up on one line of an error message.
         */
        DIAG(hoaEscaper, ctlEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.append((char) c);
        }

        void esc(StringBuilder sb, CharSequence cs) {
            for (int i = 0; i < cs.length(); ++i) {
                esc(sb, cs.charAt(i));
            }
        }

        String esc(CharSequence cs) {
            StringBuilder sb = new StringBuilder();
            esc(sb, cs);
            return sb.toString();
        }

        /**
         * @return <code>cs</code> escaped and wrapped in double quotes.
         */
        String quote(CharSequence cs) {
            StringBuilder sb = new StringBuilder().append('"');
            esc(sb, cs);
            return sb.append('"').toString();
        }
    }

    static final class TSidentitySetDeque<E> /* implements Deque<E> */ {

        int ts = 0;
        final Map<E, Integer> map = new IdentityHashMap<E, Integer>();
        final LinkedList<E> list = new LinkedList<E>();

        public boolean offerFirst(E e) {
            if (!map.containsKey(e)) {
                map.put(e, ts++);
                list.addFirst(e);
                return true;
            }
            return false;
        }
        public E removeFirst() {
            if (isEmpty()) throw new NoSuchElementException();
            E e = list.removeFirst();
            assert map.containsKey(e);
            map.remove(e);
            return e;
        }
        public E peekFirst() {
            assert map.containsKey(list.getFirst());
            return list.getFirst();
        }

        public int tsFirst() {
            E e = list.getFirst();
            return map.get(e);
        }

        public boolean contains(Object e) {
            assert map.containsKey(e) == list.contains(e);
            return map.containsKey(e);
        }
        public void clear() {
            map.clear(); list.clear(); ts = 0;
        }
        public boolean isEmpty() {
            assert map.isEmpty() == list.isEmpty();
            return map.isEmpty();
        }
        @Override
        public String toString() {
            return list.toString();
        }
    }

    /*
     * Generic digraph visitors
     */
    private interface SimpleVertex {
        Iterable<? extends SimpleEdge> edges();
    }
    private interface SimpleEdge {
        SimpleVertex vertex();
    }
    interface Vertex<E extends SimpleEdge> extends SimpleVertex {
        Iterable<E> edges();
    }
    interface Edge<V extends SimpleVertex> extends SimpleEdge {
         V vertex();
    }

    static abstract class DepthFirstVisitor<V extends Vertex<E>, E extends Edge<V>> {

        private Map<V, Integer> black = new IdentityHashMap<V, Integer>();
        private TSidentitySetDeque<V> gray = new TSidentitySetDeque<V>();
        private LinkedList<Iterator<E>> eiDeq = new LinkedList<Iterator<E>>();

        public final DepthFirstVisitor<V, E> start(Iterable<V> inits) {
            black.clear(); gray.clear(); eiDeq.clear();
            for (V init : inits) if (!black.containsKey(init)) visitFrom(init);
            return this;
        }

        private void visitFrom(V init) {

            V vertex;
            E edge;
            Iterator<E> ei;
            boolean tree, back, a;
            int ts;

            gray.offerFirst(init);
            eiDeq.addFirst(init.edges().iterator());
            while (!eiDeq.isEmpty()) {
                if ((ei = eiDeq.getFirst()).hasNext()) {
                    edge = ei.next();
                    tree = !black.containsKey(edge.vertex())
                         & !(back = gray.contains(edge.vertex()));
                    if (visit(edge, tree, back) && tree) {
                        gray.offerFirst(edge.vertex());
                        eiDeq.addFirst(edge.vertex().edges().iterator());
                    }
                } else {
                    eiDeq.removeFirst();
                    ts = gray.tsFirst();
                    a = black.put(vertex = gray.removeFirst(), ts) == null;
                    assert a;
                    visit(vertex);
                }
            }
            assert  gray.isEmpty() : gray;
        }

        /*
         * tree, back, and forward-or-cross ((!tree && !back) is "free"...
         * ... distinguishing forward from cross costs another method invocation
         */
        protected boolean visit(E edge, boolean tree, boolean back) {
            return true;
        }
        protected void visit(V vertex) {}

        protected final V current() {
            return gray.peekFirst();
        }

        /**
         * @return the vertices currently in progress, from the vertex the
         *         walk started at down to {@link #current()}.
         */
        protected final List<V> path() {
            List<V> ret = new ArrayList<V>(gray.list);
            Collections.reverse(ret);
            return ret;
        }
    }
}
