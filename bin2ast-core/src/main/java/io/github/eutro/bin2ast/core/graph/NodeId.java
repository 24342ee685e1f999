package io.github.eutro.bin2ast.core.graph;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Identifies a node in a {@link FlowGraph}.
 * <p>
 * A node is one of:
 * <ul>
 *     <li>{@link Real}: the address of a block in the analysed binary;</li>
 *     <li>{@link Inlined}: the address of a block inside a call that was inlined at some call site;</li>
 *     <li>{@link Phantom}: a synthetic node, such as the single exit added by
 *     {@link FlowGraph#inverseWithPhantomExitNode()}.</li>
 * </ul>
 * <p>
 * Node ids are totally ordered: every {@link Real} node sorts before every {@link Inlined} node,
 * which sorts before every {@link Phantom} node. Within one variant, nodes are ordered by their
 * numeric fields.
 */
public abstract class NodeId implements Comparable<NodeId> {
    private NodeId() {
    }

    /**
     * Create a node id for a block address.
     *
     * @param address The address.
     * @return The node id.
     */
    public static Real real(long address) {
        return new Real(address);
    }

    /**
     * Create a node id for a block address inside an inlined call.
     *
     * @param callSite The address of the call that was inlined.
     * @param address  The address of the block in the callee.
     * @return The node id.
     */
    public static Inlined inlined(long callSite, long address) {
        return new Inlined(callSite, address);
    }

    /**
     * Create a synthetic node id.
     *
     * @param index The index of the node.
     * @return The node id.
     */
    public static Phantom phantom(int index) {
        return new Phantom(index);
    }

    /**
     * Parse a node id from its {@link #toString() string form}.
     * <p>
     * The accepted forms are {@code 0x1c4} for real nodes, {@code F_0x10_0x20} for
     * inlined nodes (call site first), and {@code __3} for phantom nodes.
     *
     * @param s The string.
     * @return The node id.
     * @throws IllegalArgumentException If the string is not a node id.
     */
    public static NodeId parse(String s) {
        try {
            if (s.startsWith("__")) {
                return phantom(Integer.parseInt(s.substring(2)));
            }
            if (s.startsWith("F_")) {
                int sep = s.indexOf('_', 2);
                if (sep < 0) throw new IllegalArgumentException("Malformed inlined node id: " + s);
                return inlined(parseAddress(s.substring(2, sep)), parseAddress(s.substring(sep + 1)));
            }
            return real(parseAddress(s));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed node id: " + s, e);
        }
    }

    private static long parseAddress(String s) {
        if (s.startsWith("0x") || s.startsWith("0X")) {
            return Long.parseUnsignedLong(s.substring(2), 16);
        }
        return Long.parseUnsignedLong(s);
    }

    private static String formatAddress(long address) {
        return "0x" + Long.toHexString(address);
    }

    /**
     * Get the address of the block this node stands for.
     *
     * @return The address.
     * @throws UnsupportedOperationException If this is a {@link Phantom} node.
     */
    public abstract long address();

    /**
     * Get whether this node is synthetic.
     *
     * @return Whether this is a {@link Phantom} node.
     */
    public boolean isPhantom() {
        return false;
    }

    abstract int variant();

    abstract int compareSameVariant(NodeId o);

    @Override
    public int compareTo(@NotNull NodeId o) {
        int c = Integer.compare(variant(), o.variant());
        return c != 0 ? c : compareSameVariant(o);
    }

    /**
     * A block in the analysed binary.
     */
    public static final class Real extends NodeId {
        private final long address;

        private Real(long address) {
            this.address = address;
        }

        @Override
        public long address() {
            return address;
        }

        @Override
        int variant() {
            return 0;
        }

        @Override
        int compareSameVariant(NodeId o) {
            return Long.compareUnsigned(address, ((Real) o).address);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Real && ((Real) o).address == address;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(address);
        }

        @Override
        public String toString() {
            return formatAddress(address);
        }
    }

    /**
     * A block inside a call that was inlined into the function.
     */
    public static final class Inlined extends NodeId {
        private final long callSite;
        private final long address;

        private Inlined(long callSite, long address) {
            this.callSite = callSite;
            this.address = address;
        }

        /**
         * Get the address of the inlined call.
         *
         * @return The call site.
         */
        public long callSite() {
            return callSite;
        }

        @Override
        public long address() {
            return address;
        }

        @Override
        int variant() {
            return 1;
        }

        @Override
        int compareSameVariant(NodeId o) {
            Inlined that = (Inlined) o;
            int c = Long.compareUnsigned(callSite, that.callSite);
            return c != 0 ? c : Long.compareUnsigned(address, that.address);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Inlined)) return false;
            Inlined that = (Inlined) o;
            return callSite == that.callSite && address == that.address;
        }

        @Override
        public int hashCode() {
            return Objects.hash(callSite, address);
        }

        @Override
        public String toString() {
            return "F_" + formatAddress(callSite) + "_" + formatAddress(address);
        }
    }

    /**
     * A synthetic node with no counterpart in the binary.
     */
    public static final class Phantom extends NodeId {
        private final int index;

        private Phantom(int index) {
            this.index = index;
        }

        /**
         * Get the index of this node.
         *
         * @return The index.
         */
        public int index() {
            return index;
        }

        @Override
        public long address() {
            throw new UnsupportedOperationException("phantom node " + this + " has no address");
        }

        @Override
        public boolean isPhantom() {
            return true;
        }

        @Override
        int variant() {
            return 2;
        }

        @Override
        int compareSameVariant(NodeId o) {
            return Integer.compare(index, ((Phantom) o).index);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Phantom && ((Phantom) o).index == index;
        }

        @Override
        public int hashCode() {
            return 31 * index + 7;
        }

        @Override
        public String toString() {
            return "__" + index;
        }
    }
}
