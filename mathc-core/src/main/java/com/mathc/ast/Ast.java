package com.mathc.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only arena of {@link AstNode}s plus the handle of the root node.
 *
 * <p>Children are always appended before their parent, so every handle a node
 * refers to has a smaller index than the node itself. The arena can therefore
 * be read front to back as a post-order listing of the tree, and it cannot
 * contain cycles. Nodes are never updated or removed.</p>
 *
 * <p>An {@code Ast} is not thread-safe while it is being built. Once the root
 * has been set it is only read.</p>
 */
public final class Ast {

    private final List<AstNode> nodes;
    private NodeId root = NodeId.NONE;

    public Ast() {
        this.nodes = new ArrayList<>();
    }

    public Ast(int initialCapacity) {
        this.nodes = new ArrayList<>(initialCapacity);
    }

    // ========================================================================
    // Construction
    // ========================================================================

    public NodeId addConstant(ConstantKind kind, int position) {
        return append(new Constant(position, kind));
    }

    public NodeId addReal(double value, int position) {
        return append(new Real(position, value));
    }

    /**
     * Appends a rational, reduced to lowest terms.
     *
     * @throws IllegalArgumentException if {@code denominator} is zero
     */
    public NodeId addRational(long numerator, long denominator, int position) {
        return append(Rational.of(position, numerator, denominator));
    }

    public NodeId addIdentifier(String name, int position) {
        return append(new Identifier(position, name));
    }

    public NodeId addBinaryOp(BinaryOpKind kind, NodeId left, NodeId right, int position) {
        requireChild(left, "left operand");
        requireChild(right, "right operand");
        return append(new BinaryOp(position, kind, left, right));
    }

    public NodeId addUnaryOp(UnaryOpKind kind, NodeId inner, int position) {
        requireChild(inner, "operand");
        return append(new UnaryOp(position, kind, inner));
    }

    public NodeId addCall(FunctionKind function, List<NodeId> arguments, int position) {
        for (NodeId argument : arguments) {
            requireChild(argument, "argument");
        }
        return append(new Call(position, function, arguments));
    }

    /**
     * Marks the root of the tree. Can only be called once.
     */
    public void setRoot(NodeId root) {
        if (!this.root.isNone()) {
            throw new IllegalStateException("Root already set to " + this.root);
        }
        requireChild(root, "root");
        this.root = root;
    }

    private NodeId append(AstNode node) {
        nodes.add(node);
        return new NodeId(nodes.size() - 1);
    }

    // A child must already be in this arena; anything else would break the ordering invariant
    private void requireChild(NodeId id, String role) {
        if (id == null || id.isNone()) {
            throw new IllegalArgumentException("Missing " + role);
        }
        if (id.index() >= nodes.size()) {
            throw new IllegalArgumentException(
                "Unknown " + role + " " + id + " (arena holds " + nodes.size() + " nodes)");
        }
    }

    // ========================================================================
    // Lookup
    // ========================================================================

    /**
     * @throws IndexOutOfBoundsException for {@link NodeId#NONE} or a handle
     *         that this arena never produced
     */
    public AstNode at(NodeId id) {
        if (id.isNone()) {
            throw new IndexOutOfBoundsException("Cannot look up " + id);
        }
        return nodes.get(id.index());
    }

    public NodeId root() {
        return root;
    }

    public AstNode rootNode() {
        return at(root);
    }

    public int size() {
        return nodes.size();
    }

    public List<AstNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public <R> R accept(NodeId id, AstVisitor<R> visitor) {
        return at(id).accept(visitor);
    }

    @Override
    public String toString() {
        return "Ast[root=" + root + ", nodes=" + nodes + "]";
    }
}
