package org.pragmatica.scss.tree;

import org.pragmatica.scss.error.Diagnostic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Parse-tree node - error-tolerant concrete representation of a style sheet construct.
 *
 * <p>A node owns its children exclusively. Named roles ({@link Role}) are views into the same
 * children. The range {@code [offset, offset + length)} only grows while children are added and is
 * fixed by the parser when the producing rule finishes. A node with diagnostics is still structurally
 * complete and walkable.
 */
public final class Node {
    private static final int UNSET = -1;

    private NodeType type;
    private int offset;
    private int length;
    private Node parent;
    private boolean detachedList;
    private final List<Node> children = new ArrayList<>();
    private final Map<Role, Node> roles = new EnumMap<>(Role.class);
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private final Set<ReferenceType> referenceTypes = EnumSet.noneOf(ReferenceType.class);
    private boolean customProperty;
    private int colonPosition = UNSET;
    private int semicolonPosition = UNSET;

    private Node(NodeType type, int offset, int length) {
        this.type = type;
        this.offset = offset;
        this.length = length;
    }

    public static Node create(NodeType type, int offset, int length) {
        return new Node(type, offset, length);
    }

    // === Structure ===

    public NodeType type() {
        return type;
    }

    /**
     * Re-tag the node, for rules that learn their exact category after consuming tokens
     * (e.g. {@code >} vs {@code >>>} combinators).
     */
    public void setType(NodeType type) {
        this.type = type;
    }

    public int offset() {
        return offset;
    }

    public int length() {
        return length;
    }

    public int end() {
        return offset + length;
    }

    public SourceSpan span() {
        return new SourceSpan(Math.max(offset, 0), length);
    }

    /**
     * Fix the end of the node. Used by the parser when the producing rule finishes.
     */
    public void setLength(int length) {
        this.length = Math.max(length, 0);
    }

    public Optional<Node> parent() {
        return Optional.ofNullable(parent);
    }

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Append a child. Passing {@code null} is a no-op returning {@code false}, so callers can write
     * {@code node.addChild(parseSomething())} as a combinator.
     */
    public boolean addChild(Node node) {
        if (node == null) {
            return false;
        }
        adopt(node);
        attachPendingList();
        return true;
    }

    /**
     * Record {@code node} under the given role, appending it as a child unless it already is a
     * descendant.
     *
     * @return whether a non-null node was supplied
     */
    public boolean set(Role role, Node node) {
        if (node == null) {
            return false;
        }
        if (!node.isDescendantOf(this)) {
            adopt(node);
        }
        roles.put(role, node);
        return true;
    }

    public Optional<Node> get(Role role) {
        return Optional.ofNullable(roles.get(role));
    }

    /**
     * The list node behind a list role, created on first access. An empty list is not a child;
     * it joins the children when its first element is added.
     */
    public Node list(Role role) {
        var existing = roles.get(role);
        if (existing != null) {
            return existing;
        }
        var list = new Node(NodeType.NODE_LIST, UNSET, 0);
        list.parent = this;
        list.detachedList = true;
        roles.put(role, list);
        return list;
    }

    public boolean setIdentifier(Node node) {
        return set(Role.IDENTIFIER, node);
    }

    public boolean setValue(Node node) {
        return set(Role.VALUE, node);
    }

    public boolean setVariable(Node node) {
        return set(Role.VARIABLE, node);
    }

    public boolean setCondition(Node node) {
        return set(Role.CONDITION, node);
    }

    public Optional<Node> identifier() {
        return get(Role.IDENTIFIER);
    }

    public Optional<Node> value() {
        return get(Role.VALUE);
    }

    /**
     * Elements of a list role; empty when the list was never populated.
     */
    public List<Node> elements(Role role) {
        return get(role).map(Node::children)
                        .orElse(List.of());
    }

    private void adopt(Node node) {
        if (node.parent != this) {
            if (node.parent != null) {
                node.parent.detach(node);
            }
            node.parent = this;
            node.detachedList = false;
            children.add(node);
        } else if (node.detachedList) {
            node.detachedList = false;
            children.add(node);
        }
        extendTo(node);
    }

    private void detach(Node node) {
        children.remove(node);
        roles.values()
             .removeIf(child -> child == node);
    }

    private void attachPendingList() {
        if (detachedList) {
            detachedList = false;
            parent.children.add(this);
        }
    }

    private void extendTo(Node node) {
        if (node.offset == UNSET) {
            return;
        }
        if (offset == UNSET || node.offset < offset) {
            if (offset != UNSET) {
                length += offset - node.offset;
            }
            offset = node.offset;
        }
        if (node.end() > end()) {
            length = node.end() - offset;
        }
    }

    private boolean isDescendantOf(Node ancestor) {
        for (var current = parent; current != null; current = current.parent) {
            if (current == ancestor) {
                return true;
            }
        }
        return false;
    }

    // === Diagnostics ===

    public void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean isErroneous() {
        return !diagnostics.isEmpty();
    }

    /**
     * Diagnostics of this node and all descendants, in source order.
     */
    public List<Diagnostic> collectDiagnostics() {
        var result = new ArrayList<Diagnostic>();
        walk(node -> {
            result.addAll(node.diagnostics);
            return true;
        });
        result.sort((a, b) -> Integer.compare(a.span().offset(), b.span().offset()));
        return List.copyOf(result);
    }

    // === Editor metadata ===

    public Set<ReferenceType> referenceTypes() {
        return Collections.unmodifiableSet(referenceTypes);
    }

    public void setReferenceTypes(Set<ReferenceType> types) {
        referenceTypes.clear();
        referenceTypes.addAll(types);
    }

    public boolean isCustomProperty() {
        return customProperty;
    }

    public void setCustomProperty(boolean customProperty) {
        this.customProperty = customProperty;
    }

    /**
     * Offset of the colon separating name and value, or -1.
     */
    public int colonPosition() {
        return colonPosition;
    }

    public void setColonPosition(int colonPosition) {
        this.colonPosition = colonPosition;
    }

    /**
     * Offset of the terminating semicolon, or -1. The semicolon is not part of the node.
     */
    public int semicolonPosition() {
        return semicolonPosition;
    }

    public void setSemicolonPosition(int semicolonPosition) {
        this.semicolonPosition = semicolonPosition;
    }

    // === Traversal ===

    /**
     * Depth-first pre-order walk. Returning {@code false} from the visitor skips the node's children.
     */
    public void walk(Predicate<Node> visitor) {
        var pending = new ArrayDeque<Node>();
        pending.push(this);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (visitor.test(node)) {
                for (var i = node.children.size() - 1; i >= 0; i--) {
                    pending.push(node.children.get(i));
                }
            }
        }
    }

    /**
     * The deepest node whose range contains the given offset.
     */
    public Optional<Node> nodeAt(int position) {
        if (!covers(position)) {
            return Optional.empty();
        }
        var found = this;
        var descend = true;
        while (descend) {
            descend = false;
            for (var child : found.children) {
                if (child.covers(position)) {
                    found = child;
                    descend = true;
                    break;
                }
            }
        }
        return Optional.of(found);
    }

    private boolean covers(int position) {
        return position >= offset && position < end();
    }

    public String text(String source) {
        return span().extract(source);
    }

    @Override
    public String toString() {
        return type + "[" + span() + "]";
    }
}
