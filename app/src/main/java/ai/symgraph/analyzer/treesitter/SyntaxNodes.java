package ai.symgraph.analyzer.treesitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Traversal helpers shared by the language extractors. */
public final class SyntaxNodes {
    private SyntaxNodes() {}

    public static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    /** Recursively finds the first node matching the given predicate, in document order. */
    public static @Nullable TSNode findNodeRecursive(@Nullable TSNode rootNode, Predicate<TSNode> predicate) {
        if (!isPresent(rootNode)) {
            return null;
        }
        if (predicate.test(rootNode)) {
            return rootNode;
        }
        for (int i = 0; i < rootNode.getChildCount(); i++) {
            var result = findNodeRecursive(rootNode.getChild(i), predicate);
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    /** Recursively finds all nodes matching the given predicate, in document order. */
    public static List<TSNode> findAllNodesRecursive(TSNode rootNode, Predicate<TSNode> predicate) {
        var results = new ArrayList<TSNode>();
        findAllNodesRecursiveInternal(rootNode, predicate, results);
        return results;
    }

    private static void findAllNodesRecursiveInternal(
            @Nullable TSNode node, Predicate<TSNode> predicate, List<TSNode> results) {
        if (!isPresent(node)) {
            return;
        }
        if (predicate.test(node)) {
            results.add(node);
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            findAllNodesRecursiveInternal(node.getChild(i), predicate, results);
        }
    }

    public static List<TSNode> findAllNodesByType(TSNode rootNode, String nodeType) {
        return findAllNodesRecursive(rootNode, node -> nodeType.equals(node.getType()));
    }

    /** All direct children, named and anonymous. */
    public static List<TSNode> children(@Nullable TSNode node) {
        if (!isPresent(node)) {
            return Collections.emptyList();
        }
        var out = new ArrayList<TSNode>(node.getChildCount());
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (isPresent(child)) {
                out.add(child);
            }
        }
        return out;
    }

    public static List<TSNode> namedChildren(@Nullable TSNode node) {
        if (!isPresent(node)) {
            return Collections.emptyList();
        }
        var out = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (isPresent(child)) {
                out.add(child);
            }
        }
        return out;
    }

    public static List<TSNode> childrenOfType(@Nullable TSNode node, Set<String> types) {
        var out = new ArrayList<TSNode>();
        for (var child : children(node)) {
            if (types.contains(child.getType())) {
                out.add(child);
            }
        }
        return out;
    }

    public static @Nullable TSNode firstChildOfType(@Nullable TSNode node, String... types) {
        for (var child : children(node)) {
            for (var type : types) {
                if (type.equals(child.getType())) {
                    return child;
                }
            }
        }
        return null;
    }

    public static boolean hasChildOfType(@Nullable TSNode node, String type) {
        return firstChildOfType(node, type) != null;
    }

    /** The child stored under {@code field}, or null when the grammar did not produce one. */
    public static @Nullable TSNode field(@Nullable TSNode node, String field) {
        if (!isPresent(node)) {
            return null;
        }
        var child = node.getChildByFieldName(field);
        return isPresent(child) ? child : null;
    }

    /** Nearest ancestor (excluding {@code node}) whose type is in {@code types}. */
    public static @Nullable TSNode ancestorOfType(TSNode node, Set<String> types) {
        var current = node.getParent();
        while (isPresent(current)) {
            if (types.contains(current.getType())) {
                return current;
            }
            current = current.getParent();
        }
        return null;
    }

    /** All ancestors from the parent up to the root whose type is in {@code types}, nearest first. */
    public static List<TSNode> ancestorsOfType(TSNode node, Set<String> types) {
        var out = new ArrayList<TSNode>();
        var current = node.getParent();
        while (isPresent(current)) {
            if (types.contains(current.getType())) {
                out.add(current);
            }
            current = current.getParent();
        }
        return out;
    }

    public static boolean hasAncestorOfType(TSNode node, Set<String> types) {
        return ancestorOfType(node, types) != null;
    }

    /**
     * The contiguous run of comment siblings immediately before {@code node}, in source order. Stops at the first
     * sibling that is not a comment.
     */
    public static List<TSNode> precedingComments(TSNode node, Predicate<TSNode> isComment) {
        return precedingComments(node, isComment, Set.of());
    }

    /**
     * Like {@link #precedingComments(TSNode, Predicate)}, but a preceding sibling whose type is in {@code containers}
     * does not end the run: its trailing children are scanned as well. Grammars that attach a comment to the end of a
     * header node (Kotlin's {@code package_header} and {@code import_list}) need this to find the comment that
     * documents the next declaration.
     */
    public static List<TSNode> precedingComments(TSNode node, Predicate<TSNode> isComment, Set<String> containers) {
        var comments = new ArrayList<TSNode>();
        var current = node.getPrevSibling();
        while (isPresent(current)) {
            if (isComment.test(current)) {
                comments.add(current);
                current = current.getPrevSibling();
            } else if (containers.contains(current.getType())) {
                var kids = children(current);
                if (kids.isEmpty()) {
                    break;
                }
                current = kids.get(kids.size() - 1);
            } else {
                break;
            }
        }
        Collections.reverse(comments);
        return comments;
    }

    public static boolean sameNode(@Nullable TSNode a, @Nullable TSNode b) {
        if (!isPresent(a) || !isPresent(b)) {
            return false;
        }
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }
}
