package ai.symgraph.analyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * A declared entity extracted from a source file.
 *
 * <p>Children (fields, methods, enum cases, protocol requirements) are owned exclusively by their parent: a symbol can
 * be attached to at most one parent, and a symbol with a parent never appears in a file's top-level sequence.
 *
 * <p>The {@link NodeRef} is a handle into the tree of the file being extracted and is only used while that tree is
 * alive; it takes no part in equality.
 */
public final class ParsedSymbol {
    private final String name;
    private final String kind;
    private final String signature;
    private final ParsedSpan span;
    private final @Nullable String docstring;
    private final @Nullable NodeRef node;
    private final List<ParsedSymbol> children = new ArrayList<>();
    private @Nullable ParsedSymbol parent;

    public ParsedSymbol(
            String name,
            String kind,
            String signature,
            ParsedSpan span,
            @Nullable String docstring,
            @Nullable NodeRef node) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.signature = Objects.requireNonNull(signature, "signature");
        this.span = Objects.requireNonNull(span, "span");
        this.docstring = docstring == null || docstring.isBlank() ? null : docstring;
        this.node = node;
    }

    public String name() {
        return name;
    }

    public String kind() {
        return kind;
    }

    public String signature() {
        return signature;
    }

    public ParsedSpan span() {
        return span;
    }

    public Optional<String> docstring() {
        return Optional.ofNullable(docstring);
    }

    public @Nullable NodeRef node() {
        return node;
    }

    public List<ParsedSymbol> children() {
        return Collections.unmodifiableList(children);
    }

    public Optional<ParsedSymbol> parent() {
        return Optional.ofNullable(parent);
    }

    public boolean hasParent() {
        return parent != null;
    }

    /**
     * Attaches {@code child} as the last child of this symbol.
     *
     * @throws IllegalArgumentException if the child already belongs to a parent, or is this symbol itself
     */
    public ParsedSymbol addChild(ParsedSymbol child) {
        if (child == this) {
            throw new IllegalArgumentException("A symbol cannot be its own child: " + name);
        }
        if (child.parent != null) {
            throw new IllegalArgumentException(
                    "Symbol " + child.name + " is already a child of " + child.parent.name);
        }
        child.parent = this;
        children.add(child);
        return this;
    }

    /** Depth-first, pre-order: this symbol, then each child subtree. */
    public List<ParsedSymbol> flatten() {
        var out = new ArrayList<ParsedSymbol>();
        collect(this, out);
        return out;
    }

    private static void collect(ParsedSymbol symbol, List<ParsedSymbol> out) {
        out.add(symbol);
        for (var child : symbol.children) {
            collect(child, out);
        }
    }

    /** Unqualified trailing segment of the name, e.g. {@code bar} for {@code com.foo.Bar.bar} or {@code A::bar}. */
    public String simpleName() {
        int colons = name.lastIndexOf("::");
        int dot = name.lastIndexOf('.');
        if (colons >= 0 && colons + 1 > dot) {
            return name.substring(colons + 2);
        }
        return dot >= 0 ? name.substring(dot + 1) : name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParsedSymbol other)) return false;
        return name.equals(other.name)
                && kind.equals(other.kind)
                && signature.equals(other.signature)
                && span.equals(other.span)
                && Objects.equals(docstring, other.docstring)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, signature, span, docstring, children);
    }

    @Override
    public String toString() {
        return "ParsedSymbol[" + kind + " " + name + " @" + span.startLine() + "-" + span.endLine()
                + (children.isEmpty() ? "" : ", children=" + children.size()) + "]";
    }
}
