package ai.symgraph.analyzer;

/** Type tags attached to {@link ParsedDependency} edges. */
public final class DependencyTypes {
    private DependencyTypes() {}

    public static final String IMPORT = "import";
    public static final String CALL = "call";
    public static final String EXTENDS = "extends";
    public static final String IMPLEMENTS = "implements";
    public static final String CONFORMS = "conforms";
    public static final String IMPLEMENTS_HEADER = "implements_header";
    public static final String IMPLEMENTS_DECLARATION = "implements_declaration";
}
