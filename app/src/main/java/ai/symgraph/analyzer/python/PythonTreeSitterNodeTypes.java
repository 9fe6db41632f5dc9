package ai.symgraph.analyzer.python;

import ai.symgraph.analyzer.CommonTreeSitterNodeTypes;

/** Constants for Python TreeSitter node type names. */
public final class PythonTreeSitterNodeTypes {

    // ===== COMMON TYPES (imported from CommonTreeSitterNodeTypes) =====
    public static final String FUNCTION_DEFINITION = CommonTreeSitterNodeTypes.FUNCTION_DEFINITION;
    public static final String IDENTIFIER = CommonTreeSitterNodeTypes.IDENTIFIER;
    public static final String COMMENT = CommonTreeSitterNodeTypes.COMMENT;

    // ===== PYTHON-SPECIFIC TYPES =====
    public static final String MODULE = "module";
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String DECORATED_DEFINITION = "decorated_definition";
    public static final String DECORATOR = "decorator";
    public static final String BLOCK = "block";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String STRING = "string";
    public static final String ASYNC = "async";

    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    public static final String FUTURE_IMPORT_STATEMENT = "future_import_statement";
    public static final String DOTTED_NAME = "dotted_name";
    public static final String ALIASED_IMPORT = "aliased_import";
    public static final String RELATIVE_IMPORT = "relative_import";

    public static final String ARGUMENT_LIST = "argument_list";
    public static final String ATTRIBUTE = "attribute";

    private PythonTreeSitterNodeTypes() {
        // Utility class - no instantiation
    }
}
