package ai.symgraph.analyzer.javascript;

import ai.symgraph.analyzer.CommonTreeSitterNodeTypes;

/** Constants for JavaScript TreeSitter node type names. The TypeScript grammar reuses all of them. */
public final class JavaScriptTreeSitterNodeTypes {

    // ===== COMMON TYPES (imported from CommonTreeSitterNodeTypes) =====
    // Class-like declarations
    public static final String CLASS_DECLARATION = CommonTreeSitterNodeTypes.CLASS_DECLARATION;

    // Function-like declarations
    public static final String FUNCTION_DECLARATION = CommonTreeSitterNodeTypes.FUNCTION_DECLARATION;
    public static final String METHOD_DEFINITION = CommonTreeSitterNodeTypes.METHOD_DEFINITION;

    public static final String CALL_EXPRESSION = CommonTreeSitterNodeTypes.CALL_EXPRESSION;
    public static final String IDENTIFIER = CommonTreeSitterNodeTypes.IDENTIFIER;
    public static final String COMMENT = CommonTreeSitterNodeTypes.COMMENT;

    // ===== JAVASCRIPT-SPECIFIC TYPES =====
    public static final String PROGRAM = "program";

    // Class-like declarations
    public static final String CLASS_HERITAGE = "class_heritage";
    public static final String CLASS_BODY = "class_body";

    // Function-like declarations
    public static final String GENERATOR_FUNCTION_DECLARATION = "generator_function_declaration";
    public static final String FUNCTION_EXPRESSION = "function_expression";
    public static final String FUNCTION = "function";
    public static final String GENERATOR_FUNCTION = "generator_function";
    public static final String ARROW_FUNCTION = "arrow_function";

    // Field-like declarations
    public static final String FIELD_DEFINITION = "field_definition";
    public static final String VARIABLE_DECLARATOR = "variable_declarator";
    public static final String LEXICAL_DECLARATION = "lexical_declaration";
    public static final String VARIABLE_DECLARATION = "variable_declaration";

    // Statements
    public static final String EXPORT_STATEMENT = "export_statement";
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String ARGUMENTS = "arguments";

    // Expressions
    public static final String MEMBER_EXPRESSION = "member_expression";

    // Modifiers (anonymous tokens)
    public static final String ASYNC = "async";
    public static final String STATIC = "static";

    private JavaScriptTreeSitterNodeTypes() {
        // Utility class - no instantiation
    }
}
