package ai.symgraph.analyzer;

/** Tree-sitter node type names shared across several grammars. */
public final class CommonTreeSitterNodeTypes {

    // ===== CLASS-LIKE DECLARATIONS =====
    public static final String CLASS_DECLARATION = "class_declaration";
    public static final String INTERFACE_DECLARATION = "interface_declaration";
    public static final String ENUM_DECLARATION = "enum_declaration";
    public static final String PROTOCOL_DECLARATION = "protocol_declaration";

    // ===== FUNCTION-LIKE DECLARATIONS =====
    public static final String FUNCTION_DECLARATION = "function_declaration";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String METHOD_DECLARATION = "method_declaration";
    public static final String METHOD_DEFINITION = "method_definition";
    public static final String CONSTRUCTOR_DECLARATION = "constructor_declaration";

    // ===== FIELD-LIKE DECLARATIONS =====
    public static final String FIELD_DECLARATION = "field_declaration";
    public static final String PROPERTY_DECLARATION = "property_declaration";

    // ===== EXPRESSIONS =====
    public static final String CALL_EXPRESSION = "call_expression";

    // ===== IDENTIFIERS =====
    public static final String IDENTIFIER = "identifier";
    public static final String TYPE_IDENTIFIER = "type_identifier";
    public static final String FIELD_IDENTIFIER = "field_identifier";

    // ===== COMMENTS =====
    public static final String COMMENT = "comment";
    public static final String LINE_COMMENT = "line_comment";
    public static final String BLOCK_COMMENT = "block_comment";
    public static final String MULTILINE_COMMENT = "multiline_comment";

    public static final String ERROR = "ERROR";

    private CommonTreeSitterNodeTypes() {
        // Utility class - no instantiation
    }
}
