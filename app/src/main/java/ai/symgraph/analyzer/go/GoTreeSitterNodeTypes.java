package ai.symgraph.analyzer.go;

import ai.symgraph.analyzer.CommonTreeSitterNodeTypes;

/** Constants for Go TreeSitter node type names. Combines common TreeSitter node types with Go-specific ones. */
public final class GoTreeSitterNodeTypes {

    // ===== COMMON TYPES (imported from CommonTreeSitterNodeTypes) =====
    public static final String FUNCTION_DECLARATION = CommonTreeSitterNodeTypes.FUNCTION_DECLARATION;
    public static final String METHOD_DECLARATION = CommonTreeSitterNodeTypes.METHOD_DECLARATION;
    public static final String COMMENT = CommonTreeSitterNodeTypes.COMMENT;
    public static final String FIELD_IDENTIFIER = CommonTreeSitterNodeTypes.FIELD_IDENTIFIER;
    public static final String TYPE_IDENTIFIER = CommonTreeSitterNodeTypes.TYPE_IDENTIFIER;

    // ===== GO-SPECIFIC TYPES =====
    public static final String PACKAGE_CLAUSE = "package_clause";
    public static final String PACKAGE_IDENTIFIER = "package_identifier";

    public static final String IMPORT_DECLARATION = "import_declaration";
    public static final String IMPORT_SPEC = "import_spec";

    // Type definitions
    public static final String TYPE_DECLARATION = "type_declaration";
    public static final String TYPE_SPEC = "type_spec";
    public static final String TYPE_ALIAS = "type_alias";
    public static final String STRUCT_TYPE = "struct_type";
    public static final String INTERFACE_TYPE = "interface_type";
    public static final String FIELD_DECLARATION_LIST = "field_declaration_list";
    public static final String FIELD_DECLARATION = "field_declaration";

    // Interface members; older grammars call these method_spec
    public static final String METHOD_ELEM = "method_elem";
    public static final String METHOD_SPEC = "method_spec";

    private GoTreeSitterNodeTypes() {
        // Utility class - no instantiation
    }
}
