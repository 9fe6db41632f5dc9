package ai.symgraph.analyzer.kotlin;

import ai.symgraph.analyzer.CommonTreeSitterNodeTypes;

/** Constants for Kotlin TreeSitter node type names. */
public final class KotlinTreeSitterNodeTypes {

    // ===== COMMON TYPES (imported from CommonTreeSitterNodeTypes) =====
    public static final String CLASS_DECLARATION = CommonTreeSitterNodeTypes.CLASS_DECLARATION;
    public static final String FUNCTION_DECLARATION = CommonTreeSitterNodeTypes.FUNCTION_DECLARATION;
    public static final String PROPERTY_DECLARATION = CommonTreeSitterNodeTypes.PROPERTY_DECLARATION;
    public static final String CALL_EXPRESSION = CommonTreeSitterNodeTypes.CALL_EXPRESSION;
    public static final String TYPE_IDENTIFIER = CommonTreeSitterNodeTypes.TYPE_IDENTIFIER;
    public static final String COMMENT = CommonTreeSitterNodeTypes.COMMENT;
    public static final String LINE_COMMENT = CommonTreeSitterNodeTypes.LINE_COMMENT;
    public static final String MULTILINE_COMMENT = CommonTreeSitterNodeTypes.MULTILINE_COMMENT;

    // ===== KOTLIN-SPECIFIC TYPES =====
    public static final String PACKAGE_HEADER = "package_header";
    public static final String IMPORT_LIST = "import_list";
    public static final String IMPORT_HEADER = "import_header";
    public static final String WILDCARD_IMPORT = "wildcard_import";
    public static final String IDENTIFIER = "identifier";
    public static final String SIMPLE_IDENTIFIER = "simple_identifier";

    public static final String OBJECT_DECLARATION = "object_declaration";
    public static final String COMPANION_OBJECT = "companion_object";
    public static final String SECONDARY_CONSTRUCTOR = "secondary_constructor";
    public static final String CLASS_BODY = "class_body";
    public static final String ENUM_CLASS_BODY = "enum_class_body";
    public static final String ENUM_ENTRY = "enum_entry";
    public static final String INTERFACE_KEYWORD = "interface";

    public static final String MODIFIERS = "modifiers";
    public static final String CLASS_MODIFIER = "class_modifier";
    public static final String FUNCTION_MODIFIER = "function_modifier";
    public static final String ANNOTATION = "annotation";

    public static final String DELEGATION_SPECIFIERS = "delegation_specifiers";
    public static final String DELEGATION_SPECIFIER = "delegation_specifier";
    public static final String USER_TYPE = "user_type";
    public static final String RECEIVER_TYPE = "receiver_type";
    public static final String VARIABLE_DECLARATION = "variable_declaration";

    private KotlinTreeSitterNodeTypes() {
        // Utility class - no instantiation
    }
}
