package ai.symgraph.analyzer.swift;

import ai.symgraph.analyzer.CommonTreeSitterNodeTypes;

/** Constants for Swift TreeSitter node type names. */
public final class SwiftTreeSitterNodeTypes {

    // ===== COMMON TYPES (imported from CommonTreeSitterNodeTypes) =====
    public static final String CLASS_DECLARATION = CommonTreeSitterNodeTypes.CLASS_DECLARATION;
    public static final String PROTOCOL_DECLARATION = CommonTreeSitterNodeTypes.PROTOCOL_DECLARATION;
    public static final String FUNCTION_DECLARATION = CommonTreeSitterNodeTypes.FUNCTION_DECLARATION;
    public static final String PROPERTY_DECLARATION = CommonTreeSitterNodeTypes.PROPERTY_DECLARATION;
    public static final String CALL_EXPRESSION = CommonTreeSitterNodeTypes.CALL_EXPRESSION;
    public static final String TYPE_IDENTIFIER = CommonTreeSitterNodeTypes.TYPE_IDENTIFIER;
    public static final String COMMENT = CommonTreeSitterNodeTypes.COMMENT;
    public static final String MULTILINE_COMMENT = CommonTreeSitterNodeTypes.MULTILINE_COMMENT;

    // ===== SWIFT-SPECIFIC TYPES =====
    public static final String IMPORT_DECLARATION = "import_declaration";
    public static final String INIT_DECLARATION = "init_declaration";
    public static final String PROTOCOL_FUNCTION_DECLARATION = "protocol_function_declaration";
    public static final String PROTOCOL_PROPERTY_DECLARATION = "protocol_property_declaration";

    public static final String CLASS_BODY = "class_body";
    public static final String ENUM_CLASS_BODY = "enum_class_body";
    public static final String PROTOCOL_BODY = "protocol_body";
    public static final String ENUM_ENTRY = "enum_entry";

    public static final String INHERITANCE_SPECIFIER = "inheritance_specifier";
    public static final String USER_TYPE = "user_type";
    public static final String SIMPLE_IDENTIFIER = "simple_identifier";
    public static final String PATTERN = "pattern";
    public static final String MODIFIERS = "modifiers";
    public static final String ATTRIBUTE = "attribute";

    // declaration keywords of class_declaration
    public static final String CLASS_KEYWORD = "class";
    public static final String STRUCT_KEYWORD = "struct";
    public static final String ENUM_KEYWORD = "enum";
    public static final String EXTENSION_KEYWORD = "extension";
    public static final String ACTOR_KEYWORD = "actor";

    private SwiftTreeSitterNodeTypes() {
        // Utility class - no instantiation
    }
}
