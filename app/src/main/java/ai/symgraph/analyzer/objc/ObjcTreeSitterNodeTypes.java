package ai.symgraph.analyzer.objc;

import ai.symgraph.analyzer.CommonTreeSitterNodeTypes;

/** Constants for Objective-C TreeSitter node type names. */
public final class ObjcTreeSitterNodeTypes {

    // ===== COMMON TYPES (imported from CommonTreeSitterNodeTypes) =====
    public static final String PROTOCOL_DECLARATION = CommonTreeSitterNodeTypes.PROTOCOL_DECLARATION;
    public static final String PROPERTY_DECLARATION = CommonTreeSitterNodeTypes.PROPERTY_DECLARATION;
    public static final String METHOD_DECLARATION = CommonTreeSitterNodeTypes.METHOD_DECLARATION;
    public static final String METHOD_DEFINITION = CommonTreeSitterNodeTypes.METHOD_DEFINITION;
    public static final String FUNCTION_DEFINITION = CommonTreeSitterNodeTypes.FUNCTION_DEFINITION;
    public static final String IDENTIFIER = CommonTreeSitterNodeTypes.IDENTIFIER;
    public static final String TYPE_IDENTIFIER = CommonTreeSitterNodeTypes.TYPE_IDENTIFIER;
    public static final String COMMENT = CommonTreeSitterNodeTypes.COMMENT;

    // ===== OBJECTIVE-C-SPECIFIC TYPES =====
    public static final String PREPROC_INCLUDE = "preproc_include";
    public static final String MODULE_IMPORT = "module_import";
    public static final String SYSTEM_LIB_STRING = "system_lib_string";
    public static final String STRING_LITERAL = "string_literal";

    public static final String CLASS_INTERFACE = "class_interface";
    public static final String CLASS_IMPLEMENTATION = "class_implementation";
    public static final String IMPLEMENTATION_DEFINITION = "implementation_definition";
    public static final String QUALIFIED_PROTOCOL_INTERFACE_DECLARATION = "qualified_protocol_interface_declaration";

    public static final String PROTOCOL_QUALIFIERS = "protocol_qualifiers";
    public static final String PROTOCOL_REFERENCE_LIST = "protocol_reference_list";
    public static final String PARAMETERIZED_ARGUMENTS = "parameterized_arguments";

    public static final String METHOD_PARAMETER = "method_parameter";
    public static final String STRUCT_DECLARATOR = "struct_declarator";
    public static final String FUNCTION_DECLARATOR = "function_declarator";
    public static final String MESSAGE_EXPRESSION = "message_expression";

    private ObjcTreeSitterNodeTypes() {}
}
