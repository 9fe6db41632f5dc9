package ai.symgraph.analyzer.cpp;

import ai.symgraph.analyzer.CommonTreeSitterNodeTypes;

/** Constants for C and C++ TreeSitter node type names. The C grammar uses the subset without classes. */
public final class CppTreeSitterNodeTypes {

    // ===== COMMON TYPES (imported from CommonTreeSitterNodeTypes) =====
    public static final String FIELD_DECLARATION = CommonTreeSitterNodeTypes.FIELD_DECLARATION;
    public static final String FUNCTION_DEFINITION = CommonTreeSitterNodeTypes.FUNCTION_DEFINITION;
    public static final String CALL_EXPRESSION = CommonTreeSitterNodeTypes.CALL_EXPRESSION;
    public static final String IDENTIFIER = CommonTreeSitterNodeTypes.IDENTIFIER;
    public static final String TYPE_IDENTIFIER = CommonTreeSitterNodeTypes.TYPE_IDENTIFIER;
    public static final String FIELD_IDENTIFIER = CommonTreeSitterNodeTypes.FIELD_IDENTIFIER;
    public static final String COMMENT = CommonTreeSitterNodeTypes.COMMENT;

    // ===== C/C++-SPECIFIC TYPES =====
    // Specifiers
    public static final String CLASS_SPECIFIER = "class_specifier";
    public static final String STRUCT_SPECIFIER = "struct_specifier";
    public static final String UNION_SPECIFIER = "union_specifier";
    public static final String ENUM_SPECIFIER = "enum_specifier";
    public static final String VIRTUAL_SPECIFIER = "virtual_specifier";
    public static final String ACCESS_SPECIFIER = "access_specifier";
    public static final String STORAGE_CLASS_SPECIFIER = "storage_class_specifier";

    // Definitions
    public static final String NAMESPACE_DEFINITION = "namespace_definition";
    public static final String TEMPLATE_DECLARATION = "template_declaration";
    public static final String LINKAGE_SPECIFICATION = "linkage_specification";

    // Declarations
    public static final String DECLARATION = "declaration";
    public static final String TYPE_DEFINITION = "type_definition";
    public static final String ALIAS_DECLARATION = "alias_declaration";
    public static final String FRIEND_DECLARATION = "friend_declaration";

    // Declarators
    public static final String FUNCTION_DECLARATOR = "function_declarator";
    public static final String POINTER_DECLARATOR = "pointer_declarator";
    public static final String REFERENCE_DECLARATOR = "reference_declarator";
    public static final String ARRAY_DECLARATOR = "array_declarator";
    public static final String INIT_DECLARATOR = "init_declarator";
    public static final String PARENTHESIZED_DECLARATOR = "parenthesized_declarator";
    public static final String QUALIFIED_IDENTIFIER = "qualified_identifier";
    public static final String OPERATOR_NAME = "operator_name";
    public static final String DESTRUCTOR_NAME = "destructor_name";

    // Bodies and lists
    public static final String DECLARATION_LIST = "declaration_list";
    public static final String FIELD_DECLARATION_LIST = "field_declaration_list";
    public static final String ENUMERATOR_LIST = "enumerator_list";
    public static final String ENUMERATOR = "enumerator";
    public static final String BASE_CLASS_CLAUSE = "base_class_clause";

    // Preprocessor
    public static final String PREPROC_INCLUDE = "preproc_include";
    public static final String PREPROC_IF = "preproc_if";
    public static final String PREPROC_IFDEF = "preproc_ifdef";
    public static final String PREPROC_ELSE = "preproc_else";
    public static final String PREPROC_ELIF = "preproc_elif";
    public static final String SYSTEM_LIB_STRING = "system_lib_string";

    private CppTreeSitterNodeTypes() {}
}
