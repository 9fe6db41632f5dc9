package ai.symgraph.analyzer.typescript;

import ai.symgraph.analyzer.CommonTreeSitterNodeTypes;

/** Constants for TypeScript TreeSitter node type names. */
public final class TypeScriptTreeSitterNodeTypes {

    // ===== COMMON TYPES (imported from CommonTreeSitterNodeTypes) =====
    public static final String INTERFACE_DECLARATION = CommonTreeSitterNodeTypes.INTERFACE_DECLARATION;
    public static final String ENUM_DECLARATION = CommonTreeSitterNodeTypes.ENUM_DECLARATION;
    public static final String TYPE_IDENTIFIER = CommonTreeSitterNodeTypes.TYPE_IDENTIFIER;

    // ===== TYPESCRIPT-SPECIFIC TYPES =====
    // Class-like declarations
    public static final String ABSTRACT_CLASS_DECLARATION = "abstract_class_declaration";
    public static final String TYPE_ALIAS_DECLARATION = "type_alias_declaration";
    public static final String EXTENDS_CLAUSE = "extends_clause";
    public static final String IMPLEMENTS_CLAUSE = "implements_clause";
    public static final String EXTENDS_TYPE_CLAUSE = "extends_type_clause";
    public static final String GENERIC_TYPE = "generic_type";
    public static final String NESTED_TYPE_IDENTIFIER = "nested_type_identifier";

    // Function-like declarations
    public static final String FUNCTION_SIGNATURE = "function_signature";
    public static final String METHOD_SIGNATURE = "method_signature";
    public static final String ABSTRACT_METHOD_SIGNATURE = "abstract_method_signature";

    // Field-like declarations
    public static final String PUBLIC_FIELD_DEFINITION = "public_field_definition";
    public static final String PROPERTY_SIGNATURE = "property_signature";
    public static final String ENUM_BODY = "enum_body";
    public static final String ENUM_ASSIGNMENT = "enum_assignment";
    public static final String PROPERTY_IDENTIFIER = "property_identifier";

    private TypeScriptTreeSitterNodeTypes() {
        // Utility class - no instantiation
    }
}
