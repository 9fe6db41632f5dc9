package ai.symgraph.analyzer.java;

import ai.symgraph.analyzer.CommonTreeSitterNodeTypes;

/** Constants for Java TreeSitter node type names. */
public final class JavaTreeSitterNodeTypes {

    // ===== COMMON TYPES (imported from CommonTreeSitterNodeTypes) =====
    public static final String CLASS_DECLARATION = CommonTreeSitterNodeTypes.CLASS_DECLARATION;
    public static final String INTERFACE_DECLARATION = CommonTreeSitterNodeTypes.INTERFACE_DECLARATION;
    public static final String ENUM_DECLARATION = CommonTreeSitterNodeTypes.ENUM_DECLARATION;
    public static final String METHOD_DECLARATION = CommonTreeSitterNodeTypes.METHOD_DECLARATION;
    public static final String CONSTRUCTOR_DECLARATION = CommonTreeSitterNodeTypes.CONSTRUCTOR_DECLARATION;
    public static final String FIELD_DECLARATION = CommonTreeSitterNodeTypes.FIELD_DECLARATION;
    public static final String LINE_COMMENT = CommonTreeSitterNodeTypes.LINE_COMMENT;
    public static final String BLOCK_COMMENT = CommonTreeSitterNodeTypes.BLOCK_COMMENT;

    // ===== JAVA-SPECIFIC TYPES =====
    public static final String PACKAGE_DECLARATION = "package_declaration";
    public static final String IMPORT_DECLARATION = "import_declaration";
    public static final String SCOPED_IDENTIFIER = "scoped_identifier";
    public static final String ASTERISK = "asterisk";

    public static final String RECORD_DECLARATION = "record_declaration";
    public static final String ANNOTATION_TYPE_DECLARATION = "annotation_type_declaration";
    public static final String ANNOTATION_TYPE_ELEMENT_DECLARATION = "annotation_type_element_declaration";
    public static final String CONSTANT_DECLARATION = "constant_declaration";
    public static final String COMPACT_CONSTRUCTOR_DECLARATION = "compact_constructor_declaration";

    public static final String ENUM_BODY = "enum_body";
    public static final String ENUM_BODY_DECLARATIONS = "enum_body_declarations";
    public static final String ENUM_CONSTANT = "enum_constant";

    public static final String SUPERCLASS = "superclass";
    public static final String SUPER_INTERFACES = "super_interfaces";
    public static final String EXTENDS_INTERFACES = "extends_interfaces";
    public static final String TYPE_LIST = "type_list";
    public static final String VARIABLE_DECLARATOR = "variable_declarator";

    public static final String MODIFIERS = "modifiers";
    public static final String MARKER_ANNOTATION = "marker_annotation";
    public static final String ANNOTATION = "annotation";

    private JavaTreeSitterNodeTypes() {
        // Utility class - no instantiation
    }
}
