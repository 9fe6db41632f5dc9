package ai.symgraph.analyzer;

/** Kind tags attached to {@link ParsedSymbol}s. The set is open; these are the ones the bundled extractors emit. */
public final class SymbolKinds {
    private SymbolKinds() {}

    public static final String PACKAGE = "package";
    public static final String MODULE = "module";
    public static final String NAMESPACE = "namespace";

    public static final String CLASS = "class";
    public static final String CLASS_TEMPLATE = "class_template";
    public static final String DATA_CLASS = "data_class";
    public static final String OBJECT = "object";
    public static final String STRUCT = "struct";
    public static final String INTERFACE = "interface";
    public static final String PROTOCOL = "protocol";
    public static final String EXTENSION = "extension";
    public static final String CATEGORY = "category";
    public static final String IMPLEMENTATION = "implementation";
    public static final String ENUM = "enum";
    public static final String ENUM_CONSTANT = "enum_constant";
    public static final String ENUM_CASE = "enum_case";
    public static final String ANNOTATION = "annotation";
    public static final String RECORD = "record";
    public static final String TYPE = "type";
    public static final String EXPORT = "export";

    public static final String FUNCTION = "function";
    public static final String FUNCTION_TEMPLATE = "function_template";
    public static final String FUNCTION_DECLARATION = "function_declaration";
    public static final String STATIC_FUNCTION = "static_function";
    public static final String INLINE_FUNCTION = "inline_function";
    public static final String ASYNC_FUNCTION = "async_function";
    public static final String SUSPEND_FUNCTION = "suspend_function";
    public static final String EXTENSION_FUNCTION = "extension_function";
    public static final String GENERATOR_FUNCTION = "generator_function";
    public static final String ARROW_FUNCTION = "arrow_function";
    public static final String ASYNC_ARROW_FUNCTION = "async_arrow_function";

    public static final String METHOD = "method";
    public static final String VIRTUAL_METHOD = "virtual_method";
    public static final String STATIC_METHOD = "static_method";
    public static final String CLASS_METHOD = "class_method";
    public static final String ASYNC_METHOD = "async_method";
    public static final String SUSPEND_METHOD = "suspend_method";
    public static final String CONSTRUCTOR = "constructor";
    public static final String DESTRUCTOR = "destructor";
    public static final String INITIALIZER = "initializer";
    public static final String OPERATOR = "operator";

    public static final String FIELD = "field";
    public static final String PROPERTY = "property";
    public static final String STATIC_PROPERTY = "static_property";
    public static final String PROPERTY_OBSERVER = "property_observer";

    /** Kinds that carry a body and can therefore be the definition side of a declaration/definition pair. */
    public static boolean isDefinitionKind(String kind) {
        return switch (kind) {
            case FUNCTION,
                    STATIC_FUNCTION,
                    INLINE_FUNCTION,
                    FUNCTION_TEMPLATE,
                    METHOD,
                    VIRTUAL_METHOD,
                    STATIC_METHOD,
                    CLASS_METHOD,
                    CONSTRUCTOR,
                    DESTRUCTOR,
                    OPERATOR -> true;
            default -> false;
        };
    }

    /** Kinds that own member children. */
    public static boolean isTypeKind(String kind) {
        return switch (kind) {
            case CLASS,
                    CLASS_TEMPLATE,
                    DATA_CLASS,
                    OBJECT,
                    STRUCT,
                    INTERFACE,
                    PROTOCOL,
                    EXTENSION,
                    CATEGORY,
                    IMPLEMENTATION,
                    ENUM,
                    ANNOTATION,
                    RECORD,
                    NAMESPACE -> true;
            default -> false;
        };
    }
}
