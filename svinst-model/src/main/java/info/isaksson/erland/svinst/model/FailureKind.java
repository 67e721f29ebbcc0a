package info.isaksson.erland.svinst.model;

/** Why a single file could not be processed. Every kind is file-scoped. */
public enum FailureKind {
    INCLUDE_NOT_FOUND("IncludeNotFound"),
    INCLUDE_CYCLE("IncludeCycle"),
    INCLUDE_DEPTH_LIMIT("IncludeDepthLimit"),
    UNBALANCED_CONDITIONAL("UnbalancedConditional"),
    UNDEFINED_MACRO("UndefinedMacro"),
    MACRO_RECURSION_LIMIT("MacroRecursionLimit"),
    MALFORMED_DIRECTIVE("MalformedDirective"),
    PARSE_FAILURE("ParseFailure"),
    IO_ERROR("IoError"),
    INTERNAL_ERROR("InternalError");

    private final String displayName;

    FailureKind(String displayName) {
        this.displayName = displayName;
    }

    /** Name used in diagnostics, e.g. {@code IncludeCycle}. */
    public String displayName() {
        return displayName;
    }
}
