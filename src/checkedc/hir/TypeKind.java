package checkedc.hir;

/**
* Coarse classification of declared types, enough for the checked pointer
* analyses.
*/
public enum TypeKind {
    INTEGER,
    CHARACTER,
    STRUCT,
    POINTER,
    ARRAY_PTR,
    NT_ARRAY_PTR,
    NT_CHECKED_ARRAY;

    /**
    * Checks if the type is a null-terminated array pointer or a
    * null-terminated checked array.
    */
    public boolean isNtArray() {
        return (this == NT_ARRAY_PTR || this == NT_CHECKED_ARRAY);
    }
}
