package checkedc.hir;

/**
* Kinds of implicit conversions recorded on {@link ImplicitCastExpression}.
*/
public enum CastKind {
    LVALUE_TO_RVALUE,
    NO_OP,
    LVALUE_BIT_CAST,
    ARRAY_TO_POINTER_DECAY,
    INTEGRAL_CAST,
    INTEGRAL_TO_POINTER,
    POINTER_TO_INTEGRAL,
    BIT_CAST;

    /**
    * Checks if a conversion of this kind leaves the value unchanged, in which
    * case analyses may look through it.
    */
    public boolean isValuePreserving() {
        return (this == LVALUE_TO_RVALUE || this == NO_OP ||
                this == LVALUE_BIT_CAST);
    }
}
