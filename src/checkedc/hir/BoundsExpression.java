package checkedc.hir;

/**
* Base class of the Checked C bounds annotations attached to declarations and
* where clauses.
*/
public abstract class BoundsExpression extends Expression {

    protected BoundsExpression(int size) {
        super(size);
    }

    @Override
    public BoundsExpression clone() {
        return (BoundsExpression)super.clone();
    }

    /**
    * Returns the equivalent range bounds for the pointer declared by
    * <b>symbol</b>. The returned expression is newly created.
    *
    * @param symbol the symbol whose bounds this expression describes.
    * @return the range form of the bounds.
    */
    public abstract RangeBoundsExpression toRange(Symbol symbol);
}
