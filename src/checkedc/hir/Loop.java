package checkedc.hir;

/**
* Common interface of the loop statements.
*/
public interface Loop {

    /**
    * Returns the loop body.
    */
    Statement getBody();

    /**
    * Returns the controlling expression, or null for a loop without one.
    */
    Expression getCondition();
}
