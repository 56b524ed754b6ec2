package checkedc.hir;

import java.io.PrintWriter;
import java.util.List;

/**
* Represents a function call. The first child is the function name and the
* remaining children are the arguments.
*/
public class FunctionCall extends Expression {

    /**
    * Creates a function call.
    *
    * @param function the called function.
    * @param args the list of arguments.
    */
    public FunctionCall(Expression function, List<Expression> args) {
        super(args.size() + 1);
        addChild(function);
        for (Expression arg : args) {
            addChild(arg);
            arg.setParens(false);
        }
    }

    @Override
    public FunctionCall clone() {
        return (FunctionCall)super.clone();
    }

    public Expression getName() {
        return (Expression)children.get(0);
    }

    public int getNumArguments() {
        return children.size() - 1;
    }

    public Expression getArgument(int n) {
        return (Expression)children.get(n + 1);
    }

    public void print(PrintWriter o) {
        getName().print(o);
        o.print("(");
        for (int i = 1; i < children.size(); i++) {
            if (i > 1) {
                o.print(", ");
            }
            children.get(i).print(o);
        }
        o.print(")");
    }
}
