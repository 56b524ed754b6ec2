package checkedc.hir;

import java.util.Arrays;

/**
 * Shorthands for building IR fragments in tests. Every call creates new,
 * parentless objects.
 */
public final class IRBuilder {

  private IRBuilder() {
  }

  public static VariableDeclarator intVar(String name) {
    return new VariableDeclarator("int", name, TypeKind.INTEGER);
  }

  /** An _Nt_array_ptr&lt;char&gt; without bounds annotation. */
  public static VariableDeclarator ntPtr(String name) {
    return new VariableDeclarator("_Nt_array_ptr<char>", name,
                                  TypeKind.NT_ARRAY_PTR);
  }

  /** Attaches bounds(lower, upper) to the pointer and returns it. */
  public static VariableDeclarator withBounds(VariableDeclarator var,
                                              Expression lower,
                                              Expression upper) {
    var.setBounds(new RangeBoundsExpression(lower, upper));
    return var;
  }

  /** Attaches count(n) to the pointer and returns it. */
  public static VariableDeclarator withCount(VariableDeclarator var,
                                             Expression count) {
    var.setBounds(new CountBoundsExpression(count));
    return var;
  }

  public static Identifier id(Symbol symbol) {
    return new Identifier(symbol);
  }

  public static IntegerLiteral lit(long value) {
    return new IntegerLiteral(value);
  }

  public static CharLiteral chr(char value) {
    return new CharLiteral(value);
  }

  public static BinaryExpression add(Expression lhs, Expression rhs) {
    return new BinaryExpression(lhs, BinaryOperator.ADD, rhs);
  }

  public static BinaryExpression sub(Expression lhs, Expression rhs) {
    return new BinaryExpression(lhs, BinaryOperator.SUBTRACT, rhs);
  }

  public static BinaryExpression mul(Expression lhs, Expression rhs) {
    return new BinaryExpression(lhs, BinaryOperator.MULTIPLY, rhs);
  }

  public static BinaryExpression div(Expression lhs, Expression rhs) {
    return new BinaryExpression(lhs, BinaryOperator.DIVIDE, rhs);
  }

  public static BinaryExpression eq(Expression lhs, Expression rhs) {
    return new BinaryExpression(lhs, BinaryOperator.COMPARE_EQ, rhs);
  }

  public static BinaryExpression ne(Expression lhs, Expression rhs) {
    return new BinaryExpression(lhs, BinaryOperator.COMPARE_NE, rhs);
  }

  public static BinaryExpression and(Expression lhs, Expression rhs) {
    return new BinaryExpression(lhs, BinaryOperator.LOGICAL_AND, rhs);
  }

  public static BinaryExpression or(Expression lhs, Expression rhs) {
    return new BinaryExpression(lhs, BinaryOperator.LOGICAL_OR, rhs);
  }

  public static UnaryExpression deref(Expression e) {
    return new UnaryExpression(UnaryOperator.DEREFERENCE, e);
  }

  public static UnaryExpression not(Expression e) {
    return new UnaryExpression(UnaryOperator.LOGICAL_NEGATION, e);
  }

  public static UnaryExpression neg(Expression e) {
    return new UnaryExpression(UnaryOperator.MINUS, e);
  }

  public static UnaryExpression postInc(Expression e) {
    return new UnaryExpression(UnaryOperator.POST_INCREMENT, e);
  }

  public static UnaryExpression addressOf(Expression e) {
    return new UnaryExpression(UnaryOperator.ADDRESS_OF, e);
  }

  public static ArrayAccess index(Expression array, Expression index) {
    return new ArrayAccess(array, index);
  }

  public static AccessExpression arrow(Expression base, Symbol field) {
    return new AccessExpression(base, AccessOperator.POINTER_ACCESS,
                                new Identifier(field));
  }

  public static AccessExpression dot(Expression base, Symbol field) {
    return new AccessExpression(base, AccessOperator.MEMBER_ACCESS,
                                new Identifier(field));
  }

  public static FunctionCall call(Symbol function, Expression... args) {
    return new FunctionCall(new Identifier(function), Arrays.asList(args));
  }

  public static ImplicitCastExpression rvalue(Expression e) {
    return new ImplicitCastExpression(CastKind.LVALUE_TO_RVALUE, e);
  }

  public static AssignmentExpression assign(Expression lhs, Expression rhs) {
    return new AssignmentExpression(lhs, AssignmentOperator.NORMAL, rhs);
  }

  public static ExpressionStatement stmt(Expression e) {
    return new ExpressionStatement(e);
  }

  public static DeclarationStatement decl(VariableDeclarator var) {
    return new DeclarationStatement(var);
  }

  public static DeclarationStatement decl(VariableDeclarator var,
                                          Expression init) {
    return new DeclarationStatement(var, init);
  }

  public static CompoundStatement block(Statement... stmts) {
    CompoundStatement ret = new CompoundStatement();
    for (Statement s : stmts) {
      ret.addStatement(s);
    }
    return ret;
  }

  public static Procedure proc(String name, CompoundStatement body,
                               VariableDeclarator... params) {
    return new Procedure(name, Arrays.asList(params), body);
  }
}
