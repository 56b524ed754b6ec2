package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents a declared variable with its printed type, its type kind and the
* optional bounds annotation. Declarators act as the symbols of the program.
*/
public class VariableDeclarator implements Symbol, Printable {

    private static int next_id = 0;

    private String type_name;

    private String name;

    private TypeKind kind;

    private BoundsExpression bounds;

    private int id;

    /**
    * Creates a declarator without a bounds annotation.
    *
    * @param type_name the printed form of the type, e.g.
    *       <code>_Nt_array_ptr&lt;char&gt;</code>.
    * @param name the variable name.
    * @param kind the type kind.
    */
    public VariableDeclarator(String type_name, String name, TypeKind kind) {
        this.type_name = type_name;
        this.name = name;
        this.kind = kind;
        this.bounds = null;
        synchronized (VariableDeclarator.class) {
            this.id = next_id++;
        }
    }

    /**
    * Creates a declarator with a bounds annotation.
    */
    public VariableDeclarator(String type_name, String name, TypeKind kind,
                              BoundsExpression bounds) {
        this(type_name, name, kind);
        this.bounds = bounds;
    }

    public String getSymbolName() {
        return name;
    }

    public int getDeclarationId() {
        return id;
    }

    public String getTypeName() {
        return type_name;
    }

    public TypeKind getTypeKind() {
        return kind;
    }

    /**
    * Returns the declared bounds annotation, or null if none was written.
    */
    public BoundsExpression getBounds() {
        return bounds;
    }

    /**
    * Attaches a bounds annotation. Bounds commonly refer to the declared
    * variable itself, so they are attached after construction.
    *
    * @param bounds the bounds annotation.
    */
    public void setBounds(BoundsExpression bounds) {
        this.bounds = bounds;
    }

    public void print(PrintWriter o) {
        o.print(type_name);
        o.print(" ");
        o.print(name);
        if (bounds != null) {
            o.print(" : ");
            bounds.print(o);
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
