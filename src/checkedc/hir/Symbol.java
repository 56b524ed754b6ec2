package checkedc.hir;

/**
* An IR object that implements Symbol interface is identified as a unique
* symbol in the procedure. Every {@link Identifier} object has a link to its
* corresponding Symbol object and can access the attributes of the symbol
* object. Symbols are compared by identity.
*/
public interface Symbol {

    /**
    * Returns the name of the symbol.
    *
    * @return the name of the symbol.
    */
    String getSymbolName();

    /**
    * Returns the sequence number assigned when the symbol was declared. Two
    * distinct symbols sharing a name (shadowing) are told apart by this
    * number.
    *
    * @return the declaration sequence number.
    */
    int getDeclarationId();
}
