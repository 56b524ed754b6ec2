package checkedc.hir;

/**
* Raised on an attempt to attach an IR object that is already owned by
* another parent. Shared subtrees must be cloned.
*/
public class NotAnOrphanException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NotAnOrphanException() {
    }

    public NotAnOrphanException(String message) {
        super(message);
    }
}
