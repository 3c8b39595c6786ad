package app.lessico.transfer.reconcile;

public class OwnershipConflictException extends RuntimeException {

    public OwnershipConflictException(String message) {
        super(message);
    }
}
