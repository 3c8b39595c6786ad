package app.lessico.transfer.reconcile;

/**
 * What to do when a bundle declares a different {@code exportType} than the scope requested.
 */
public enum ScopeMismatchPolicy {
    reject,
    warn
}
