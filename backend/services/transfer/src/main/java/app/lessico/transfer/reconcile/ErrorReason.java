package app.lessico.transfer.reconcile;

public enum ErrorReason {
    store_unavailable,
    ownership_conflict,
    unexpected
}
