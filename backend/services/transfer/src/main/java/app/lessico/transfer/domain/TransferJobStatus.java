package app.lessico.transfer.domain;

public enum TransferJobStatus {
    processing,
    completed,
    partial,
    failed
}
