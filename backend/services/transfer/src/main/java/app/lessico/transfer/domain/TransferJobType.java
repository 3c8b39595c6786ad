package app.lessico.transfer.domain;

public enum TransferJobType {
    import_job,
    export_job
}
