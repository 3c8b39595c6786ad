package app.lessico.transfer.codec;

import app.lessico.transfer.domain.TransferScope;

public class ScopeMismatchException extends RuntimeException {

    private final TransferScope requested;
    private final String declaredExportType;

    public ScopeMismatchException(TransferScope requested, String declaredExportType) {
        super("Bundle is not compatible: expected " + requested.exportType() + ", found " + declaredExportType);
        this.requested = requested;
        this.declaredExportType = declaredExportType;
    }

    public TransferScope getRequested() {
        return requested;
    }

    public String getDeclaredExportType() {
        return declaredExportType;
    }
}
