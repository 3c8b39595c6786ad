package app.lessico.transfer.config;

import app.lessico.transfer.reconcile.ScopeMismatchPolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.transfer")
public record TransferProps(
        ScopeMismatchPolicy scopeMismatchPolicy,
        @Positive Long maxBundleBytes,
        @Min(8) Integer idLength
) {

    public static final long DEFAULT_MAX_BUNDLE_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_ID_LENGTH = 20;

    public TransferProps {
        if (scopeMismatchPolicy == null) {
            scopeMismatchPolicy = ScopeMismatchPolicy.reject;
        }
        if (maxBundleBytes == null) {
            maxBundleBytes = DEFAULT_MAX_BUNDLE_BYTES;
        }
        if (idLength == null) {
            idLength = DEFAULT_ID_LENGTH;
        }
    }
}
