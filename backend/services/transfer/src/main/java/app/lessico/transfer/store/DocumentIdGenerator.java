package app.lessico.transfer.store;

import app.lessico.transfer.config.TransferProps;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Allocates opaque alphanumeric document ids in the same shape as the ids already present in
 * exported bundles.
 */
@Component
public class DocumentIdGenerator {

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final SecureRandom random = new SecureRandom();
    private final int length;

    @Autowired
    public DocumentIdGenerator(TransferProps props) {
        this(props.idLength());
    }

    public DocumentIdGenerator(int length) {
        this.length = length;
    }

    public String next() {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
