package app.lessico.transfer.codec;

public class MalformedBundleException extends RuntimeException {

    public MalformedBundleException(String message) {
        super(message);
    }

    public MalformedBundleException(String message, Throwable cause) {
        super(message, cause);
    }
}
