package app.lessico.transfer.reconcile;

import java.util.Locale;

public final class NaturalKeys {

    private NaturalKeys() {
    }

    /**
     * Case-insensitive exact match key. Surrounding whitespace is significant.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        return text.toLowerCase(Locale.ROOT);
    }
}
