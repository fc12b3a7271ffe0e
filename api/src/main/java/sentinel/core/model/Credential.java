package sentinel.core.model;

/**
 * A rendered upstream credential together with the raw secret it was built from.
 * Both values are kept only for injection and redaction; {@link #toString()} never
 * reveals them.
 */
public record Credential(String rendered, String secret) {

    @Override
    public String toString() {
        return "Credential[***]";
    }
}
