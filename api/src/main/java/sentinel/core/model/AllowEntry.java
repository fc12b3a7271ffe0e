package sentinel.core.model;

/**
 * One IP allowlist entry: an exact address or a CIDR block.
 */
public sealed interface AllowEntry {

    /**
     * Parses an entry. Anything containing {@code /} is treated as CIDR; a CIDR entry
     * whose prefix length is not a number is kept with a negative prefix so that it
     * never matches.
     *
     * @param entry the raw entry
     * @return the parsed entry
     */
    static AllowEntry parse(String entry) {
        var slash = entry.indexOf('/');
        if (slash < 0) {
            return new Exact(entry);
        }
        var base = entry.substring(0, slash);
        int prefixLength;
        try {
            prefixLength = Integer.parseInt(entry.substring(slash + 1));
        } catch (NumberFormatException e) {
            prefixLength = -1;
        }
        return new Cidr(base, prefixLength);
    }

    record Exact(String address) implements AllowEntry {}

    record Cidr(String baseAddress, int prefixLength) implements AllowEntry {}
}
