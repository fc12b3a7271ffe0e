package sentinel.core.service;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import sentinel.core.model.AllowEntry;

/**
 * Matches client addresses against IP allowlist entries.
 *
 * <p>Entries without {@code /} are compared textually. CIDR entries compare the top
 * {@code prefixLength} bits of the two addresses: whole bytes first, then the
 * remaining bits under a {@code 0xFF << (8 - remainingBits)} mask. Anything that does
 * not parse, mixes address families or has an out-of-range prefix never matches.
 *
 * <p>Addresses are parsed literally and never resolved through DNS.
 */
@ApplicationScoped
public class AddressMatcher {

    private static final int IPV4_BYTES = 4;
    private static final int IPV6_BYTES = 16;
    private static final int IPV6_GROUPS = 8;

    public boolean matchesAny(String clientAddress, List<String> entries) {
        for (var entry : entries) {
            if (matches(clientAddress, entry)) {
                return true;
            }
        }
        return false;
    }

    public boolean matches(String clientAddress, String entry) {
        if (clientAddress == null || entry == null) {
            return false;
        }
        var parsed = AllowEntry.parse(entry);
        if (parsed instanceof AllowEntry.Exact exact) {
            return exact.address().equals(clientAddress);
        }
        var cidr = (AllowEntry.Cidr) parsed;
        return matchesCidr(clientAddress, cidr);
    }

    /**
     * Parses a literal IPv4 or IPv6 address.
     *
     * @param address the address text
     * @return 4 or 16 bytes, or empty if the text is not an address literal
     */
    public Optional<byte[]> parse(String address) {
        if (address == null || address.isEmpty()) {
            return Optional.empty();
        }
        if (address.indexOf(':') >= 0) {
            return Optional.ofNullable(parseIpv6(address));
        }
        return Optional.ofNullable(parseIpv4(address));
    }

    private boolean matchesCidr(String clientAddress, AllowEntry.Cidr cidr) {
        final var prefixLength = cidr.prefixLength();
        if (prefixLength < 0) {
            return false;
        }

        final var networkBytes = parse(cidr.baseAddress()).orElse(null);
        final var sourceBytes = parse(clientAddress).orElse(null);
        if (networkBytes == null || sourceBytes == null) {
            return false;
        }
        if (networkBytes.length != sourceBytes.length) {
            return false;
        }
        if (prefixLength > networkBytes.length * 8) {
            return false;
        }

        final var fullBytes = prefixLength / 8;
        final var remainingBits = prefixLength % 8;

        for (var i = 0; i < fullBytes; i++) {
            if (networkBytes[i] != sourceBytes[i]) {
                return false;
            }
        }

        if (remainingBits > 0) {
            final var mask = (byte) (0xFF << (8 - remainingBits));
            if ((networkBytes[fullBytes] & mask) != (sourceBytes[fullBytes] & mask)) {
                return false;
            }
        }

        return true;
    }

    private byte[] parseIpv4(String address) {
        final var parts = address.split("\\.", -1);
        if (parts.length != IPV4_BYTES) {
            return null;
        }
        final var bytes = new byte[IPV4_BYTES];
        for (var i = 0; i < IPV4_BYTES; i++) {
            final var part = parts[i];
            if (part.isEmpty() || part.length() > 3 || !isDecimal(part)) {
                return null;
            }
            final var value = Integer.parseInt(part);
            if (value > 255) {
                return null;
            }
            bytes[i] = (byte) value;
        }
        return bytes;
    }

    /**
     * Expands {@code ::} into the zero groups it stands for, so {@code ::1} becomes
     * seven {@code 0000} groups followed by {@code 0001}. A trailing dotted IPv4 part
     * counts as two groups.
     */
    private byte[] parseIpv6(String address) {
        var text = address;
        final var zone = text.indexOf('%');
        if (zone >= 0) {
            text = text.substring(0, zone);
        }

        byte[] ipv4Tail = null;
        final var lastColon = text.lastIndexOf(':');
        if (text.indexOf('.', lastColon) >= 0) {
            ipv4Tail = parseIpv4(text.substring(lastColon + 1));
            if (ipv4Tail == null) {
                return null;
            }
            final var head = text.substring(0, lastColon + 1);
            text = head.endsWith("::") ? head : head.substring(0, head.length() - 1);
        }

        final var doubleColon = text.indexOf("::");
        if (doubleColon >= 0 && text.indexOf("::", doubleColon + 1) >= 0) {
            return null;
        }

        final int[] left;
        final int[] right;
        if (doubleColon >= 0) {
            left = parseGroups(text.substring(0, doubleColon));
            right = parseGroups(text.substring(doubleColon + 2));
        } else {
            left = parseGroups(text);
            right = new int[0];
        }
        if (left == null || right == null) {
            return null;
        }

        final var tailGroups = ipv4Tail != null ? 2 : 0;
        final var groupCount = left.length + right.length + tailGroups;
        if (doubleColon >= 0 ? groupCount >= IPV6_GROUPS : groupCount != IPV6_GROUPS) {
            return null;
        }

        final var groups = new int[IPV6_GROUPS];
        System.arraycopy(left, 0, groups, 0, left.length);
        final var rightStart = IPV6_GROUPS - tailGroups - right.length;
        System.arraycopy(right, 0, groups, rightStart, right.length);

        final var bytes = new byte[IPV6_BYTES];
        for (var i = 0; i < IPV6_GROUPS; i++) {
            bytes[i * 2] = (byte) (groups[i] >> 8);
            bytes[i * 2 + 1] = (byte) groups[i];
        }
        if (ipv4Tail != null) {
            System.arraycopy(ipv4Tail, 0, bytes, IPV6_BYTES - IPV4_BYTES, IPV4_BYTES);
        }
        return bytes;
    }

    private int[] parseGroups(String text) {
        if (text.isEmpty()) {
            return new int[0];
        }
        final var parts = text.split(":", -1);
        final var groups = new int[parts.length];
        for (var i = 0; i < parts.length; i++) {
            final var part = parts[i];
            if (part.isEmpty() || part.length() > 4 || !isHex(part)) {
                return null;
            }
            groups[i] = Integer.parseInt(part, 16);
        }
        return groups;
    }

    private static boolean isDecimal(String text) {
        for (var i = 0; i < text.length(); i++) {
            if (text.charAt(i) < '0' || text.charAt(i) > '9') {
                return false;
            }
        }
        return true;
    }

    private static boolean isHex(String text) {
        for (var i = 0; i < text.length(); i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
