package fr.lapetina.provisioner.domain.inventory;

/**
 * Syntactic validation of IPv4 and IPv6 address literals.
 *
 * <p>{@link java.net.InetAddress#getByName(String)} resolves anything that is not a literal,
 * so it cannot be used to validate inventory input. This class only looks at the text:
 * <ul>
 *   <li>IPv4: four dotted decimal octets, 0-255, no leading zeros</li>
 *   <li>IPv6: eight 16-bit hex groups, at most one {@code ::}, optional trailing IPv4
 *       and optional {@code %scope} suffix</li>
 * </ul>
 */
public final class AddressLiterals {

    private static final int IPV6_GROUPS = 8;

    private AddressLiterals() {
    }

    /**
     * Returns true if the value is an IPv4 or IPv6 literal.
     */
    public static boolean isValid(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        return value.indexOf(':') >= 0 ? isIpv6(value) : isIpv4(value);
    }

    public static boolean isIpv4(String value) {
        if (value == null) {
            return false;
        }
        String[] octets = value.split("\\.", -1);
        if (octets.length != 4) {
            return false;
        }
        for (String octet : octets) {
            if (!isOctet(octet)) {
                return false;
            }
        }
        return true;
    }

    public static boolean isIpv6(String value) {
        if (value == null) {
            return false;
        }
        String address = value;
        int scope = value.indexOf('%');
        if (scope >= 0) {
            String scopeId = value.substring(scope + 1);
            if (scopeId.isEmpty() || scopeId.indexOf('%') >= 0 || scopeId.indexOf('/') >= 0) {
                return false;
            }
            address = value.substring(0, scope);
        }

        int compressed = address.indexOf("::");
        if (compressed != address.lastIndexOf("::") || address.contains(":::")) {
            return false;
        }

        if (compressed < 0) {
            int groups = countGroups(address.split(":", -1), true);
            return groups == IPV6_GROUPS;
        }

        String head = address.substring(0, compressed);
        String tail = address.substring(compressed + 2);
        int headGroups = head.isEmpty() ? 0 : countGroups(head.split(":", -1), false);
        int tailGroups = tail.isEmpty() ? 0 : countGroups(tail.split(":", -1), true);
        if (headGroups < 0 || tailGroups < 0) {
            return false;
        }
        // "::" stands for at least one zero group
        return headGroups + tailGroups <= IPV6_GROUPS - 1;
    }

    /**
     * Counts the 16-bit groups a run of colon-separated parts stands for,
     * or -1 if any part is invalid. An embedded IPv4 is only allowed as the last part
     * of the address and counts as two groups.
     */
    private static int countGroups(String[] parts, boolean endsAddress) {
        int groups = 0;
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            boolean last = i == parts.length - 1;
            if (last && endsAddress && part.indexOf('.') >= 0) {
                if (!isIpv4(part)) {
                    return -1;
                }
                groups += 2;
            } else if (isHexGroup(part)) {
                groups++;
            } else {
                return -1;
            }
        }
        return groups;
    }

    private static boolean isOctet(String octet) {
        int length = octet.length();
        if (length == 0 || length > 3) {
            return false;
        }
        if (length > 1 && octet.charAt(0) == '0') {
            return false;
        }
        int value = 0;
        for (int i = 0; i < length; i++) {
            char c = octet.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
            value = value * 10 + (c - '0');
        }
        return value <= 255;
    }

    private static boolean isHexGroup(String group) {
        int length = group.length();
        if (length == 0 || length > 4) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            char c = group.charAt(i);
            boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
            if (!hex) {
                return false;
            }
        }
        return true;
    }
}
