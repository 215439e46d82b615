package com.questrail.echosrv.net;

import java.util.List;
import java.util.Optional;

/**
 * Socket address family as reported by {@code getsockname}.
 */
public enum AddressFamily {
    INET(jnr.constants.platform.AddressFamily.AF_INET, "AF_INET (IPv4)"),
    INET6(jnr.constants.platform.AddressFamily.AF_INET6, "AF_INET6 (IPv6)"),
    UNIX(jnr.constants.platform.AddressFamily.AF_UNIX, "AF_UNIX (Unix domain)");

    /** Families accepted by network transports. */
    public static final List<AddressFamily> NETWORK = List.of(INET, INET6);

    /** Families accepted by filesystem-path transports. */
    public static final List<AddressFamily> LOCAL = List.of(UNIX);

    private final jnr.constants.platform.AddressFamily nativeFamily;
    private final String description;

    AddressFamily(jnr.constants.platform.AddressFamily nativeFamily, String description) {
        this.nativeFamily = nativeFamily;
        this.description = description;
    }

    public int nativeValue() {
        return nativeFamily.intValue();
    }

    public String description() {
        return description;
    }

    public static Optional<AddressFamily> fromNative(int value) {
        for (AddressFamily family : values()) {
            if (family.nativeValue() == value) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }

    /** Diagnostic name for a raw family value, known or not. */
    public static String describe(int value) {
        return fromNative(value)
                .map(AddressFamily::description)
                .orElse("unknown address family " + value);
    }
}
