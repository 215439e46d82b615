package com.questrail.echosrv.net;

/**
 * A descriptor that passed kind and family validation.
 *
 * <p>Only code in this package can create one, so holding an instance is proof that
 * {@link DescriptorValidator#validate} accepted the descriptor.</p>
 */
public final class ValidatedDescriptor
{
    private final int descriptor;
    private final SocketKind kind;
    private final AddressFamily family;

    ValidatedDescriptor(int descriptor, SocketKind kind, AddressFamily family) {
        this.descriptor = descriptor;
        this.kind = kind;
        this.family = family;
    }

    public int descriptor() {
        return descriptor;
    }

    public SocketKind kind() {
        return kind;
    }

    public AddressFamily family() {
        return family;
    }

    @Override
    public String toString() {
        return "ValidatedDescriptor{fd=" + descriptor + ", kind=" + kind + ", family=" + family + "}";
    }
}
