package com.questrail.echosrv.net;

import com.questrail.echosrv.error.FdInheritanceException;

import java.util.List;
import java.util.Objects;

/**
 * Checks that a raw descriptor is a socket of the expected kind and family.
 *
 * <p>Implementations supply the two OS queries; {@link #validate} fixes the order in
 * which they run.</p>
 */
public interface DescriptorValidator
{
    /**
     * @throws FdInheritanceException if the descriptor is not of {@code expected} kind or
     *         the query fails
     */
    void checkSocketKind(int descriptor, SocketKind expected);

    /**
     * @throws FdInheritanceException if the descriptor's family is not {@code expected} or
     *         the query fails
     */
    void checkAddressFamily(int descriptor, AddressFamily expected);

    /**
     * Kind first (a mismatch is final), then each accepted family in turn. When no
     * family matches, the last family failure is thrown.
     */
    default ValidatedDescriptor validate(int descriptor, SocketKind kind, List<AddressFamily> acceptedFamilies) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(acceptedFamilies, "acceptedFamilies");

        checkSocketKind(descriptor, kind);

        FdInheritanceException last = null;
        for (AddressFamily family : acceptedFamilies) {
            try {
                checkAddressFamily(descriptor, family);
                return new ValidatedDescriptor(descriptor, kind, family);
            } catch (FdInheritanceException e) {
                last = e;
            }
        }
        if (last != null) {
            throw last;
        }
        throw new FdInheritanceException(descriptor, "No valid socket families configured");
    }
}
