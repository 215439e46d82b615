package com.questrail.echosrv.net;

import com.questrail.echosrv.error.FdInheritanceException;

import jnr.constants.platform.SocketLevel;
import jnr.constants.platform.SocketOption;
import jnr.ffi.Memory;
import jnr.ffi.Platform;
import jnr.ffi.Pointer;
import jnr.ffi.Runtime;
import jnr.ffi.byref.IntByReference;

/**
 * {@link DescriptorValidator} backed by {@code getsockopt(SO_TYPE)} and {@code getsockname}.
 */
public enum NativeDescriptorValidator implements DescriptorValidator
{
    INSTANCE;

    // Large enough for any sockaddr (sockaddr_storage is 128 bytes).
    private static final int SOCKADDR_STORAGE_SIZE = 128;

    @Override
    public void checkSocketKind(int descriptor, SocketKind expected) {
        IntByReference value = new IntByReference(0);
        IntByReference length = new IntByReference(Integer.BYTES);
        int rc = NativeSockets.INSTANCE.getsockopt(
                descriptor,
                SocketLevel.SOL_SOCKET.intValue(),
                SocketOption.SO_TYPE.intValue(),
                value,
                length);
        if (rc < 0) {
            throw new FdInheritanceException(descriptor,
                    "getsockopt(SO_TYPE) failed on fd " + descriptor + ": "
                            + SocketDescriptors.describeErrno(SocketDescriptors.lastErrno()));
        }

        int actual = value.intValue();
        if (actual != expected.nativeValue()) {
            throw new FdInheritanceException(descriptor,
                    "Socket type mismatch on fd " + descriptor + ": expected " + expected.nativeName()
                            + ", got " + describeType(actual));
        }
    }

    @Override
    public void checkAddressFamily(int descriptor, AddressFamily expected) {
        int actual = queryFamily(descriptor);
        if (actual != expected.nativeValue()) {
            throw new FdInheritanceException(descriptor,
                    "Address family mismatch on fd " + descriptor + ": expected " + expected.description()
                            + ", got " + AddressFamily.describe(actual));
        }
    }

    private static int queryFamily(int descriptor) {
        Runtime runtime = Runtime.getRuntime(NativeSockets.INSTANCE);
        Pointer address = Memory.allocateDirect(runtime, SOCKADDR_STORAGE_SIZE, true);
        IntByReference length = new IntByReference(SOCKADDR_STORAGE_SIZE);

        if (NativeSockets.INSTANCE.getsockname(descriptor, address, length) < 0) {
            throw new FdInheritanceException(descriptor,
                    "getsockname failed on fd " + descriptor + ": "
                            + SocketDescriptors.describeErrno(SocketDescriptors.lastErrno()));
        }

        // BSD layouts carry sa_len in the first byte and an 8-bit family after it.
        if (Platform.getNativePlatform().isBSD()) {
            return address.getByte(1) & 0xFF;
        }
        return address.getShort(0) & 0xFFFF;
    }

    private static String describeType(int type) {
        for (SocketKind kind : SocketKind.values()) {
            if (kind.nativeValue() == type) {
                return kind.nativeName();
            }
        }
        return "socket type " + type;
    }
}
