package com.questrail.echosrv.net;

import jnr.ffi.LibraryLoader;
import jnr.ffi.Platform;
import jnr.ffi.Pointer;
import jnr.ffi.annotations.In;
import jnr.ffi.annotations.Out;
import jnr.ffi.annotations.SaveError;
import jnr.ffi.byref.IntByReference;

/**
 * JNR-FFI bindings for the libc socket calls used to inspect inherited descriptors.
 *
 * <p>Every call records {@code errno}; read it through {@link SocketDescriptors#lastErrno()}.</p>
 */
public interface NativeSockets
{
    NativeSockets INSTANCE = loadInstance();

    private static NativeSockets loadInstance() {
        return LibraryLoader.create(NativeSockets.class)
                .load(Platform.getNativePlatform().getStandardCLibraryName());
    }

    @SaveError
    int getsockopt(int sockfd, int level, int optname, @Out IntByReference optval, @In @Out IntByReference optlen);

    @SaveError
    int getsockname(int sockfd, @Out Pointer addr, @In @Out IntByReference addrlen);

    @SaveError
    int fcntl(int fd, int cmd, int arg);

    @SaveError
    int dup(int fd);
}
