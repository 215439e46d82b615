package com.questrail.echosrv.net;

import com.questrail.echosrv.error.FdInheritanceException;

import jnr.constants.platform.Errno;
import jnr.constants.platform.Fcntl;
import jnr.constants.platform.OpenFlags;
import jnr.ffi.LastError;
import jnr.ffi.Runtime;

/**
 * Small wrappers over {@link NativeSockets} that turn {@code -1} returns into exceptions.
 */
public final class SocketDescriptors
{
    private SocketDescriptors() {
    }

    public static int lastErrno() {
        return LastError.getLastError(Runtime.getRuntime(NativeSockets.INSTANCE));
    }

    static String describeErrno(int errno) {
        Errno e = Errno.valueOf(errno);
        return e == Errno.__UNKNOWN_CONSTANT__ ? "errno " + errno : e.name() + " (" + e.description() + ")";
    }

    /** Switches the descriptor to non-blocking mode, as the event loop requires. */
    public static void setNonBlocking(int fd) {
        NativeSockets lib = NativeSockets.INSTANCE;
        int flags = lib.fcntl(fd, Fcntl.F_GETFL.intValue(), 0);
        if (flags < 0) {
            throw new FdInheritanceException(fd, "fcntl(F_GETFL) failed on fd " + fd + ": " + describeErrno(lastErrno()));
        }
        int nonBlocking = OpenFlags.O_NONBLOCK.intValue();
        if ((flags & nonBlocking) != 0) {
            return;
        }
        if (lib.fcntl(fd, Fcntl.F_SETFL.intValue(), flags | nonBlocking) < 0) {
            throw new FdInheritanceException(fd, "fcntl(F_SETFL) failed on fd " + fd + ": " + describeErrno(lastErrno()));
        }
    }

    /** Duplicates {@code fd}; the caller owns the returned descriptor. */
    public static int duplicate(int fd) {
        int copy = NativeSockets.INSTANCE.dup(fd);
        if (copy < 0) {
            throw new FdInheritanceException(fd, "dup failed on fd " + fd + ": " + describeErrno(lastErrno()));
        }
        return copy;
    }
}
