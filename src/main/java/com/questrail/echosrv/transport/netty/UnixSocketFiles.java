package com.questrail.echosrv.transport.netty;

import com.questrail.echosrv.net.BindTarget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Socket-file housekeeping for Unix-domain transports.
 */
final class UnixSocketFiles
{
    private static final Logger log = LoggerFactory.getLogger(UnixSocketFiles.class);

    private static final AtomicLong CLIENT_COUNTER = new AtomicLong();

    private UnixSocketFiles()
    {
    }

    /** A fresh path in the temp directory for a client endpoint the server can reply to. */
    static Path clientPath()
    {
        String name = "echosrv-client-" + ProcessHandle.current().pid() + "-" + CLIENT_COUNTER.incrementAndGet() + ".sock";
        return Path.of(System.getProperty("java.io.tmpdir"), name);
    }

    static void delete(BindTarget target)
    {
        if (!(target instanceof BindTarget.UnixPath unix)) {
            return;
        }
        try {
            Files.deleteIfExists(unix.path());
        } catch (IOException e) {
            log.warn("Could not remove socket file {}: {}", unix.path(), e.getMessage());
        }
    }
}
