package com.questrail.echosrv.server;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * The single thread a server's accept or receive loop runs on.
 */
final class ServerLoopExecutor
{
    private ServerLoopExecutor() {
    }

    static ExecutorService create(String transport) {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "echosrv-" + transport + "-loop");
            t.setDaemon(true);
            return t;
        });
    }
}
