package com.questrail.echosrv.client;

import com.questrail.echosrv.error.EchoException;
import com.questrail.echosrv.error.EchoIoException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Blocks on a transport future and rethrows its failure unwrapped.
 */
final class Await
{
    private Await() {
    }

    static <T> T result(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw rethrow(e);
        }
    }

    private static RuntimeException rethrow(Throwable t) {
        Throwable c = t;
        while ((c instanceof CompletionException || c instanceof ExecutionException) && c.getCause() != null) {
            c = c.getCause();
        }
        if (c instanceof EchoException e) {
            return e;
        }
        if (c instanceof RuntimeException e) {
            return e;
        }
        return new EchoIoException(c.getMessage(), c);
    }
}
