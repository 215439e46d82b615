package com.questrail.echosrv.server;

import com.questrail.echosrv.error.EchoTimeoutException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

final class Failures
{
    private Failures() {
    }

    static Throwable unwrap(Throwable t) {
        Throwable c = t;
        while ((c instanceof CompletionException || c instanceof ExecutionException) && c.getCause() != null) {
            c = c.getCause();
        }
        return c;
    }

    static boolean isTimeout(Throwable t) {
        return unwrap(t) instanceof EchoTimeoutException;
    }

    static String describe(Throwable t) {
        Throwable c = unwrap(t);
        return c.getMessage() != null ? c.getMessage() : c.getClass().getSimpleName();
    }
}
