package com.questrail.echosrv.transport.netty;

import com.questrail.echosrv.error.EchoException;
import com.questrail.echosrv.error.EchoIoException;
import com.questrail.echosrv.error.EchoTimeoutException;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ConnectTimeoutException;
import io.netty.util.concurrent.EventExecutor;

import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Bridges Netty futures to {@link CompletableFuture} and maps Netty failures onto the
 * engine's exception hierarchy.
 */
final class NettyFutures
{
    private NettyFutures()
    {
    }

    static CompletableFuture<Void> toCompletable(ChannelFuture future, String operation)
    {
        CompletableFuture<Void> result = new CompletableFuture<>();
        future.addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                result.complete(null);
            }
            else if (f.isCancelled()) {
                result.completeExceptionally(new EchoIoException(operation + " cancelled"));
            }
            else {
                result.completeExceptionally(translate(f.cause(), operation));
            }
        });
        return result;
    }

    /**
     * Fails {@code future} with {@link EchoTimeoutException} unless it completes within
     * {@code timeout}. The timer runs on {@code executor}.
     */
    static <T> CompletableFuture<T> withDeadline(CompletableFuture<T> future,
                                                 EventExecutor executor,
                                                 Duration timeout,
                                                 String operation)
    {
        if (future.isDone()) {
            return future;
        }
        ScheduledFuture<?> timer;
        try {
            timer = executor.schedule(
                    () -> future.completeExceptionally(timedOut(operation, timeout)),
                    timeout.toNanos(),
                    TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new EchoIoException(operation + " failed: event loop shut down", e));
            return future;
        }
        future.whenComplete((r, e) -> timer.cancel(false));
        return future;
    }

    static EchoTimeoutException timedOut(String operation, Duration timeout)
    {
        return new EchoTimeoutException(operation + " timed out after " + timeout.toMillis() + " ms", timeout);
    }

    static Throwable unwrap(Throwable t)
    {
        Throwable c = t;
        while ((c instanceof CompletionException || c instanceof ExecutionException) && c.getCause() != null) {
            c = c.getCause();
        }
        return c;
    }

    static EchoException translate(Throwable cause, String operation)
    {
        Throwable c = unwrap(cause);
        if (c instanceof EchoException e) {
            return e;
        }
        if (c instanceof ConnectTimeoutException) {
            return new EchoTimeoutException(operation + " timed out: " + c.getMessage(), null);
        }
        if (c instanceof ClosedChannelException) {
            return new EchoIoException(operation + " failed: channel closed", c);
        }
        return new EchoIoException(operation + " failed: " + c.getMessage(), c);
    }
}
