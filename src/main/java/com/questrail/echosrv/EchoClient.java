package com.questrail.echosrv;

import java.nio.charset.StandardCharsets;

/**
 * Blocking client for one server. Failures surface as
 * {@link com.questrail.echosrv.error.EchoException} subclasses.
 */
public interface EchoClient extends AutoCloseable
{
    byte[] echo(byte[] request);

    default String echoString(String request)
    {
        return new String(echo(request.getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8);
    }

    @Override
    void close();
}
