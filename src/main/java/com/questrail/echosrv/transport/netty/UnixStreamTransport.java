package com.questrail.echosrv.transport.netty;

import com.questrail.echosrv.net.AddressFamily;
import com.questrail.echosrv.net.BindTarget;
import com.questrail.echosrv.net.SocketProvisioner;

import io.netty.channel.Channel;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.EpollDomainSocketChannel;
import io.netty.channel.epoll.EpollServerDomainSocketChannel;

import java.util.List;

/**
 * Unix-domain stream sockets. Needs the native epoll transport.
 *
 * <p>A socket file created by a fresh bind is removed when its listener closes;
 * inherited sockets are left alone.</p>
 */
public final class UnixStreamTransport extends AbstractNettyStreamTransport
{
    public UnixStreamTransport()
    {
        this(NettyEventLoops.shared(), new SocketProvisioner());
    }

    public UnixStreamTransport(NettyEventLoops loops, SocketProvisioner provisioner)
    {
        super(loops, provisioner);
    }

    @Override
    public String name()
    {
        return "unix-stream";
    }

    @Override
    protected List<AddressFamily> acceptedFamilies()
    {
        return AddressFamily.LOCAL;
    }

    @Override
    protected Class<? extends ServerChannel> serverChannelType()
    {
        return EpollServerDomainSocketChannel.class;
    }

    @Override
    protected Class<? extends Channel> clientChannelType()
    {
        return EpollDomainSocketChannel.class;
    }

    @Override
    protected ServerChannel inheritedServerChannel(int descriptor)
    {
        return new EpollServerDomainSocketChannel(descriptor);
    }

    @Override
    protected boolean requiresNativeTransport()
    {
        return true;
    }

    @Override
    protected void afterClose(BindTarget target)
    {
        UnixSocketFiles.delete(target);
    }
}
