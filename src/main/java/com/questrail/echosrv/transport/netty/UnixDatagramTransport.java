package com.questrail.echosrv.transport.netty;

import com.questrail.echosrv.error.EchoIoException;
import com.questrail.echosrv.net.AddressFamily;
import com.questrail.echosrv.net.BindTarget;
import com.questrail.echosrv.net.SocketProvisioner;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.epoll.EpollDomainDatagramChannel;
import io.netty.channel.unix.DomainDatagramPacket;
import io.netty.channel.unix.DomainSocketAddress;

import java.net.SocketAddress;
import java.util.List;

/**
 * Unix-domain datagram sockets. Needs the native epoll transport.
 *
 * <p>Client endpoints bind a private temporary path so the server has an address to
 * reply to; the file is removed when the endpoint closes.</p>
 */
public final class UnixDatagramTransport extends AbstractNettyDatagramTransport
{
    public UnixDatagramTransport()
    {
        this(NettyEventLoops.shared(), new SocketProvisioner());
    }

    public UnixDatagramTransport(NettyEventLoops loops, SocketProvisioner provisioner)
    {
        super(loops, provisioner);
    }

    @Override
    public String name()
    {
        return "unix-datagram";
    }

    @Override
    protected List<AddressFamily> acceptedFamilies()
    {
        return AddressFamily.LOCAL;
    }

    @Override
    protected Class<? extends Channel> channelType()
    {
        return EpollDomainDatagramChannel.class;
    }

    @Override
    protected Channel inheritedChannel(int descriptor)
    {
        return new EpollDomainDatagramChannel(descriptor);
    }

    @Override
    protected Object newPacket(ByteBuf content, SocketAddress recipient)
    {
        if (!(recipient instanceof DomainSocketAddress domain)) {
            throw new EchoIoException("Unix datagram socket cannot send to " + recipient);
        }
        return new DomainDatagramPacket(content, domain);
    }

    @Override
    protected BindTarget clientTarget(BindTarget server)
    {
        return BindTarget.unix(UnixSocketFiles.clientPath());
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
