package com.questrail.echosrv.transport.netty;

import com.questrail.echosrv.error.EchoIoException;
import com.questrail.echosrv.net.AddressFamily;
import com.questrail.echosrv.net.BindTarget;
import com.questrail.echosrv.net.SocketProvisioner;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.epoll.EpollDatagramChannel;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.Inet6Address;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;

/**
 * UDP over IPv4 or IPv6.
 */
public final class UdpTransport extends AbstractNettyDatagramTransport
{
    public UdpTransport()
    {
        this(NettyEventLoops.shared(), new SocketProvisioner());
    }

    public UdpTransport(NettyEventLoops loops, SocketProvisioner provisioner)
    {
        super(loops, provisioner);
    }

    @Override
    public String name()
    {
        return "udp";
    }

    @Override
    protected List<AddressFamily> acceptedFamilies()
    {
        return AddressFamily.NETWORK;
    }

    @Override
    protected Class<? extends Channel> channelType()
    {
        return loops.isNative() ? EpollDatagramChannel.class : NioDatagramChannel.class;
    }

    @Override
    protected Channel inheritedChannel(int descriptor)
    {
        return new EpollDatagramChannel(descriptor);
    }

    @Override
    protected Object newPacket(ByteBuf content, SocketAddress recipient)
    {
        if (!(recipient instanceof InetSocketAddress inet)) {
            throw new EchoIoException("UDP cannot send to " + recipient);
        }
        return new DatagramPacket(content, inet);
    }

    @Override
    protected BindTarget clientTarget(BindTarget server)
    {
        InetSocketAddress address = ((BindTarget.Network) server).address();
        boolean v6 = address.getAddress() instanceof Inet6Address;
        return BindTarget.network(v6 ? "::" : "0.0.0.0", 0);
    }
}
