package com.questrail.echosrv.transport.netty;

import com.questrail.echosrv.net.AddressFamily;
import com.questrail.echosrv.net.SocketProvisioner;

import io.netty.channel.Channel;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.epoll.EpollSocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.util.List;

/**
 * TCP over IPv4 or IPv6.
 */
public final class TcpTransport extends AbstractNettyStreamTransport
{
    public TcpTransport()
    {
        this(NettyEventLoops.shared(), new SocketProvisioner());
    }

    public TcpTransport(NettyEventLoops loops, SocketProvisioner provisioner)
    {
        super(loops, provisioner);
    }

    @Override
    public String name()
    {
        return "tcp";
    }

    @Override
    protected List<AddressFamily> acceptedFamilies()
    {
        return AddressFamily.NETWORK;
    }

    @Override
    protected Class<? extends ServerChannel> serverChannelType()
    {
        return loops.isNative() ? EpollServerSocketChannel.class : NioServerSocketChannel.class;
    }

    @Override
    protected Class<? extends Channel> clientChannelType()
    {
        return loops.isNative() ? EpollSocketChannel.class : NioSocketChannel.class;
    }

    @Override
    protected ServerChannel inheritedServerChannel(int descriptor)
    {
        return new EpollServerSocketChannel(descriptor);
    }
}
