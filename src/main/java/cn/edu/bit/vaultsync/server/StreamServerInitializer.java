package cn.edu.bit.vaultsync.server;

import cn.edu.bit.vaultsync.crypto.CipherSuite;
import cn.edu.bit.vaultsync.handler.StreamServerHandler;
import cn.edu.bit.vaultsync.remote.RemoteEndpoint;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpServerExpectContinueHandler;
import io.netty.handler.stream.ChunkedWriteHandler;
import io.netty.util.concurrent.EventExecutorGroup;

public class StreamServerInitializer extends ChannelInitializer<SocketChannel> {
    private final RemoteEndpoint endpoint;
    private final CipherSuite cipherSuite;
    private final String root;
    private final String secret;
    private final EventExecutorGroup businessGroup;

    public StreamServerInitializer(RemoteEndpoint endpoint, CipherSuite cipherSuite, String root, String secret,
            EventExecutorGroup businessGroup) {
        this.endpoint = endpoint;
        this.cipherSuite = cipherSuite;
        this.root = root;
        this.secret = secret;
        this.businessGroup = businessGroup;
    }

    @Override
    protected void initChannel(SocketChannel socketChannel) {
        ChannelPipeline channelPipeline = socketChannel.pipeline();
        channelPipeline.addLast(new HttpServerCodec()); // HTTP 编解码器
        channelPipeline.addLast(new HttpServerExpectContinueHandler());
        channelPipeline.addLast(new ChunkedWriteHandler()); // 分块发送解密后的内容
        // 读取远端和解密都是阻塞操作，放到业务线程组
        channelPipeline.addLast(businessGroup, new StreamServerHandler(endpoint, cipherSuite, root, secret));
    }
}
