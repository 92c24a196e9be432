package cn.edu.bit.vaultsync.server;

import java.net.InetSocketAddress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cn.edu.bit.vaultsync.config.VaultSyncConfig;
import cn.edu.bit.vaultsync.crypto.CipherSuite;
import cn.edu.bit.vaultsync.db.DatabaseFactory;
import cn.edu.bit.vaultsync.remote.RemoteEndpoint;
import cn.edu.bit.vaultsync.service.LocalObjectStore;
import cn.edu.bit.vaultsync.session.AccountContext;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;

/**
 * 流媒体服务入口：把对象存储中的文件解密后通过 HTTP 提供出去
 */
public class VaultSync implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(VaultSync.class);
    private static final int BUSINESS_THREADS = 32;

    private final VaultSyncConfig config;
    private final InetSocketAddress address;

    private EventLoopGroup acceptors;
    private EventLoopGroup ioWorkers;
    private EventExecutorGroup storageWorkers;
    private DatabaseFactory databaseFactory;
    private Channel serverChannel;

    public VaultSync(VaultSyncConfig config, int port) {
        this.config = config;
        this.address = new InetSocketAddress(config.getServerHost(), port);
    }

    /**
     * 绑定端口后立即返回
     */
    public synchronized void bind() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Stream server already bound to " + address);
        }
        databaseFactory = new DatabaseFactory(config.getDatabasePath(), config.getDatabasePoolSize());
        RemoteEndpoint endpoint = LocalObjectStore.fromConfig(config, databaseFactory);
        var cipherSuite = new CipherSuite(config.getFormatVersion(), config.getFormatVersion());
        AccountContext account = config.getAccount();

        acceptors = new NioEventLoopGroup(1);
        ioWorkers = new NioEventLoopGroup();
        // 读取和解密数据文件会阻塞，不放在 IO 线程上
        storageWorkers = new DefaultEventExecutorGroup(BUSINESS_THREADS);

        var initializer = new StreamServerInitializer(endpoint, cipherSuite, config.getServerRoot(),
                account.secret(), storageWorkers);
        try {
            serverChannel = new ServerBootstrap()
                    .group(acceptors, ioWorkers)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(initializer)
                    .bind(address).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            logger.error("Failed to bind stream server to {}", address, e);
            close();
            throw e;
        }
        logger.info("Stream server listening on {}, serving {} (decryption {})", serverChannel.localAddress(),
                config.getServerRoot(), account.secret() == null ? "off" : "on");
    }

    public Channel channel() {
        return serverChannel;
    }

    /**
     * 阻塞直到服务端口关闭
     */
    public void awaitClose() throws InterruptedException {
        Channel channel = serverChannel;
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    @Override
    public synchronized void close() {
        if (acceptors == null) {
            return;
        }
        logger.info("Stopping stream server on {}", address);
        if (serverChannel != null && serverChannel.isOpen()) {
            serverChannel.close().syncUninterruptibly();
        }
        acceptors.shutdownGracefully().syncUninterruptibly();
        ioWorkers.shutdownGracefully().syncUninterruptibly();
        storageWorkers.shutdownGracefully().syncUninterruptibly();
        databaseFactory.shutdown();
        acceptors = null;
        serverChannel = null;
        logger.info("Stream server stopped");
    }

    static int parsePort(String[] args, int fallback) {
        if (args.length == 0) {
            return fallback;
        }
        try {
            int port = Integer.parseInt(args[0]);
            if (port > 0 && port <= 65535) {
                return port;
            }
            logger.warn("Port {} out of range, using {}", port, fallback);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed port '{}', using {}", args[0], fallback);
        }
        return fallback;
    }

    public static void main(String[] args) throws InterruptedException {
        var config = new VaultSyncConfig();
        var server = new VaultSync(config, parsePort(args, config.getServerPort()));
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "vaultsync-shutdown"));
        server.bind();
        server.awaitClose();
    }
}
