package ember.server;

import ember.Config;
import ember.EmberServerContext;
import ember.db.Database;
import ember.db.ExpirationSweeper;
import ember.network.ClientHandler;
import ember.protocol.netty.NettyRespDecoder;
import ember.protocol.netty.NettyRespEncoder;
import ember.utils.Log;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import java.net.InetSocketAddress;

/**
 * TCP listener. One boss thread accepts; the worker group runs every connection's
 * pipeline (decoder, encoder, {@link ClientHandler}).
 */
public class EmberServer {
    private final Config config;
    private final EmberServerContext context;
    private final ExpirationSweeper sweeper;
    private final NettyRespEncoder encoder = new NettyRespEncoder();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public EmberServer(Config config, Database db) {
        this.config = config;
        this.context = new EmberServerContext(config, db);
        this.sweeper = new ExpirationSweeper(db, config.sweepIntervalMillis, config.sweepSampleSize, config.sweepMaxRounds);
    }

    /** Binds and starts serving. Returns the bound port. */
    public synchronized int start() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("server already started");
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.workerThreads);
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .childOption(ChannelOption.TCP_NODELAY, true)
             .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK, new WriteBufferWaterMark(32 * 1024, 64 * 1024))
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) throws Exception {
                     ch.pipeline().addLast(new NettyRespDecoder(config.newCodec()));
                     ch.pipeline().addLast(encoder);
                     ch.pipeline().addLast(new ClientHandler(context));
                 }
             });

            ChannelFuture f = b.bind(config.host, config.port).await();
            if (!f.isSuccess()) {
                throw new IllegalStateException("Failed to bind " + config.host + ":" + config.port, f.cause());
            }
            serverChannel = f.channel();
        } catch (InterruptedException | RuntimeException e) {
            shutdownGroups();
            throw e;
        }

        int port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        context.setBoundPort(port);
        sweeper.start();
        Log.info("Ready on " + config.host + ":" + port);
        return port;
    }

    public synchronized void stop() {
        sweeper.stop();
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        shutdownGroups();
    }

    private void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully().syncUninterruptibly();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully().syncUninterruptibly();
            workerGroup = null;
        }
    }

    /** Blocks until the listening channel closes. */
    public void awaitTermination() throws InterruptedException {
        Channel ch;
        synchronized (this) {
            ch = serverChannel;
        }
        if (ch != null) {
            ch.closeFuture().sync();
        }
    }

    public EmberServerContext getContext() {
        return context;
    }

    public ExpirationSweeper getSweeper() {
        return sweeper;
    }
}
