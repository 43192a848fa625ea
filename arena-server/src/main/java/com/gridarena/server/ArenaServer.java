package com.gridarena.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import com.gridarena.engine.Broadcaster;
import com.gridarena.engine.CommandProcessor;
import com.gridarena.handler.GameCommandHandler;
import com.gridarena.session.SessionLifecycle;
import com.gridarena.state.GameState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * TCP game server built on Netty's NIO transport.
 *
 * Threading Model:
 * - Boss Group: 1 thread that accepts incoming connections
 * - Worker Group: socket I/O and line framing
 * - Session threads: {@link GameCommandHandler} runs on a single-threaded
 *   executor owned by its channel, which is where the game guard is taken
 *   (see {@link ArenaChannelInitializer})
 *
 * Keeping the game handler off the worker threads means a session waiting
 * on the guard, or on a slow peer during a broadcast, never stalls socket
 * I/O for anyone else.
 */
public class ArenaServer {

    private static final Logger logger = LoggerFactory.getLogger(ArenaServer.class);

    private final ServerConfig config;
    private final GameState gameState;
    private final SessionLifecycle lifecycle;
    private final CommandProcessor processor;

    // Netty event loop groups
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public ArenaServer(ServerConfig config) {
        this(config, GameState.create());
    }

    public ArenaServer(ServerConfig config, GameState gameState) {
        this.config = config;
        this.gameState = gameState;
        Broadcaster broadcaster = new Broadcaster(gameState);
        this.lifecycle = new SessionLifecycle(gameState, broadcaster);
        this.processor = new CommandProcessor(gameState, broadcaster);
    }

    /**
     * Binds the listening socket. Returns once the server is accepting
     * connections; use {@link #awaitTermination()} to block until shutdown.
     */
    public void bind() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // TCP options
                .option(ChannelOption.SO_BACKLOG, config.getBacklog())
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ArenaChannelInitializer(config, lifecycle, processor));

        serverChannel = bootstrap.bind(config.getPort()).sync().channel();

        logger.info("Server started on port {}. Waiting for players...", config.getPort());
    }

    /**
     * Binds and blocks until the server channel is closed.
     */
    public void start() throws InterruptedException {
        try {
            bind();
            awaitTermination();
        } finally {
            shutdown();
        }
    }

    public void awaitTermination() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    /**
     * Stops accepting connections and releases all threads.
     */
    public void shutdown() {
        logger.info("Shutting down server...");

        if (serverChannel != null) {
            serverChannel.close();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }

        logger.info("Server shutdown complete.");
    }

    /**
     * The port actually bound, which differs from the configured one when
     * the configuration asks for port 0.
     */
    public int getBoundPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public GameState getGameState() {
        return gameState;
    }
}
