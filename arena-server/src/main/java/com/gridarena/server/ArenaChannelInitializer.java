package com.gridarena.server;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;

import com.gridarena.engine.CommandProcessor;
import com.gridarena.handler.GameCommandHandler;
import com.gridarena.session.SessionLifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadFactory;

/**
 * Builds the pipeline of each accepted connection.
 *
 * Every channel gets its own single-threaded executor for the game
 * handler, so a session blocked on the game guard or on a slow peer never
 * holds up another session. The executor is shut down once the channel
 * closes.
 */
public class ArenaChannelInitializer extends ChannelInitializer<Channel> {

    private static final Logger logger = LoggerFactory.getLogger(ArenaChannelInitializer.class);

    public static final String GAME_HANDLER = "game";

    private final ServerConfig config;
    private final SessionLifecycle lifecycle;
    private final CommandProcessor processor;
    private final ThreadFactory threadFactory = new DefaultThreadFactory("arena-session");

    public ArenaChannelInitializer(ServerConfig config, SessionLifecycle lifecycle, CommandProcessor processor) {
        this.config = config;
        this.lifecycle = lifecycle;
        this.processor = processor;
    }

    @Override
    protected void initChannel(Channel ch) {
        ChannelPipeline pipeline = ch.pipeline();

        // One command per line, terminator stripped
        pipeline.addLast(new LineBasedFrameDecoder(config.getMaxLineLength()));
        pipeline.addLast(new StringDecoder(StandardCharsets.US_ASCII));
        pipeline.addLast(new StringEncoder(StandardCharsets.US_ASCII));

        // Game logic, off the I/O threads
        EventExecutor executor = new DefaultEventExecutor(threadFactory);
        pipeline.addLast(executor, GAME_HANDLER, newGameHandler());

        // The quiet period lets the pending channelInactive run before the thread exits
        ch.closeFuture().addListener(f -> {
            logger.debug("Releasing session thread of {}", ch.id().asShortText());
            executor.shutdownGracefully();
        });
    }

    protected ChannelHandler newGameHandler() {
        return new GameCommandHandler(lifecycle, processor, config.getSendTimeoutMillis());
    }
}
