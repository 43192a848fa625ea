package com.gridarena.session;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * {@link Transport} backed by a Netty channel.
 *
 * Thread Safety:
 * - Netty queues writes from any thread onto the channel's event loop
 * - Off the event loop, send() waits for the write to complete so a dead
 *   peer is reported to the broadcaster as a failed delivery
 * - On the event loop it cannot wait (Netty forbids blocking there), so a
 *   write failure instead closes the channel and the disconnect path
 *   cleans up
 */
public class ChannelTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(ChannelTransport.class);

    private final Channel channel;
    private final long sendTimeoutMillis;

    public ChannelTransport(Channel channel, long sendTimeoutMillis) {
        this.channel = channel;
        this.sendTimeoutMillis = sendTimeoutMillis;
    }

    @Override
    public boolean send(String text) {
        if (!channel.isActive()) {
            return false;
        }

        ChannelFuture future = channel.writeAndFlush(text);
        if (channel.eventLoop().inEventLoop()) {
            future.addListener(f -> {
                if (!f.isSuccess()) {
                    logger.warn("Write to {} failed, closing", describe(), f.cause());
                    channel.close();
                }
            });
            return true;
        }

        if (!future.awaitUninterruptibly(sendTimeoutMillis, TimeUnit.MILLISECONDS)) {
            logger.warn("Write to {} timed out after {}ms", describe(), sendTimeoutMillis);
            return false;
        }
        if (!future.isSuccess()) {
            logger.warn("Write to {} failed: {}", describe(), String.valueOf(future.cause()));
            return false;
        }
        return true;
    }

    @Override
    public void close() {
        if (channel.isOpen()) {
            channel.close();
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public String describe() {
        Object remote = channel.remoteAddress();
        return remote != null ? remote.toString() : channel.id().asShortText();
    }

    @Override
    public String toString() {
        return "ChannelTransport{" + describe() + ", active=" + channel.isActive() + '}';
    }
}
