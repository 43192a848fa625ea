package com.gridarena.handler;

import com.gridarena.engine.CommandProcessor;
import com.gridarena.engine.CommandResult;
import com.gridarena.protocol.Replies;
import com.gridarena.session.ChannelTransport;
import com.gridarena.session.PlayerSession;
import com.gridarena.session.SessionLifecycle;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one player's connection: one instance per channel.
 *
 * The pipeline in front of it splits the byte stream into lines, so every
 * channelRead0 call is exactly one command.
 * - channelActive: join the game (or be turned away when it is full)
 * - channelRead0: run the command, reply to this player if needed; a reply
 *   that cannot be delivered closes the connection like any other
 *   transport failure
 * - channelInactive: leave the game
 *
 * Threading Model:
 * - Installed on an executor owned by its channel, so all callbacks for one
 *   channel run on one thread of their own and never on a Netty I/O thread
 * - That thread may block on the game guard and on sends to other players
 */
public class GameCommandHandler extends SimpleChannelInboundHandler<String> {

    private static final Logger logger = LoggerFactory.getLogger(GameCommandHandler.class);

    private final SessionLifecycle lifecycle;
    private final CommandProcessor processor;
    private final long sendTimeoutMillis;

    private PlayerSession session;

    public GameCommandHandler(SessionLifecycle lifecycle, CommandProcessor processor, long sendTimeoutMillis) {
        this.lifecycle = lifecycle;
        this.processor = processor;
        this.sendTimeoutMillis = sendTimeoutMillis;
    }

    /**
     * Called when the TCP connection is established.
     */
    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        logger.debug("New connection: {}", ctx.channel().remoteAddress());
        session = lifecycle.join(new ChannelTransport(ctx.channel(), sendTimeoutMillis));
        super.channelActive(ctx);
    }

    /**
     * Called when the connection is closed, whether by the client, a quit,
     * or the server freeing the slot.
     */
    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (session != null) {
            lifecycle.leave(session);
            session = null;
        }
        super.channelInactive(ctx);
    }

    /**
     * Called with one line of client input, delimiter already stripped.
     */
    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        // channelInactive may clear the field while the command runs
        PlayerSession current = session;
        if (current == null) {
            return;
        }

        CommandResult result = processor.process(current, line.trim());

        boolean delivered = result.getReply() == null || current.reply(result.getReply());
        if (!delivered) {
            logger.warn("Reply to player {} could not be delivered, closing", current.getSymbol());
        }
        if (!delivered || result.isTerminated()) {
            ctx.close();
        }
    }

    /**
     * An over-long line is a protocol error and the session carries on;
     * anything else ends the session.
     */
    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        PlayerSession current = session;
        if (cause instanceof TooLongFrameException && current != null) {
            logger.debug("Player {} sent an over-long line", current.getSymbol());
            if (!current.reply(Replies.UNKNOWN_COMMAND)) {
                logger.warn("Reply to player {} could not be delivered, closing", current.getSymbol());
                ctx.close();
            }
            return;
        }
        logger.error("Connection error on {}", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
