package com.questrail.homehub.viewer.netty;

import com.questrail.homehub.broadcast.BroadcastHub;
import com.questrail.homehub.broadcast.ConnectResult;
import com.questrail.homehub.internal.time.WallClock;
import com.questrail.homehub.message.HeartbeatMessage;
import com.questrail.homehub.message.InitialStateMessage;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * ViewerChannelHandler
 * -----------------------------------------------------------------------------
 * Per-channel glue between a WebSocket and the {@link BroadcastHub}.
 *
 * <ul>
 *   <li>Handshake complete: join the hub; if admitted, send the initial
 *       state.</li>
 *   <li>Reader idle: send a heartbeat.</li>
 *   <li>Text frame: ignored. Reading it already reset the idle timer.</li>
 *   <li>Channel inactive: leave the hub.</li>
 * </ul>
 *
 * <p>Messages that are not text frames (plain HTTP requests) pass through to
 * the next handler.</p>
 */
final class ViewerChannelHandler extends SimpleChannelInboundHandler<TextWebSocketFrame>
{
    private static final Logger log = LoggerFactory.getLogger(ViewerChannelHandler.class);

    private final BroadcastHub hub;
    private final Supplier<InitialStateMessage> initialState;
    private final WallClock wallClock;

    private NettyViewerConnection connection;

    ViewerChannelHandler(BroadcastHub hub, Supplier<InitialStateMessage> initialState, WallClock wallClock)
    {
        this.hub = Objects.requireNonNull(hub, "hub");
        this.initialState = Objects.requireNonNull(initialState, "initialState");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
    {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            onHandshake(ctx);
        } else if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.READER_IDLE) {
            if (connection != null) {
                hub.send(connection, HeartbeatMessage.INSTANCE);
            }
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    private void onHandshake(ChannelHandlerContext ctx)
    {
        NettyViewerConnection candidate = new NettyViewerConnection(ctx.channel(), wallClock.now());
        ConnectResult result = hub.connect(candidate);
        if (!result.isAccepted()) {
            return;
        }
        connection = candidate;
        hub.send(candidate, initialState.get());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame)
    {
        if (log.isTraceEnabled()) {
            log.trace("Ignoring viewer message from {}: {}", ctx.channel().remoteAddress(), frame.text());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        NettyViewerConnection c = connection;
        connection = null;
        if (c != null) {
            hub.disconnect(c);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        log.warn("Viewer channel {} failed", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
