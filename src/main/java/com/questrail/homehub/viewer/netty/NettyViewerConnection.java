package com.questrail.homehub.viewer.netty;

import com.questrail.homehub.broadcast.ViewerConnection;
import com.questrail.homehub.message.EncodedViewerMessage;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import java.nio.channels.ClosedChannelException;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link ViewerConnection} over a Netty WebSocket channel.
 *
 * <p>The encoded message bytes are wrapped, not copied, so every viewer of a
 * broadcast writes the same array.</p>
 */
final class NettyViewerConnection implements ViewerConnection
{
    private final Channel channel;
    private final Instant connectedAt;

    NettyViewerConnection(Channel channel, Instant connectedAt)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.connectedAt = Objects.requireNonNull(connectedAt, "connectedAt");
    }

    @Override
    public String remoteIdentity()
    {
        return String.valueOf(channel.remoteAddress());
    }

    @Override
    public Instant connectedAt()
    {
        return connectedAt;
    }

    @Override
    public CompletionStage<Void> send(EncodedViewerMessage message)
    {
        Objects.requireNonNull(message, "message");

        CompletableFuture<Void> done = new CompletableFuture<>();
        if (!channel.isActive()) {
            done.completeExceptionally(new ClosedChannelException());
            return done;
        }

        TextWebSocketFrame frame = new TextWebSocketFrame(Unpooled.wrappedBuffer(message.utf8()));
        channel.writeAndFlush(frame).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                done.complete(null);
            } else {
                done.completeExceptionally(future.cause());
            }
        });
        return done;
    }

    @Override
    public void close(int code, String reason)
    {
        if (!channel.isActive()) {
            return;
        }
        channel.writeAndFlush(new CloseWebSocketFrame(code, reason))
                .addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public String toString()
    {
        return "NettyViewerConnection[" + remoteIdentity() + "]";
    }
}
