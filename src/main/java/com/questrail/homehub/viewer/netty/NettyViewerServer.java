package com.questrail.homehub.viewer.netty;

import com.questrail.homehub.broadcast.BroadcastHub;
import com.questrail.homehub.internal.time.WallClock;
import com.questrail.homehub.message.InitialStateMessage;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * NettyViewerServer
 * =============================================================================
 * WebSocket server for dashboard viewers, and owner of the hub's event loop.
 *
 * <h2>Architectural Role</h2>
 * A <strong>pure transport adapter</strong>: it accepts WebSocket connections
 * on one path and wires each into the {@link BroadcastHub}. It holds no hub
 * state of its own.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) MUST
 * NOT escape this package. The event loop is exposed only as a
 * {@link ScheduledExecutorService}.
 *
 * <h2>Single event loop</h2>
 * The server runs on a single-threaded {@link NioEventLoopGroup} that accepts
 * connections, performs all channel I/O, and also executes the hub's
 * scheduled work through {@link #eventLoop()}. The group is created in the
 * constructor, so the scheduler exists before the socket is bound.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} binds the listening socket.</li>
 *   <li>{@link #stop()} closes every viewer and the listener, then shuts the
 *       event loop down and waits for it.</li>
 * </ul>
 */
public final class NettyViewerServer
{
    private static final Logger log = LoggerFactory.getLogger(NettyViewerServer.class);

    private static final int MAX_HTTP_CONTENT = 64 * 1024;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final InetSocketAddress bindAddress;
    private final String webSocketPath;
    private final Duration heartbeatIdle;
    private final BroadcastHub hub;
    private final Supplier<InitialStateMessage> initialState;
    private final WallClock wallClock;

    private final EventLoopGroup group;
    private final ChannelGroup channels;

    private volatile Channel serverChannel;

    public NettyViewerServer(InetSocketAddress bindAddress,
                             String webSocketPath,
                             Duration heartbeatIdle,
                             BroadcastHub hub,
                             Supplier<InitialStateMessage> initialState,
                             WallClock wallClock)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.webSocketPath = Objects.requireNonNull(webSocketPath, "webSocketPath");
        this.heartbeatIdle = Objects.requireNonNull(heartbeatIdle, "heartbeatIdle");
        this.hub = Objects.requireNonNull(hub, "hub");
        this.initialState = Objects.requireNonNull(initialState, "initialState");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.group = new NioEventLoopGroup(1);
        this.channels = new DefaultChannelGroup("viewers", group.next());
    }

    /**
     * The single event loop, for use as the hub's scheduler.
     */
    public ScheduledExecutorService eventLoop()
    {
        return group.next();
    }

    /**
     * Bind the listening socket. Blocks until bound.
     *
     * @throws IOException if the address cannot be bound
     */
    public void start() throws IOException
    {
        if (serverChannel != null) {
            throw new IllegalStateException("viewer server already started");
        }

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        channels.add(ch);
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(MAX_HTTP_CONTENT));
                        p.addLast(new IdleStateHandler(heartbeatIdle.toMillis(), 0, 0, TimeUnit.MILLISECONDS));
                        p.addLast(new WebSocketServerProtocolHandler(webSocketPath));
                        p.addLast(new ViewerChannelHandler(hub, initialState, wallClock));
                        p.addLast(new ViewerHttpFallbackHandler());
                    }
                });

        ChannelFuture bind = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            throw new IOException("Cannot bind viewer server to " + bindAddress, bind.cause());
        }
        serverChannel = bind.channel();
        log.info("Viewer server listening on {}{}", serverChannel.localAddress(), webSocketPath);
    }

    /**
     * Actual listening address; useful when binding port 0.
     */
    public InetSocketAddress boundAddress()
    {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("viewer server not started");
        }
        return (InetSocketAddress) ch.localAddress();
    }

    public void stop()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
            serverChannel = null;
        }
        channels.close().awaitUninterruptibly();

        try {
            if (!group.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                    .await(SHUTDOWN_TIMEOUT_SECONDS + 1, TimeUnit.SECONDS)) {
                log.warn("Viewer event loop did not terminate within {}s", SHUTDOWN_TIMEOUT_SECONDS + 1);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
