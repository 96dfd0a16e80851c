package io.blockstore.core.net;

import io.blockstore.core.protocol.BlockStoreException;
import io.blockstore.core.protocol.ProtocolLimits;
import io.blockstore.core.protocol.messages.BlockStoreResponse;
import io.blockstore.core.rpc.RequestHandler;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.CharsetUtil;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Framed TCP front end: 4-byte big-endian length, then a UTF-8 JSON
 * {@link Envelope}. Requests are executed off the I/O threads since backend
 * calls may block on disk.
 */
public final class BlockStoreSocketServer {
    private static final Logger LOG = Logger.getLogger(BlockStoreSocketServer.class.getName());
    private static final String TRANSPORT = "socket";

    private final RequestHandler handler;
    private final String bindAddress;
    private final int port;

    private final NioEventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final NioEventLoopGroup workerGroup = new NioEventLoopGroup();
    private final EventExecutorGroup requestGroup;
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private Channel serverChannel;

    public BlockStoreSocketServer(RequestHandler handler, String bindAddress, int port) {
        this(handler, bindAddress, port, Math.max(2, Runtime.getRuntime().availableProcessors()));
    }

    public BlockStoreSocketServer(RequestHandler handler, String bindAddress, int port, int requestThreads) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.requestGroup = new DefaultEventExecutorGroup(Math.max(1, requestThreads));
    }

    public void start() {
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            configurePipeline(ch.pipeline());
                        }
                    });

            serverChannel = bootstrap.bind(bindAddress, port).sync().channel();
            channels.add(serverChannel);
            LOG.info(() -> "Block store socket server listening on " + bindAddress + ':' + port());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting socket server", e);
        }
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        if (serverChannel == null) {
            return port;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        channels.close().awaitUninterruptibly();
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        requestGroup.shutdownGracefully();
        LOG.info("Block store socket server stopped");
    }

    static void configureFraming(ChannelPipeline pipeline) {
        pipeline.addLast(new LengthFieldBasedFrameDecoder(ProtocolLimits.MAX_FRAME_BYTES, 0, 4, 0, 4));
        pipeline.addLast(new LengthFieldPrepender(4));
        pipeline.addLast(new StringDecoder(CharsetUtil.UTF_8));
        pipeline.addLast(new StringEncoder(CharsetUtil.UTF_8));
        pipeline.addLast(new EnvelopeCodec());
    }

    private void configurePipeline(ChannelPipeline pipeline) {
        configureFraming(pipeline);
        pipeline.addLast(requestGroup, new RequestChannelHandler());
    }

    private final class RequestChannelHandler extends SimpleChannelInboundHandler<Envelope> {
        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            channels.add(ctx.channel());
            LOG.fine(() -> "Client connected: " + ctx.channel().remoteAddress());
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            channels.remove(ctx.channel());
            LOG.fine(() -> "Client disconnected: " + ctx.channel().remoteAddress());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Envelope msg) {
            if (msg.request() == null) {
                Envelope reply = msg.hasError()
                        ? msg
                        : Envelope.error(msg.id(), RequestHandler.toErrorReply(
                                BlockStoreException.invalid("Envelope carries no request")));
                ctx.writeAndFlush(reply);
                return;
            }
            Envelope reply;
            try {
                BlockStoreResponse response = handler.handle(msg.request(), TRANSPORT);
                reply = Envelope.response(msg.id(), response);
            } catch (RuntimeException e) {
                reply = Envelope.error(msg.id(), RequestHandler.toErrorReply(e));
            }
            ctx.writeAndFlush(reply);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.WARNING, "Socket channel error from " + ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}
