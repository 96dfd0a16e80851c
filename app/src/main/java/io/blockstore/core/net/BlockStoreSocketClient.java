package io.blockstore.core.net;

import io.blockstore.core.protocol.BlockStoreException;
import io.blockstore.core.protocol.ErrorCode;
import io.blockstore.core.protocol.messages.BlockStoreRequest;
import io.blockstore.core.protocol.messages.BlockStoreResponse;
import io.blockstore.core.protocol.messages.ErrorReply;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client side of {@link BlockStoreSocketServer}. Requests may be pipelined;
 * replies are matched to callers by envelope id.
 */
public final class BlockStoreSocketClient implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(BlockStoreSocketClient.class.getName());

    private final NioEventLoopGroup group = new NioEventLoopGroup(1);
    private final Map<Long, CompletableFuture<BlockStoreResponse>> pending = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1L);
    private final Channel channel;

    private BlockStoreSocketClient(String host, int port) {
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        BlockStoreSocketServer.configureFraming(ch.pipeline());
                        ch.pipeline().addLast(new ReplyHandler());
                    }
                });
        try {
            this.channel = bootstrap.connect(host, port).sync().channel();
        } catch (InterruptedException e) {
            group.shutdownGracefully();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while connecting to " + host + ':' + port, e);
        } catch (RuntimeException e) {
            group.shutdownGracefully();
            throw e;
        }
    }

    public static BlockStoreSocketClient connect(String host, int port) {
        return new BlockStoreSocketClient(host, port);
    }

    /** Send without waiting; the future fails with {@link BlockStoreException} on an error reply. */
    public CompletableFuture<BlockStoreResponse> send(BlockStoreRequest request) {
        long id = nextId.getAndIncrement();
        CompletableFuture<BlockStoreResponse> future = new CompletableFuture<>();
        pending.put(id, future);
        // Cancelled or timed-out callers must not leave their slot behind.
        future.whenComplete((response, error) -> pending.remove(id, future));
        channel.writeAndFlush(Envelope.request(id, request)).addListener(write -> {
            if (!write.isSuccess()) {
                future.completeExceptionally(write.cause());
            }
        });
        return future;
    }

    public BlockStoreResponse call(BlockStoreRequest request, Duration timeout) {
        CompletableFuture<BlockStoreResponse> future = send(request);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for reply", e);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new IllegalStateException("No reply within " + timeout, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof BlockStoreException bse) {
                throw bse;
            }
            throw new IllegalStateException("Request failed", e.getCause());
        }
    }

    @Override
    public void close() {
        channel.close().awaitUninterruptibly();
        group.shutdownGracefully();
        failPending(new IllegalStateException("Client closed"));
    }

    private void failPending(Throwable cause) {
        for (Long id : pending.keySet()) {
            CompletableFuture<BlockStoreResponse> future = pending.remove(id);
            if (future != null) {
                future.completeExceptionally(cause);
            }
        }
    }

    int pendingCount() {
        return pending.size();
    }

    static BlockStoreException toException(ErrorReply error) {
        ErrorCode code = ErrorCode.fromWireName(error.error()).orElse(ErrorCode.STORAGE_FAILURE);
        return new BlockStoreException(code, error.message());
    }

    private final class ReplyHandler extends SimpleChannelInboundHandler<Envelope> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Envelope msg) {
            CompletableFuture<BlockStoreResponse> future = pending.remove(msg.id());
            if (future == null) {
                LOG.fine(() -> "Dropping reply for unknown request id " + msg.id());
                return;
            }
            if (msg.hasError()) {
                future.completeExceptionally(toException(msg.error()));
            } else if (msg.response() != null) {
                future.complete(msg.response());
            } else {
                future.completeExceptionally(new BlockStoreException(ErrorCode.INVALID_REQUEST,
                        "Reply " + msg.id() + " carries neither response nor error"));
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            failPending(new IllegalStateException("Connection closed"));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.WARNING, "Socket client error", cause);
            failPending(cause);
            ctx.close();
        }
    }
}
