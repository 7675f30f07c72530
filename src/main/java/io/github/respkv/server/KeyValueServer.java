package io.github.respkv.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.AsynchronousChannelGroup;
import java.nio.channels.AsynchronousServerSocketChannel;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.CompletionHandler;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.respkv.kv.KeyValueStore;
import lombok.Builder;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 使用java nio.2监听指定端口，每个连接交给一个{@link ConnectionHandler}处理，
 * 所有连接共享同一个{@link KeyValueStore}。
 */
public class KeyValueServer {
    private static final Logger logger          = LoggerFactory.getLogger(KeyValueServer.class);
    static final         int    DEFAULT_THREADS = 20;

    // 配置的监听地址，端口可以是0
    private final InetSocketAddress socketAddress;
    private final KeyValueStore     store;
    private final int               threads;
    // 服务socket channel
    private AsynchronousServerSocketChannel serverSocketChannel;
    // 连接的读写回调都在这个group的线程上执行
    private AsynchronousChannelGroup channelGroup;

    @Builder
    public KeyValueServer(@NonNull InetSocketAddress socketAddress,
                          @NonNull KeyValueStore store,
                          int threads) {
        this.socketAddress = socketAddress;
        this.store = store;
        this.threads = threads > 0 ? threads : DEFAULT_THREADS;
    }

    /**
     * 绑定端口并开始接受连接，立即返回。
     *
     * @throws IOException 绑定失败
     */
    public void start() throws IOException {
        Preconditions.checkState(serverSocketChannel == null, "server already started");
        channelGroup = AsynchronousChannelGroup.withFixedThreadPool(threads,
                new ThreadFactoryBuilder().setNameFormat("respkv-io-%d").build());
        try {
            serverSocketChannel = AsynchronousServerSocketChannel.open(channelGroup);
            serverSocketChannel.bind(socketAddress);
        } catch (IOException e) {
            try {
                channelGroup.shutdownNow();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        serverSocketChannel.accept(null, new CompletionHandler<AsynchronousSocketChannel, Void>() {
            @Override
            public void completed(AsynchronousSocketChannel channel, Void attachment) {
                if (serverSocketChannel.isOpen()) {
                    serverSocketChannel.accept(null, this);
                }
                ConnectionHandler.builder().channel(channel).store(store).build().start();
            }

            @Override
            public void failed(Throwable exc, Void attachment) {
                if (serverSocketChannel.isOpen()) {
                    logger.error("accept failed.", exc);
                    serverSocketChannel.accept(null, this);
                }
            }
        });
        logger.info("kv server listening on {}.", getLocalAddress());
    }

    /**
     * @return 实际监听的地址，配置端口为0时可以拿到系统分配的端口
     */
    public InetSocketAddress getLocalAddress() throws IOException {
        Preconditions.checkState(serverSocketChannel != null, "server not started");
        return (InetSocketAddress) serverSocketChannel.getLocalAddress();
    }

    /**
     * 等待服务关闭
     */
    public void awaitTermination() throws InterruptedException {
        Preconditions.checkState(channelGroup != null, "server not started");
        while (!channelGroup.awaitTermination(1, TimeUnit.DAYS)) {
            logger.trace("kv server still running.");
        }
    }

    /**
     * 关闭服务，已经建立的连接也随之关闭
     *
     * @throws IOException 关闭异常
     */
    public void shutdown() throws IOException {
        if (serverSocketChannel == null) {
            return;
        }
        serverSocketChannel.close();
        channelGroup.shutdownNow();
        logger.info("kv server on {} stopped.", socketAddress);
    }
}
