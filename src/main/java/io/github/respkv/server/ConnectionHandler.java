package io.github.respkv.server;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.CompletionHandler;
import java.util.ArrayList;
import java.util.List;

import com.google.common.primitives.Bytes;
import io.github.respkv.command.CommandProcessor;
import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.resp.ByteBuf;
import io.github.respkv.resp.RespArray;
import io.github.respkv.resp.RespCommandDecoder;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespDecodeException;
import io.github.respkv.resp.RespError;
import lombok.Builder;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * 驱动一个客户端连接：读数据 → 解出所有完整的命令帧 → 逐个处理 → 把这一批响应一次写回 → 写完以后再读。
 * 读和写交替进行，所以同一连接上的响应严格按请求顺序返回。
 * </p>
 * <p>
 * 客户端关闭、协议错误、读写失败都会关闭这个连接，不影响其他连接。协议错误先回复一次错误再关闭。
 * </p>
 */
public class ConnectionHandler implements CompletionHandler<Integer, Void> {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);

    private final AsynchronousSocketChannel channel;
    private final ByteBuffer                readBuffer;
    // 还没解码完的请求数据
    private final ByteBuf                   inbound;
    private final RespCommandDecoder        decoder   = RespCommandDecoder.create();
    private final CommandProcessor          processor;
    private final SocketAddress             remote;

    @Builder
    ConnectionHandler(@NonNull AsynchronousSocketChannel channel, @NonNull KeyValueStore store, int bufferSize) {
        this.channel = channel;
        this.processor = new CommandProcessor(store);
        int size = bufferSize > 0 ? bufferSize : 4096;
        this.readBuffer = ByteBuffer.allocate(size);
        this.inbound = ByteBuf.allocate(size);
        this.remote = remoteAddress(channel);
    }

    /**
     * 开始处理这个连接，直到连接关闭。立即返回，后续在channel group的线程上进行。
     */
    public void start() {
        logger.debug("connection from {} opened.", remote);
        read();
    }

    private void read() {
        readBuffer.clear();
        channel.read(readBuffer, null, this);
    }

    @Override
    public void completed(Integer result, Void attachment) {
        if (result == -1) {
            logger.debug("connection from {} closed by peer.", remote);
            close();
            return;
        }

        readBuffer.flip();
        inbound.writeBytes(readBuffer);

        List<RespData> replies = new ArrayList<>();
        boolean closeAfterWrite = false;
        try {
            RespArray frame;
            while ((frame = decoder.decode(inbound)) != null) {
                replies.add(processor.process(frame));
            }
        } catch (RespDecodeException e) {
            logger.warn("protocol error from {}: {}", remote, e.getMessage());
            replies.add(RespError.withUTF8("ERR Protocol error: " + e.getMessage()));
            closeAfterWrite = true;
        } finally {
            inbound.discardReadBytes();
        }

        if (replies.isEmpty()) {
            read();
            return;
        }
        write(replies, closeAfterWrite);
    }

    @Override
    public void failed(Throwable exc, Void attachment) {
        if (exc instanceof AsynchronousCloseException) {
            logger.debug("connection from {} closed while reading.", remote);
        } else {
            logger.error("read from {} failed.", remote, exc);
        }
        close();
    }

    private void write(List<RespData> replies, boolean closeAfterWrite) {
        byte[][] parts = new byte[replies.size()][];
        for (int i = 0; i < parts.length; i++) {
            parts[i] = replies.get(i).toBytes();
        }
        ByteBuffer out = ByteBuffer.wrap(Bytes.concat(parts));
        channel.write(out, out, new WriteHandler(closeAfterWrite));
    }

    void close() {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("close connection from {} failed.", remote, e);
        }
    }

    private static SocketAddress remoteAddress(AsynchronousSocketChannel channel) {
        try {
            return channel.getRemoteAddress();
        } catch (IOException e) {
            logger.debug("remote address unavailable.", e);
            return null;
        }
    }

    /**
     * 把一批响应全部写完，然后继续读下一批请求；需要关闭时写完就关闭。
     */
    private class WriteHandler implements CompletionHandler<Integer, ByteBuffer> {
        private final boolean closeAfterWrite;

        WriteHandler(boolean closeAfterWrite) {
            this.closeAfterWrite = closeAfterWrite;
        }

        @Override
        public void completed(Integer result, ByteBuffer buffer) {
            if (buffer.hasRemaining()) {
                channel.write(buffer, buffer, this);
            } else if (closeAfterWrite) {
                close();
            } else {
                read();
            }
        }

        @Override
        public void failed(Throwable exc, ByteBuffer buffer) {
            logger.error("write to {} failed.", remote, exc);
            close();
        }
    }
}
