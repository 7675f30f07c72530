package io.github.respkv.resp;

import java.nio.ByteBuffer;
import java.util.Arrays;

import com.google.common.base.Preconditions;
import lombok.Getter;

/**
 * jdk自带的{@link ByteBuffer}需要flip和rewind，用来做增量解码很别扭。
 * 该类的读写位置是独立的：网络数据追加在writerIndex，解码器从readerIndex消费，
 * 解码器可以按绝对索引向前查看数据而不移动readerIndex。
 */
public class ByteBuf {
    // 底层字节数组
    private byte[] buf;
    // 当前读位置
    @Getter
    private int    readerIndex;
    // 当前写位置
    @Getter
    private int    writerIndex;

    private ByteBuf(int i) {
        buf = new byte[i];
        readerIndex = 0;
        writerIndex = 0;
    }

    public static ByteBuf allocate(int i) {
        Preconditions.checkArgument(i > 0, "capacity must be positive");
        return new ByteBuf(i);
    }

    public static ByteBuf wrap(byte[] bytes) {
        ByteBuf buf = new ByteBuf(Math.max(bytes.length, 1));
        return buf.writeBytes(bytes);
    }

    /**
     * @return 当前还可以写入的大小
     */
    public int writableBytes() {
        return buf.length - writerIndex;
    }

    /**
     * 写入bb中剩余的全部数据，bb的position随之前进
     * @param bb 数据源
     * @return 本对象
     */
    public ByteBuf writeBytes(ByteBuffer bb) {
        int n = bb.remaining();
        ensureWritable(n);
        bb.get(buf, writerIndex, n);
        writerIndex += n;
        return this;
    }

    public ByteBuf writeBytes(byte[] bytes) {
        ensureWritable(bytes.length);
        System.arraycopy(bytes, 0, buf, writerIndex, bytes.length);
        writerIndex += bytes.length;
        return this;
    }

    public ByteBuf writeByte(byte b) {
        ensureWritable(1);
        buf[writerIndex++] = b;
        return this;
    }

    /**
     * 是否有数据未消费，可读取
     * @return true 有，false 没有
     */
    public boolean isReadable() {
        return readerIndex < writerIndex;
    }

    /**
     * 读一个字节
     * @return 字节
     * @throws IllegalStateException 没有可读数据
     */
    public byte readByte() {
        Preconditions.checkState(readerIndex < writerIndex, "no readable bytes");
        return buf[readerIndex++];
    }

    public int readableBytes() {
        return writerIndex - readerIndex;
    }

    /**
     * 读数据
     * @param bytes 读到的数据的存放数组
     * @return 本对象
     * @throws IndexOutOfBoundsException 没有足够数据填充数组
     */
    public ByteBuf readBytes(byte[] bytes) {
        if (bytes.length > readableBytes()) {
            throw new IndexOutOfBoundsException("need " + bytes.length + " bytes, readable " + readableBytes());
        }
        System.arraycopy(buf, readerIndex, bytes, 0, bytes.length);
        readerIndex += bytes.length;
        return this;
    }

    public ByteBuf skipBytes(int n) {
        if (n > readableBytes()) {
            throw new IndexOutOfBoundsException("skip " + n + " bytes, readable " + readableBytes());
        }
        readerIndex += n;
        return this;
    }

    /**
     * 使用绝对索引读取字节，不移动readerIndex
     * @param index 索引
     * @return 字节值
     * @throws IndexOutOfBoundsException 索引不在可读区间内
     */
    public byte getByte(int index) {
        if (index < readerIndex || index >= writerIndex) {
            throw new IndexOutOfBoundsException("index " + index + " out of [" + readerIndex + ", " + writerIndex + ")");
        }
        return buf[index];
    }

    /**
     * 按绝对索引复制一段数据，不移动readerIndex
     */
    public byte[] getBytes(int index, int length) {
        if (index < readerIndex || index + length > writerIndex) {
            throw new IndexOutOfBoundsException();
        }
        return Arrays.copyOfRange(buf, index, index + length);
    }

    /**
     * 查找某字节值的索引
     * @param fromIndex 从该索引开始
     * @param toIndex 到该索引结束（不包含）
     * @param value 查找的字节值
     * @return 该值的第一个索引值，没有找到返回-1
     */
    public int indexOf(int fromIndex, int toIndex, byte value) {
        for (int i = fromIndex; i < toIndex; i++) {
            if (buf[i] == value) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 丢弃已经消费的数据，把未读数据移动到数组开头。
     */
    public ByteBuf discardReadBytes() {
        if (readerIndex == 0) {
            return this;
        }
        int readable = readableBytes();
        System.arraycopy(buf, readerIndex, buf, 0, readable);
        readerIndex = 0;
        writerIndex = readable;
        return this;
    }

    /**
     * 缓存最大容量
     * @return 容量
     */
    public int capacity() {
        return buf.length;
    }

    private void ensureWritable(int remaining) {
        if (writableBytes() < remaining) {
            capacity(buf.length * 2 + remaining);
        }
    }

    private void capacity(int i) {
        Preconditions.checkState(i > buf.length);
        buf = Arrays.copyOf(buf, i);
    }
}
