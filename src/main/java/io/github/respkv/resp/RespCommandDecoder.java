package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.primitives.Longs;

/**
 * 请求侧解码器：客户端命令总是bulk string数组，{@code *<N>\r\n} 后跟N个 {@code $<len>\r\n<bytes>\r\n}。
 * <p>
 * 解码可以跨多次调用继续。每次调用只消费完整的单元（数组头那一行，或者一个完整的bulk string连同结尾CRLF），
 * 不完整的单元一个字节也不消费；已经读到的元素保存在{@link CommandBuilder}中，下次调用接着攒。
 * 消费的字节数就是{@link ByteBuf#getReaderIndex()}前进的距离。
 * </p>
 * 非线程安全，每个连接一个实例。
 */
public class RespCommandDecoder {
    static final int MAX_ARITY       = 1024 * 1024;
    static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    // "*1048576\r\n" 这种长度行不可能超过这个长度
    static final int MAX_LENGTH_LINE = 32;

    /**
     * 正在组装的命令：目标元素个数和已经读到的元素。
     */
    private static class CommandBuilder {
        private final int                  arity;
        private final List<RespBulkString> parts;

        CommandBuilder(int arity) {
            this.arity = arity;
            this.parts = new ArrayList<>(Math.min(arity, 64));
        }

        void add(RespBulkString part) {
            Preconditions.checkState(parts.size() < arity);
            parts.add(part);
        }

        boolean isComplete() {
            return parts.size() == arity;
        }

        RespArray build() {
            Preconditions.checkState(isComplete());
            return RespArray.with(parts);
        }
    }

    private CommandBuilder builder;

    public static RespCommandDecoder create() {
        return new RespCommandDecoder();
    }

    /**
     * 尽可能多地推进解码。
     *
     * @param in 累积的网络数据
     * @return 一个完整的命令帧；数据不够时返回null，下次带着更多数据再调用
     * @throws RespDecodeException 数据不符合协议
     */
    public RespArray decode(ByteBuf in) throws RespDecodeException {
        while (builder == null) {
            if (!in.isReadable()) {
                return null;
            }
            checkType(in, RespArray.firstChar);
            int eol = findLineEnd(in);
            if (eol == -1) {
                return null;
            }
            long arity = parseLength(in, eol);
            in.skipBytes(eol + 2 - in.getReaderIndex());
            if (arity < -1) {
                throw new RespDecodeException("invalid multibulk length: " + arity);
            }
            if (arity > MAX_ARITY) {
                throw new RespDecodeException("multibulk length too large: " + arity);
            }
            // *0和*-1不是命令，跳过
            if (arity > 0) {
                builder = new CommandBuilder((int) arity);
            }
        }

        while (!builder.isComplete()) {
            if (!in.isReadable()) {
                return null;
            }
            checkType(in, RespBulkString.firstChar);
            int eol = findLineEnd(in);
            if (eol == -1) {
                return null;
            }
            long len = parseLength(in, eol);
            if (len == -1) {
                in.skipBytes(eol + 2 - in.getReaderIndex());
                builder.add(RespBulkString.nullBulkString());
                continue;
            }
            if (len < 0) {
                throw new RespDecodeException("invalid bulk length: " + len);
            }
            if (len > MAX_BULK_LENGTH) {
                throw new RespDecodeException("bulk length too large: " + len);
            }
            int bodyStart = eol + 2;
            int bodyEnd = bodyStart + (int) len;
            if (in.getWriterIndex() < bodyEnd + 2) {
                return null;
            }
            if (in.getByte(bodyEnd) != '\r' || in.getByte(bodyEnd + 1) != '\n') {
                throw new RespDecodeException("bulk string not terminated by CRLF");
            }
            byte[] body = in.getBytes(bodyStart, (int) len);
            in.skipBytes(bodyEnd + 2 - in.getReaderIndex());
            builder.add(RespBulkString.with(body));
        }

        RespArray frame = builder.build();
        builder = null;
        return frame;
    }

    /**
     * @return 是否有命令正在组装中
     */
    public boolean isPending() {
        return builder != null;
    }

    private static void checkType(ByteBuf in, char expected) throws RespDecodeException {
        byte b = in.getByte(in.getReaderIndex());
        if (b != expected) {
            throw new RespDecodeException("expected '" + expected + "', got " + printable(b));
        }
    }

    /**
     * 查找readerIndex开始的这一行的'\r'位置，行内容从类型字节之后开始。
     *
     * @return '\r'的绝对索引；行还没收全返回-1
     */
    private static int findLineEnd(ByteBuf in) throws RespDecodeException {
        int from = in.getReaderIndex() + 1;
        int lf = in.indexOf(from, in.getWriterIndex(), (byte) '\n');
        if (lf == -1) {
            if (in.readableBytes() > MAX_LENGTH_LINE) {
                throw new RespDecodeException("length line too long");
            }
            return -1;
        }
        if (lf == from || in.getByte(lf - 1) != '\r') {
            throw new RespDecodeException("length line not terminated by CRLF");
        }
        return lf - 1;
    }

    private static long parseLength(ByteBuf in, int eol) throws RespDecodeException {
        int from = in.getReaderIndex() + 1;
        String s = new String(in.getBytes(from, eol - from), StandardCharsets.US_ASCII);
        Long len = s.isEmpty() ? null : Longs.tryParse(s);
        if (len == null) {
            throw new RespDecodeException("invalid length: '" + CharMatcher.javaIsoControl().replaceFrom(s, '?') + "'");
        }
        return len;
    }

    private static String printable(byte b) {
        return b >= 0x20 && b < 0x7f ? "'" + (char) b + "'" : String.format("0x%02x", b);
    }
}
