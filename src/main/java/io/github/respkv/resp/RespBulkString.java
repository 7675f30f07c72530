package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;

import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 长度前缀的二进制安全字符串。content为null时表示null bulk string，编码为{@code $-1\r\n}。
 */
@EqualsAndHashCode
public final class RespBulkString implements RespData {
    static final char firstChar = '$';

    private static final RespBulkString NULL = new RespBulkString(null);
    private static final byte[]         CRLF = {'\r', '\n'};

    @Getter
    private final int    length;
    @Getter
    private final byte[] content;

    public static RespBulkString with(byte[] content) {
        return new RespBulkString(content);
    }

    public static RespBulkString withUTF8(String content) {
        return new RespBulkString(content.getBytes(StandardCharsets.UTF_8));
    }

    public static RespBulkString nullBulkString() {
        return NULL;
    }

    private RespBulkString(byte[] content) {
        this.content = content;
        this.length = content == null ? -1 : content.length;
    }

    public boolean isNull() {
        return content == null;
    }

    /**
     * 按UTF-8解码。不是合法UTF-8的字节会被替换成U+FFFD，解码不可逆。
     *
     * @return 解码后的内容，null bulk string返回null
     */
    public String asUTF8() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public byte[] toBytes() {
        byte[] header = (firstChar + String.valueOf(length) + "\r\n").getBytes(StandardCharsets.US_ASCII);
        if (content == null) {
            return header;
        }
        return Bytes.concat(header, content, CRLF);
    }

    @Override
    public String toString() {
        return isNull() ? "RespBulkString(null)" : "RespBulkString(" + asUTF8() + ")";
    }
}
