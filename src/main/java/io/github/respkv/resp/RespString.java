package io.github.respkv.resp;

import java.nio.charset.Charset;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 单行类型（simple string、error、integer）的公共部分：首字节 + 内容 + CRLF。
 */
@EqualsAndHashCode
@ToString
abstract class RespString implements RespData {
    @Getter
    private final String  content;
    @Getter
    private final Charset charset;

    RespString(String content, Charset charset) {
        Preconditions.checkNotNull(content);
        Preconditions.checkArgument(content.indexOf('\r') < 0, "resp single line value must not contain \\r");
        Preconditions.checkArgument(content.indexOf('\n') < 0, "resp single line value must not contain \\n");
        this.content = content;
        this.charset = charset;
    }

    abstract char getFirstChar();

    @Override
    public byte[] toBytes() {
        return (getFirstChar() + content + "\r\n").getBytes(charset);
    }
}
