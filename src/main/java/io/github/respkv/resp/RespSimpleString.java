package io.github.respkv.resp;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RespSimpleString extends RespString {
    static final char firstChar = '+';

    public static final RespSimpleString OK     = withUTF8("OK");
    public static final RespSimpleString QUEUED = withUTF8("QUEUED");
    public static final RespSimpleString PONG   = withUTF8("PONG");

    public static RespSimpleString withUTF8(String content) {
        return new RespSimpleString(content, StandardCharsets.UTF_8);
    }

    private RespSimpleString(String content, Charset charset) {
        super(content, charset);
    }

    @Override
    char getFirstChar() {
        return firstChar;
    }
}
