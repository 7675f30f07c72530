package io.github.respkv.resp;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;

@EqualsAndHashCode(callSuper = true)
public class RespError extends RespString {
    static final char firstChar = '-';

    public static RespError withUTF8(String msg) {
        return new RespError(msg, StandardCharsets.UTF_8);
    }

    private RespError(String content, Charset charset) {
        super(content, charset);
    }

    @Override
    char getFirstChar() {
        return firstChar;
    }

    @Override
    public String toString() {
        return "RespError [" + getContent() + "]";
    }
}
