package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 整数响应，列表push命令用它返回push之后的长度。
 */
@EqualsAndHashCode(callSuper = true)
@ToString
public class RespInteger extends RespString {
    static final char firstChar = ':';
    @Getter
    private final long n;

    public static RespInteger with(long n) {
        return new RespInteger(n);
    }

    private RespInteger(long n) {
        super(String.valueOf(n), StandardCharsets.US_ASCII);
        this.n = n;
    }

    @Override
    char getFirstChar() {
        return firstChar;
    }
}
