package io.github.respkv.resp;

/**
 * 字节流不符合RESP2语法。对连接来说是致命错误，解码器状态随之失效。
 */
public class RespDecodeException extends Exception {
    private static final long serialVersionUID = -3180254517327731469L;

    public RespDecodeException(String message) {
        super(message);
    }
}
