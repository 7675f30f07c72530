package io.github.respkv.resp;

import java.nio.ByteBuffer;

/**
 * RESP2协议中的一个值，可以是请求也可以是响应。
 */
public interface RespData {

    byte[] toBytes();

    default ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(toBytes());
    }
}
