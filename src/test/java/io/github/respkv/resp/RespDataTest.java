package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RespDataTest {

    @Test
    void simpleString() {
        assertArrayEquals("+OK\r\n".getBytes(), RespSimpleString.OK.toBytes());
    }

    @Test
    void error() {
        assertArrayEquals("-ERR EXEC without MULTI\r\n".getBytes(),
                RespError.withUTF8("ERR EXEC without MULTI").toBytes());
    }

    @Test
    void integer() {
        assertArrayEquals(":-42\r\n".getBytes(), RespInteger.with(-42).toBytes());
    }

    @Test
    void bulkStringLengthIsByteLength() {
        byte[] expected = "$3\r\n值\r\n".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(expected, RespBulkString.withUTF8("值").toBytes());
        assertEquals(3, RespBulkString.withUTF8("值").getLength());
    }

    @Test
    void nullBulkString() {
        assertArrayEquals("$-1\r\n".getBytes(), RespBulkString.nullBulkString().toBytes());
        assertNull(RespBulkString.nullBulkString().asUTF8());
    }

    @Test
    void array() {
        RespArray array = RespArray.with(RespSimpleString.OK, RespBulkString.withUTF8("1"),
                RespArray.with(RespInteger.with(2)), RespArray.empty());
        assertArrayEquals("*4\r\n+OK\r\n$1\r\n1\r\n*1\r\n:2\r\n*0\r\n".getBytes(), array.toBytes());
    }

    @Test
    void singleLineMustNotContainNewline() {
        assertThrows(IllegalArgumentException.class, () -> RespSimpleString.withUTF8("a\r\nb"));
        assertThrows(IllegalArgumentException.class, () -> RespError.withUTF8("a\nb"));
    }

    @Test
    void equality() {
        assertEquals(RespBulkString.withUTF8("v"), RespBulkString.with("v".getBytes()));
        assertNotEquals(RespSimpleString.withUTF8("v"), RespError.withUTF8("v"));
        assertNotEquals(RespSimpleString.withUTF8("v"), RespBulkString.withUTF8("v"));
    }

    @Test
    void invalidUtf8DecodesToReplacementChar() {
        RespBulkString bs = RespBulkString.with(new byte[]{'a', (byte) 0xff});
        assertEquals("a\uFFFD", bs.asUTF8());
        assertArrayEquals(new byte[]{'a', (byte) 0xff}, bs.getContent());
    }

    @Test
    void arrayElementTakesTypeOfCaller() {
        RespArray array = RespArray.with(RespSimpleString.OK, RespBulkString.withUTF8("1"));
        RespBulkString element = array.get(1);
        assertEquals("1", element.asUTF8());

        assertThrows(ClassCastException.class, () -> {
            RespSimpleString wrong = array.get(1);
            fail("cast should fail, got " + wrong);
        });
    }
}
