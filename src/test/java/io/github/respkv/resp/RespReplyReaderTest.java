package io.github.respkv.resp;

import java.nio.ByteBuffer;
import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RespReplyReaderTest {
    private RespReplyReader reader;

    @BeforeEach
    void beforeEach() {
        reader = new RespReplyReader();
    }

    @Test
    void simpleString() throws RespDecodeException {
        reader.feed(ByteBuffer.wrap("+OK\r\n".getBytes()));
        RespSimpleString s = reader.next();
        assertEquals(RespSimpleString.OK, s);
        assertNull(reader.next());
    }

    @Test
    void lineSplitAcrossFeeds() throws RespDecodeException {
        reader.feed("+PO".getBytes());
        assertNull(reader.next());
        reader.feed("NG\r".getBytes());
        assertNull(reader.next());

        reader.feed("\n".getBytes());
        assertEquals(RespSimpleString.PONG, reader.next());
    }

    @Test
    void errorAndInteger() throws RespDecodeException {
        reader.feed("-ERR unknown command 'FOO'\r\n:102201\r\n".getBytes());

        RespError e = reader.next();
        assertEquals("ERR unknown command 'FOO'", e.getContent());
        RespInteger i = reader.next();
        assertEquals(102201, i.getN());
    }

    @Test
    void bulkString() throws RespDecodeException {
        reader.feed("$6\r\nfoo".getBytes());
        assertNull(reader.next());
        reader.feed("bar\r".getBytes());
        assertNull(reader.next());
        reader.feed("\n".getBytes());

        RespBulkString bs = reader.next();
        assertArrayEquals("foobar".getBytes(), bs.getContent());
    }

    @Test
    void bulkStringWithCrlfInside() throws RespDecodeException {
        reader.feed(RespBulkString.withUTF8("a\r\nb").toBytes());
        assertEquals(RespBulkString.withUTF8("a\r\nb"), reader.next());
    }

    @Test
    void nullBulkString() throws RespDecodeException {
        reader.feed("$-1\r\n".getBytes());
        assertSame(RespBulkString.nullBulkString(), reader.next());
    }

    @Test
    void arrayOfReplies() throws RespDecodeException {
        RespArray replies = RespArray.with(RespSimpleString.OK, RespInteger.with(2),
                RespBulkString.withUTF8("v"), RespBulkString.nullBulkString(),
                RespError.withUTF8("WRONGTYPE Operation against a key holding the wrong kind of value"));
        byte[] bytes = replies.toBytes();

        reader.feed(Arrays.copyOf(bytes, bytes.length - 3));
        assertNull(reader.next());
        reader.feed(Arrays.copyOfRange(bytes, bytes.length - 3, bytes.length));

        assertEquals(replies, reader.next());
    }

    @Test
    void emptyArray() throws RespDecodeException {
        reader.feed("*0\r\n".getBytes());
        assertEquals(RespArray.empty(), reader.next());
    }

    @Test
    void repliesComeOutInOrder() throws RespDecodeException {
        reader.feed("+QUEUED\r\n:3\r\n$-1\r\n".getBytes());

        assertEquals(RespSimpleString.QUEUED, reader.next());
        assertEquals(RespInteger.with(3), reader.next());
        assertEquals(RespBulkString.nullBulkString(), reader.next());
        assertNull(reader.next());
    }

    @Test
    void nestedArrayIsRejected() {
        reader.feed("*1\r\n*0\r\n".getBytes());
        assertThrows(RespDecodeException.class, () -> reader.next());
    }

    @Test
    void malformedReplies() {
        assertThrows(RespDecodeException.class, () -> new RespReplyReader().feed("?1\r\n".getBytes()).next());
        assertThrows(RespDecodeException.class, () -> new RespReplyReader().feed(":abc\r\n".getBytes()).next());
        assertThrows(RespDecodeException.class, () -> new RespReplyReader().feed("+OK\n".getBytes()).next());
        assertThrows(RespDecodeException.class, () -> new RespReplyReader().feed("*-1\r\n".getBytes()).next());
    }
}
