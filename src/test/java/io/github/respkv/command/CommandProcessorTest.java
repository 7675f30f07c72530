package io.github.respkv.command;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.resp.RespArray;
import io.github.respkv.resp.RespBulkString;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespError;
import io.github.respkv.resp.RespInteger;
import io.github.respkv.resp.RespSimpleString;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.github.respkv.command.CommandsTest.frame;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CommandProcessorTest {
    private KeyValueStore    store;
    private CommandProcessor processor;

    @BeforeEach
    void beforeEach() {
        store = new KeyValueStore();
        processor = new CommandProcessor(store);
    }

    private RespData send(String... parts) {
        return processor.process(frame(parts));
    }

    private static RespArray bulks(String... values) {
        RespData[] datas = Arrays.stream(values).map(RespBulkString::withUTF8).toArray(RespData[]::new);
        return RespArray.with(datas);
    }

    @Test
    void ping() {
        assertEquals(RespSimpleString.PONG, send("PING"));
        assertEquals(RespBulkString.withUTF8("hi"), send("PING", "hi"));
    }

    @Test
    void setGet() {
        assertEquals(RespSimpleString.OK, send("SET", "k", "v"));
        assertEquals(RespBulkString.withUTF8("v"), send("GET", "k"));
        assertEquals(RespBulkString.nullBulkString(), send("GET", "missing"));
    }

    @Test
    void lists() {
        assertEquals(RespInteger.with(2), send("RPUSH", "l", "a", "b"));
        assertEquals(RespInteger.with(3), send("LPUSH", "l", "z"));
        assertEquals(bulks("z", "a", "b"), send("LRANGE", "l", "0", "-1"));
        assertEquals(RespArray.empty(), send("LRANGE", "missing", "0", "-1"));
    }

    @Test
    void wrongType() {
        send("SET", "k", "v");
        RespError expected = RespError.withUTF8("WRONGTYPE Operation against a key holding the wrong kind of value");
        assertEquals(expected, send("LPUSH", "k", "a"));
        assertEquals(expected, send("LRANGE", "k", "0", "1"));

        send("RPUSH", "l", "a");
        assertEquals(expected, send("GET", "l"));
    }

    @Test
    void unknownCommandLeavesStoreUnchanged() {
        KeyValueStore mocked = mock(KeyValueStore.class);
        CommandProcessor p = new CommandProcessor(mocked);

        assertEquals(RespError.withUTF8("ERR unknown command 'FLUSHALL'"), p.process(frame("FLUSHALL")));
        verifyNoInteractions(mocked);
    }

    @Test
    void transaction() {
        assertEquals(RespSimpleString.OK, send("MULTI"));
        assertTrue(processor.isInTransaction());
        assertEquals(RespSimpleString.QUEUED, send("SET", "k", "v"));
        assertEquals(RespSimpleString.QUEUED, send("RPUSH", "l", "a", "b"));
        assertEquals(RespSimpleString.QUEUED, send("GET", "k"));
        assertEquals(0, store.size());

        assertEquals(RespArray.with(RespSimpleString.OK, RespInteger.with(2), RespBulkString.withUTF8("v")),
                send("EXEC"));
        assertFalse(processor.isInTransaction());
        assertEquals(RespBulkString.withUTF8("v"), send("GET", "k"));
    }

    @Test
    void queuedCommandsAreNotVisibleBeforeExec() {
        KeyValueStore mocked = mock(KeyValueStore.class);
        CommandProcessor p = new CommandProcessor(mocked);

        p.process(frame("MULTI"));
        p.process(frame("SET", "k", "v"));
        p.process(frame("LPUSH", "l", "a"));
        verifyNoInteractions(mocked);

        p.process(frame("EXEC"));
        verify(mocked).set("k", "v");
    }

    @Test
    void emptyTransaction() {
        send("MULTI");
        assertEquals(RespArray.empty(), send("EXEC"));
    }

    @Test
    void nestedMulti() {
        send("MULTI");
        send("SET", "k", "v");
        assertEquals(RespError.withUTF8(TransactionException.NESTED_MULTI), send("MULTI"));
        assertTrue(processor.isInTransaction());

        assertEquals(RespArray.with(RespSimpleString.OK), send("EXEC"));
    }

    @Test
    void discard() {
        send("MULTI");
        send("SET", "k", "v");
        assertEquals(RespSimpleString.OK, send("DISCARD"));
        assertFalse(processor.isInTransaction());
        assertEquals(RespBulkString.nullBulkString(), send("GET", "k"));
        assertEquals(0, store.size());
    }

    @Test
    void execAndDiscardWithoutMulti() {
        assertEquals(RespError.withUTF8("ERR EXEC without MULTI"), send("EXEC"));
        assertEquals(RespError.withUTF8("ERR DISCARD without MULTI"), send("DISCARD"));
    }

    @Test
    void invalidCommandAbortsTransaction() {
        send("MULTI");
        send("SET", "k", "v");
        assertEquals(RespError.withUTF8("ERR wrong number of arguments for 'get' command"), send("GET"));
        assertFalse(processor.isInTransaction());

        assertEquals(RespError.withUTF8("ERR EXEC without MULTI"), send("EXEC"));
        assertEquals(0, store.size());
    }

    @Test
    void typeErrorInsideExecDoesNotShortCircuit() {
        send("SET", "k", "v");
        send("MULTI");
        send("LPUSH", "k", "a");
        send("SET", "k2", "v2");
        send("RPUSH", "l", "x");

        RespArray replies = (RespArray) send("EXEC");
        assertEquals(3, replies.size());
        assertEquals(RespError.withUTF8(
                "WRONGTYPE Operation against a key holding the wrong kind of value"), replies.get(0));
        assertEquals(RespSimpleString.OK, replies.get(1));
        assertEquals(RespInteger.with(1), replies.get(2));
        assertEquals(RespBulkString.withUTF8("v2"), send("GET", "k2"));
    }

    @Test
    void pingIsQueuedToo() {
        send("MULTI");
        assertEquals(RespSimpleString.QUEUED, send("PING"));
        assertEquals(RespArray.with(RespSimpleString.PONG), send("EXEC"));
    }

    @Test
    void runtimeFailureBecomesErrorReply() throws Exception {
        KeyValueStore mocked = mock(KeyValueStore.class);
        when(mocked.get("k")).thenThrow(new IllegalStateException("boom"));
        CommandProcessor p = new CommandProcessor(mocked);

        assertEquals(RespError.withUTF8("ERR IllegalStateException"), p.process(frame("GET", "k")));
        when(mocked.get("x")).thenReturn(Optional.of("y"));
        assertEquals(RespBulkString.withUTF8("y"), p.process(frame("GET", "x")));
    }

    @Test
    void listRoundTrip() {
        send("RPUSH", "l", "a", "b", "c");
        assertEquals(bulks("b", "c"), send("LRANGE", "l", "1", "5"));
        assertEquals(RespError.withUTF8(CommandFormatException.NOT_AN_INTEGER), send("LRANGE", "l", "x", "1"));
        assertEquals(Collections.singletonList(RespBulkString.withUTF8("c")),
                ((RespArray) send("LRANGE", "l", "-1", "-1")).getDatas());
    }

    @Test
    void valuesAreStoredAsUtf8Text() {
        RespArray set = RespArray.with(RespBulkString.withUTF8("SET"), RespBulkString.withUTF8("bin"),
                RespBulkString.with(new byte[]{'v', (byte) 0xc3}));
        assertEquals(RespSimpleString.OK, processor.process(set));

        RespBulkString value = (RespBulkString) send("GET", "bin");
        assertEquals("v\uFFFD", value.asUTF8());
        assertArrayEquals("v\uFFFD".getBytes(StandardCharsets.UTF_8), value.getContent());
    }
}
