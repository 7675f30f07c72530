package io.github.respkv.command;

import java.util.List;
import java.util.stream.Collectors;

import com.google.common.primitives.Longs;
import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.kv.WrongTypeException;
import io.github.respkv.resp.RespArray;
import io.github.respkv.resp.RespBulkString;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespError;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * LRANGE key start stop，下标是有符号整数，可以为负数。
 */
@Getter
@EqualsAndHashCode
@ToString
public final class LRangeCommand implements Command {
    private final String key;
    private final long   start;
    private final long   stop;

    static LRangeCommand parse(List<RespData> args) throws CommandFormatException {
        if (args.size() != 3) {
            throw CommandFormatException.wrongArity(CommandType.LRANGE);
        }
        return new LRangeCommand(Commands.string(args.get(0)), index(args.get(1)), index(args.get(2)));
    }

    private static long index(RespData arg) throws CommandFormatException {
        Long n = Longs.tryParse(Commands.string(arg));
        if (n == null) {
            throw new CommandFormatException(CommandFormatException.NOT_AN_INTEGER);
        }
        return n;
    }

    private LRangeCommand(String key, long start, long stop) {
        this.key = key;
        this.start = start;
        this.stop = stop;
    }

    @Override
    public CommandType getType() {
        return CommandType.LRANGE;
    }

    @Override
    public RespData execute(KeyValueStore store) {
        try {
            List<String> elements = store.lrange(key, start, stop);
            return RespArray.with(elements.stream().map(RespBulkString::withUTF8).collect(Collectors.toList()));
        } catch (WrongTypeException e) {
            return RespError.withUTF8(e.getMessage());
        }
    }
}
