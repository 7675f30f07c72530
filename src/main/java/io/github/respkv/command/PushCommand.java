package io.github.respkv.command;

import java.util.List;

import com.google.common.collect.ImmutableList;
import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.kv.WrongTypeException;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespError;
import io.github.respkv.resp.RespInteger;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * LPUSH/RPUSH key value [value ...]，返回push之后的列表长度。
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class PushCommand implements Command {
    private final String                key;
    private final ImmutableList<String> values;

    PushCommand(String key, ImmutableList<String> values) {
        this.key = key;
        this.values = values;
    }

    static String key(List<RespData> args, CommandType type) throws CommandFormatException {
        if (args.size() < 2) {
            throw CommandFormatException.wrongArity(type);
        }
        return Commands.string(args.get(0));
    }

    static ImmutableList<String> values(List<RespData> args) throws CommandFormatException {
        ImmutableList.Builder<String> values = ImmutableList.builder();
        for (RespData arg : args.subList(1, args.size())) {
            values.add(Commands.string(arg));
        }
        return values.build();
    }

    abstract int push(KeyValueStore store) throws WrongTypeException;

    @Override
    public RespData execute(KeyValueStore store) {
        try {
            return RespInteger.with(push(store));
        } catch (WrongTypeException e) {
            return RespError.withUTF8(e.getMessage());
        }
    }
}
