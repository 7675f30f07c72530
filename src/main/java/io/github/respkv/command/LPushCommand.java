package io.github.respkv.command;

import java.util.List;

import com.google.common.collect.ImmutableList;
import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.kv.WrongTypeException;
import io.github.respkv.resp.RespData;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class LPushCommand extends PushCommand {

    static LPushCommand parse(List<RespData> args) throws CommandFormatException {
        String key = key(args, CommandType.LPUSH);
        return new LPushCommand(key, values(args));
    }

    private LPushCommand(String key, ImmutableList<String> values) {
        super(key, values);
    }

    @Override
    public CommandType getType() {
        return CommandType.LPUSH;
    }

    @Override
    int push(KeyValueStore store) throws WrongTypeException {
        return store.lpush(getKey(), getValues());
    }
}
