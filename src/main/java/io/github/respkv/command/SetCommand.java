package io.github.respkv.command;

import java.util.List;

import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespSimpleString;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode
@ToString
public final class SetCommand implements Command {
    private final String key;
    private final String value;

    static SetCommand parse(List<RespData> args) throws CommandFormatException {
        if (args.size() != 2) {
            throw CommandFormatException.wrongArity(CommandType.SET);
        }
        return new SetCommand(Commands.string(args.get(0)), Commands.string(args.get(1)));
    }

    private SetCommand(String key, String value) {
        this.key = key;
        this.value = value;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public RespData execute(KeyValueStore store) {
        store.set(key, value);
        return RespSimpleString.OK;
    }
}
