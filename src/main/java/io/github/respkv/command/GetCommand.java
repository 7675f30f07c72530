package io.github.respkv.command;

import java.util.List;
import java.util.Optional;

import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.kv.WrongTypeException;
import io.github.respkv.resp.RespBulkString;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespError;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode
@ToString
public final class GetCommand implements Command {
    private final String key;

    static GetCommand parse(List<RespData> args) throws CommandFormatException {
        if (args.size() != 1) {
            throw CommandFormatException.wrongArity(CommandType.GET);
        }
        return new GetCommand(Commands.string(args.get(0)));
    }

    private GetCommand(String key) {
        this.key = key;
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public RespData execute(KeyValueStore store) {
        try {
            Optional<String> value = store.get(key);
            return value.isPresent() ? RespBulkString.withUTF8(value.get()) : RespBulkString.nullBulkString();
        } catch (WrongTypeException e) {
            return RespError.withUTF8(e.getMessage());
        }
    }
}
