package io.github.respkv.command;

import java.util.List;
import java.util.Optional;

import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.resp.RespBulkString;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespSimpleString;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * PING [message]：没有参数返回PONG，有参数原样返回。
 */
@EqualsAndHashCode
@ToString
public final class PingCommand implements Command {
    private final String message;

    static PingCommand parse(List<RespData> args) throws CommandFormatException {
        switch (args.size()) {
            case 0:
                return new PingCommand(null);
            case 1:
                return new PingCommand(Commands.string(args.get(0)));
            default:
                throw CommandFormatException.wrongArity(CommandType.PING);
        }
    }

    private PingCommand(String message) {
        this.message = message;
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    public RespData execute(KeyValueStore store) {
        return message == null ? RespSimpleString.PONG : RespBulkString.withUTF8(message);
    }
}
