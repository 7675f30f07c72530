package io.github.respkv.command;

import java.util.List;

import io.github.respkv.resp.RespArray;
import io.github.respkv.resp.RespBulkString;
import io.github.respkv.resp.RespData;

/**
 * 把一个请求帧解析成{@link Command}。第一个元素是命令名，不区分大小写，其余是参数。
 */
public final class Commands {

    private Commands() {
    }

    public static Command parse(RespArray frame) throws CommandException {
        if (frame.isEmpty()) {
            throw new CommandFormatException(CommandFormatException.INVALID_FORMAT);
        }
        String verb = string(frame.get(0));
        CommandType type = CommandType.lookup(verb);
        if (type == null) {
            throw new UnknownCommandException(verb);
        }

        List<RespData> args = frame.getDatas().subList(1, frame.size());
        switch (type) {
            case PING:
                return PingCommand.parse(args);
            case SET:
                return SetCommand.parse(args);
            case GET:
                return GetCommand.parse(args);
            case LPUSH:
                return LPushCommand.parse(args);
            case RPUSH:
                return RPushCommand.parse(args);
            case LRANGE:
                return LRangeCommand.parse(args);
            case MULTI:
                return noArgs(args, type, TransactionCommand.MULTI);
            case EXEC:
                return noArgs(args, type, TransactionCommand.EXEC);
            case DISCARD:
                return noArgs(args, type, TransactionCommand.DISCARD);
            default:
                throw new AssertionError("unhandled command type: " + type);
        }
    }

    /**
     * 参数必须是非null的bulk string。key和value都按UTF-8文本保存，不是二进制安全的：
     * 非法的UTF-8字节在这里就被替换成U+FFFD。
     */
    static String string(RespData arg) throws CommandFormatException {
        if (!(arg instanceof RespBulkString) || ((RespBulkString) arg).isNull()) {
            throw new CommandFormatException(CommandFormatException.INVALID_FORMAT);
        }
        return ((RespBulkString) arg).asUTF8();
    }

    private static Command noArgs(List<RespData> args, CommandType type, Command command)
            throws CommandFormatException {
        if (!args.isEmpty()) {
            throw CommandFormatException.wrongArity(type);
        }
        return command;
    }
}
