package io.github.respkv.command;

import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.resp.RespBulkString;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespSimpleString;

/**
 * MULTI、EXEC、DISCARD没有参数。状态切换由{@link Transaction}完成，
 * 这里的execute只给出{@link Transaction}放行之后的确认响应：MULTI和DISCARD返回OK，EXEC返回null。
 */
public enum TransactionCommand implements Command {
    MULTI(CommandType.MULTI, RespSimpleString.OK),
    EXEC(CommandType.EXEC, RespBulkString.nullBulkString()),
    DISCARD(CommandType.DISCARD, RespSimpleString.OK);

    private final CommandType type;
    private final RespData    ack;

    TransactionCommand(CommandType type, RespData ack) {
        this.type = type;
        this.ack = ack;
    }

    @Override
    public CommandType getType() {
        return type;
    }

    @Override
    public RespData execute(KeyValueStore store) {
        return ack;
    }
}
