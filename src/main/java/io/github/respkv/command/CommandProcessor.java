package io.github.respkv.command;

import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.resp.RespArray;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespError;
import io.github.respkv.resp.RespSimpleString;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 处理一个连接上的请求帧：解析命令，经过{@link Transaction}决定直接执行还是入队，返回响应。
 * 每个请求都有且只有一个响应，命令级别的错误都变成{@link RespError}。
 * 每个连接一个实例。
 */
public class CommandProcessor {
    private static final Logger logger = LoggerFactory.getLogger(CommandProcessor.class);

    private final KeyValueStore store;
    private final Transaction   transaction = new Transaction();

    public CommandProcessor(@NonNull KeyValueStore store) {
        this.store = store;
    }

    public RespData process(RespArray frame) {
        Command command;
        try {
            command = Commands.parse(frame);
        } catch (CommandException e) {
            // 事务中的非法命令放弃整个事务
            transaction.abort();
            return e.toReply();
        }

        try {
            switch (command.getType()) {
                case MULTI:
                    transaction.begin();
                    return command.execute(store);
                case EXEC:
                    return transaction.exec(store);
                case DISCARD:
                    transaction.discard();
                    return command.execute(store);
                default:
                    if (transaction.isActive()) {
                        transaction.enqueue(command);
                        return RespSimpleString.QUEUED;
                    }
                    return command.execute(store);
            }
        } catch (TransactionException e) {
            return e.toReply();
        } catch (RuntimeException e) {
            logger.error("command {} failed.", command, e);
            return RespError.withUTF8("ERR " + e.getClass().getSimpleName());
        }
    }

    public boolean isInTransaction() {
        return transaction.isActive();
    }
}
