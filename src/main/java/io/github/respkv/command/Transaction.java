package io.github.respkv.command;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.resp.RespArray;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * 一个连接上的事务状态机，只有两个状态：Idle和Active。随连接创建和销毁，不在连接之间共享，不需要同步。
 * </p>
 * <ul>
 * <li>Idle → Active：MULTI。已经是Active时报错，状态和队列不变。</li>
 * <li>Active时的普通命令按到达顺序入队，不执行。</li>
 * <li>EXEC：按FIFO顺序逐个执行，每个命令一个响应；单个命令失败只是结果数组里的一个错误，后面的命令照常执行，没有回滚。
 * 执行完无条件回到Idle。</li>
 * <li>DISCARD：清空队列，回到Idle。</li>
 * </ul>
 */
public class Transaction {
    private static final Logger logger = LoggerFactory.getLogger(Transaction.class);

    private final List<Command> queue = new ArrayList<>();
    private boolean             active;

    public boolean isActive() {
        return active;
    }

    /**
     * @return 已入队的命令，按入队顺序
     */
    public List<Command> getQueued() {
        return ImmutableList.copyOf(queue);
    }

    public void begin() throws TransactionException {
        if (active) {
            throw new TransactionException(TransactionException.NESTED_MULTI);
        }
        active = true;
    }

    public void enqueue(Command command) {
        Preconditions.checkState(active, "no active transaction");
        queue.add(command);
    }

    public RespArray exec(KeyValueStore store) throws TransactionException {
        if (!active) {
            throw new TransactionException(TransactionException.EXEC_WITHOUT_MULTI);
        }
        List<Command> commands = new ArrayList<>(queue);
        reset();

        List<RespData> replies = new ArrayList<>(commands.size());
        for (Command command : commands) {
            replies.add(executeQueued(command, store));
        }
        return RespArray.with(replies);
    }

    public void discard() throws TransactionException {
        if (!active) {
            throw new TransactionException(TransactionException.DISCARD_WITHOUT_MULTI);
        }
        reset();
    }

    /**
     * 事务中出现无法解析的命令时，放弃整个事务。Idle时调用没有影响。
     */
    public void abort() {
        if (active) {
            logger.debug("transaction aborted, {} queued commands dropped", queue.size());
        }
        reset();
    }

    private void reset() {
        queue.clear();
        active = false;
    }

    private static RespData executeQueued(Command command, KeyValueStore store) {
        try {
            return command.execute(store);
        } catch (RuntimeException e) {
            logger.error("queued command {} failed.", command, e);
            return RespError.withUTF8("ERR " + e.getClass().getSimpleName());
        }
    }
}
