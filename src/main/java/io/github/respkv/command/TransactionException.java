package io.github.respkv.command;

/**
 * MULTI嵌套，或者没有MULTI就EXEC/DISCARD。事务状态不变。
 */
public class TransactionException extends CommandException {
    private static final long serialVersionUID = 4471127021365929310L;

    static final String NESTED_MULTI         = "ERR MULTI calls can not be nested";
    static final String EXEC_WITHOUT_MULTI    = "ERR EXEC without MULTI";
    static final String DISCARD_WITHOUT_MULTI = "ERR DISCARD without MULTI";

    TransactionException(String message) {
        super(message);
    }
}
