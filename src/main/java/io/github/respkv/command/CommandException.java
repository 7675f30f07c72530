package io.github.respkv.command;

import io.github.respkv.resp.RespError;

/**
 * 单个请求级别的可恢复错误，异常信息就是返回给客户端的错误文本。
 */
public class CommandException extends Exception {
    private static final long serialVersionUID = 2693741049129850227L;

    public CommandException(String message) {
        super(message);
    }

    public RespError toReply() {
        return RespError.withUTF8(getMessage());
    }
}
