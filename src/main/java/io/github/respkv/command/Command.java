package io.github.respkv.command;

import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.resp.RespData;

/**
 * 解析、校验过的命令，构造之后不可变。
 * 执行时对存储做一次调用，把结果或错误包装成响应；执行本身不抛出受检异常。
 */
public interface Command {

    CommandType getType();

    RespData execute(KeyValueStore store);
}
