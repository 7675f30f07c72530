package io.github.respkv.command;

import java.util.Arrays;
import java.util.Locale;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import lombok.Getter;

/**
 * 支持的全部命令。新增命令需要在这里加一个值，并在{@link Commands#parse}里加一个分支。
 */
public enum CommandType {
    PING("ping"),
    SET("set"),
    GET("get"),
    LPUSH("lpush"),
    RPUSH("rpush"),
    LRANGE("lrange"),
    MULTI("multi"),
    EXEC("exec"),
    DISCARD("discard");

    private static final ImmutableMap<String, CommandType> BY_VERB =
            Maps.uniqueIndex(Arrays.asList(values()), CommandType::getVerb);

    @Getter
    private final String verb;

    CommandType(String verb) {
        this.verb = verb;
    }

    /**
     * 不区分大小写地查找命令
     *
     * @return 对应的命令，不支持的命令返回null
     */
    static CommandType lookup(String verb) {
        return BY_VERB.get(verb.toLowerCase(Locale.ROOT));
    }
}
