package io.github.respkv.kv;

/**
 * 对字符串key执行列表操作，或者反过来。抛出时存储没有任何改动。
 */
public class WrongTypeException extends Exception {
    private static final long serialVersionUID = 5147265512890137541L;

    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    private final String key;

    public WrongTypeException(String key) {
        super(MESSAGE);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
