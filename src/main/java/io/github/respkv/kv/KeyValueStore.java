package io.github.respkv.kv;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import lombok.NonNull;

/**
 * <p>
 * 进程内唯一的存储，所有连接共享同一个实例，进程启动时创建，退出时随之销毁。
 * key映射到字符串或者列表。
 * </p>
 * <p>
 * 每个操作都在整个map的锁内完成，不会观察到其他连接写了一半的数据；
 * 操作都是纯内存的，不会无限期阻塞。返回给调用方的列表都是副本。
 * </p>
 */
public class KeyValueStore {
    private final Map<String, StoredValue> entries = new HashMap<>();

    /**
     * @param key key
     * @return key对应的字符串，key不存在返回empty
     * @throws WrongTypeException key对应的是列表
     */
    public synchronized Optional<String> get(@NonNull String key) throws WrongTypeException {
        StoredValue v = entries.get(key);
        if (v == null) {
            return Optional.empty();
        }
        if (v.getType() != StoredValue.Type.STRING) {
            throw new WrongTypeException(key);
        }
        return Optional.of(((StoredValue.StringValue) v).getValue());
    }

    /**
     * 无条件覆盖，不管原来存的是什么。
     */
    public synchronized void set(@NonNull String key, @NonNull String value) {
        entries.put(key, new StoredValue.StringValue(value));
    }

    /**
     * 按给定顺序逐个插入表头，key不存在时先创建空列表。
     *
     * @return push之后的列表长度
     * @throws WrongTypeException key对应的是字符串
     */
    public synchronized int lpush(@NonNull String key, @NonNull List<String> values) throws WrongTypeException {
        StoredValue.ListValue list = listForPush(key, values);
        list.pushHead(values);
        return list.size();
    }

    /**
     * 按给定顺序逐个追加到表尾，key不存在时先创建空列表。
     *
     * @return push之后的列表长度
     * @throws WrongTypeException key对应的是字符串
     */
    public synchronized int rpush(@NonNull String key, @NonNull List<String> values) throws WrongTypeException {
        StoredValue.ListValue list = listForPush(key, values);
        list.pushTail(values);
        return list.size();
    }

    /**
     * 取列表的[start, stop]闭区间。负数下标从表尾开始数，-1是最后一个元素。
     * 解析负数下标后，start小于0取0，stop超过最后一个下标取最后一个下标；
     * start大于stop或者key不存在时返回空列表。
     *
     * @throws WrongTypeException key对应的是字符串
     */
    public synchronized List<String> lrange(@NonNull String key, long start, long stop) throws WrongTypeException {
        StoredValue v = entries.get(key);
        if (v == null) {
            return Collections.emptyList();
        }
        if (v.getType() != StoredValue.Type.LIST) {
            throw new WrongTypeException(key);
        }
        StoredValue.ListValue list = (StoredValue.ListValue) v;
        long len = list.size();
        if (start < 0) {
            start += len;
        }
        if (stop < 0) {
            stop += len;
        }
        if (start < 0) {
            start = 0;
        }
        if (stop >= len) {
            stop = len - 1;
        }
        if (start > stop) {
            return Collections.emptyList();
        }
        return list.range((int) start, (int) stop);
    }

    /**
     * @return key的个数
     */
    public synchronized int size() {
        return entries.size();
    }

    private StoredValue.ListValue listForPush(String key, List<String> values) throws WrongTypeException {
        Preconditions.checkArgument(!values.isEmpty(), "push needs at least one value");
        StoredValue v = entries.get(key);
        if (v == null) {
            StoredValue.ListValue list = new StoredValue.ListValue();
            entries.put(key, list);
            return list;
        }
        if (v.getType() != StoredValue.Type.LIST) {
            throw new WrongTypeException(key);
        }
        return (StoredValue.ListValue) v;
    }
}
