package io.github.respkv.kv;

import java.util.ArrayList;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 一个key对应的值，字符串或者列表，两者之间不做隐式转换。
 * 只在{@link KeyValueStore}内部持有，不会把引用交给调用方。
 */
abstract class StoredValue {

    enum Type {
        STRING,
        LIST
    }

    abstract Type getType();

    @EqualsAndHashCode(callSuper = false)
    @ToString
    static final class StringValue extends StoredValue {
        @Getter
        private final String value;

        StringValue(String value) {
            this.value = value;
        }

        @Override
        Type getType() {
            return Type.STRING;
        }
    }

    /**
     * 有序、可按下标访问、允许重复的列表。
     */
    @EqualsAndHashCode(callSuper = false)
    @ToString
    static final class ListValue extends StoredValue {
        private final List<String> elements = new ArrayList<>();

        @Override
        Type getType() {
            return Type.LIST;
        }

        int size() {
            return elements.size();
        }

        /**
         * 逐个插入到表头，所以[a, b, c]插入后读出来是[c, b, a]
         */
        void pushHead(List<String> values) {
            List<String> head = new ArrayList<>(values.size());
            for (int i = values.size() - 1; i >= 0; i--) {
                head.add(values.get(i));
            }
            elements.addAll(0, head);
        }

        void pushTail(List<String> values) {
            elements.addAll(values);
        }

        List<String> range(int from, int to) {
            return new ArrayList<>(elements.subList(from, to + 1));
        }
    }
}
