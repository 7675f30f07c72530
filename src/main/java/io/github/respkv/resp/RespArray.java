package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode
@ToString
public final class RespArray implements RespData {
    static final char firstChar = '*';

    private static final RespArray EMPTY = new RespArray(ImmutableList.of());

    private final ImmutableList<RespData> datas;

    public static RespArray empty() {
        return EMPTY;
    }

    public static RespArray with(List<? extends RespData> datas) {
        return new RespArray(ImmutableList.copyOf(datas));
    }

    public static RespArray with(RespData... datas) {
        return new RespArray(ImmutableList.copyOf(Arrays.asList(datas)));
    }

    private RespArray(ImmutableList<RespData> datas) {
        this.datas = datas;
    }

    public int size() {
        return datas.size();
    }

    public boolean isEmpty() {
        return datas.isEmpty();
    }

    public <T extends RespData> T get(int i) {
        return (T) datas.get(i);
    }

    public List<RespData> getDatas() {
        return datas;
    }

    @Override
    public byte[] toBytes() {
        byte[][] parts = new byte[datas.size() + 1][];
        parts[0] = (firstChar + String.valueOf(datas.size()) + "\r\n").getBytes(StandardCharsets.US_ASCII);
        for (int i = 0; i < datas.size(); i++) {
            parts[i + 1] = datas.get(i).toBytes();
        }
        return Bytes.concat(parts);
    }
}
