package cn.gm.light.kvtable.entity;

import cn.gm.light.kvtable.utils.Bytes;
import com.google.common.base.Preconditions;
import lombok.Getter;

import java.util.Arrays;

/**
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @description 一条键值记录，key 与 value 均为任意字节
 * @date 2025/3/3 19:17:59
 */
@Getter
public final class Kv {
    private final byte[] key;
    private final byte[] value;

    public Kv(byte[] key, byte[] value) {
        this.key = Preconditions.checkNotNull(key, "key");
        this.value = Preconditions.checkNotNull(value, "value");
    }

    public static Kv of(byte[] key, byte[] value) {
        return new Kv(key, value);
    }

    public static Kv of(String key, String value) {
        return new Kv(Bytes.utf8(key), Bytes.utf8(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Kv)) return false;
        Kv other = (Kv) o;
        return Arrays.equals(key, other.key) && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(key) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return Bytes.toDisplay(key) + "=" + Bytes.toDisplay(value);
    }
}
