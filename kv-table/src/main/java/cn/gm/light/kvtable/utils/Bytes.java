package cn.gm.light.kvtable.utils;

import com.google.common.io.BaseEncoding;
import com.google.common.primitives.UnsignedBytes;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;

/**
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @description 字节数组工具
 * @date 2025/3/9 10:39:35
 */
public final class Bytes {

    public static final byte[] EMPTY = new byte[0];

    // 无符号字节序比较，前缀较短者排前
    public static final Comparator<byte[]> COMPARATOR = UnsignedBytes.lexicographicalComparator();

    private static final int DISPLAY_LIMIT = 32;

    public static int compare(byte[] a, byte[] b) {
        return COMPARATOR.compare(a, b);
    }

    public static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    public static String string(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Renders a key or value for log lines: printable ASCII as-is,
     * anything else as hex, truncated after 32 bytes.
     */
    public static String toDisplay(byte[] bytes) {
        if (bytes == null) {
            return "null";
        }
        int len = Math.min(bytes.length, DISPLAY_LIMIT);
        boolean printable = true;
        for (int i = 0; i < len; i++) {
            if (bytes[i] < 0x20 || bytes[i] > 0x7e) {
                printable = false;
                break;
            }
        }
        String shown = printable
                ? new String(bytes, 0, len, StandardCharsets.US_ASCII)
                : "0x" + BaseEncoding.base16().lowerCase().encode(bytes, 0, len);
        return bytes.length > DISPLAY_LIMIT ? shown + "...(" + bytes.length + " bytes)" : shown;
    }

    private Bytes() {
    }
}
