package cn.gm.light.kvtable.exception;

/**
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @description 存储层统一异常基类
 * @date 2025/3/4 12:59:14
 */
public class KvException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final int code;

    public KvException(int code, String message) {
        super(message);
        this.code = code;
    }

    // 带异常根源的构造方法
    public KvException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static KvException of(String message) {
        return new KvException(500, message);
    }

    public int getCode() { return code; }
}
