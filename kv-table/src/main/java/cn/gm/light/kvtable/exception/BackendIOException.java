package cn.gm.light.kvtable.exception;

/**
 * The storage engine failed to open, read, write, sync or close.
 * The engine's own exception is always kept as the cause.
 *
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @date 2025/3/4 13:10:02
 */
public class BackendIOException extends KvException {
    private static final long serialVersionUID = 1L;
    public static final int CODE = 500;

    public BackendIOException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
