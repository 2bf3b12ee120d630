package cn.gm.light.kvtable.exception;

/**
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @description 已关闭的存储或游标上继续操作
 * @date 2025/3/4 13:12:40
 */
public class InvalidStateException extends KvException {
    private static final long serialVersionUID = 1L;
    public static final int CODE = 409;

    public InvalidStateException(String message) {
        super(CODE, message);
    }
}
