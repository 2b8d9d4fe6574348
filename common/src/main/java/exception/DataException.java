package exception;

/**
 * 数据异常类
 *
 * 设计目的：
 * 1. 封装远端响应体解码失败（CSV/JSON 格式错误、字段缺失等）。
 * 2. 由扫描驱动在调用行解析协作者失败时抛出，携带请求地址便于定位。
 *
 * @author hli
 */
public class DataException extends BusinessException {

    private static final Integer DEFAULT_ERROR_CODE = 4001;

    public DataException(String message) {
        super(DEFAULT_ERROR_CODE, message);
    }

    public DataException(String message, Throwable cause) {
        super(DEFAULT_ERROR_CODE, message, cause);
    }
}
