package exception;

/**
 * 时间字面量非法
 * <p>
 * 查询条件中 timestamp_utc 的取值无法解析为时间点，或取值类型不受支持。
 *
 * @author hli
 */
public class InvalidTimestampException extends PlanningException {

    private static final Integer DEFAULT_ERROR_CODE = 4101;

    public InvalidTimestampException(String message) {
        super(DEFAULT_ERROR_CODE, message);
    }

    public InvalidTimestampException(String message, Throwable cause) {
        super(DEFAULT_ERROR_CODE, message, cause);
    }
}
