package exception;

/**
 * 日期区间非法
 * <p>
 * 调整后起始日期晚于结束日期，或日期字符串无法解析为 yyyy-MM-dd。
 *
 * @author hli
 */
public class InvalidDateRangeException extends PlanningException {

    private static final Integer DEFAULT_ERROR_CODE = 4102;

    public InvalidDateRangeException(String message) {
        super(DEFAULT_ERROR_CODE, message);
    }

    public InvalidDateRangeException(String message, Throwable cause) {
        super(DEFAULT_ERROR_CODE, message, cause);
    }
}
