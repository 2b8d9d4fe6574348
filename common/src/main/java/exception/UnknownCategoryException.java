package exception;

/**
 * 未知逻辑表
 * <p>
 * 扫描请求指定的表名不在网关支持的逻辑表集合内。
 *
 * @author hli
 */
public class UnknownCategoryException extends PlanningException {

    private static final Integer DEFAULT_ERROR_CODE = 4103;

    public UnknownCategoryException(String message) {
        super(DEFAULT_ERROR_CODE, message);
    }
}
