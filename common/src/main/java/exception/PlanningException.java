package exception;

/**
 * 查询规划异常（规划阶段的统一出口）
 *
 * 设计目的：
 * 1. 作为 plan() 边界对外暴露的统一异常类型，调用方只需捕获该类即可覆盖所有规划失败。
 * 2. 具体失败原因由子类区分：时间字面量非法、日期区间非法、未知表、未知枚举值。
 *
 * 实现思路：
 * - 继承 BusinessException，复用错误码机制。
 * - 规划阶段不做任何本地恢复，异常全部向上传播。
 *
 * @author hli
 */
public class PlanningException extends BusinessException {

    private static final Integer DEFAULT_ERROR_CODE = 4100;

    public PlanningException(String message) {
        super(DEFAULT_ERROR_CODE, message);
    }

    public PlanningException(Integer errorCode, String message) {
        super(errorCode, message);
    }

    public PlanningException(Integer errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
