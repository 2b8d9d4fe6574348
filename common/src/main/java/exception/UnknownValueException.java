package exception;

import lombok.Getter;

/**
 * 未知枚举取值
 * <p>
 * 等值过滤条件指定的取值不在该分类维度的已知取值集合内，例如 product_type = 'biomass'。
 *
 * @author hli
 */
@Getter
public class UnknownValueException extends PlanningException {

    private static final Integer DEFAULT_ERROR_CODE = 4104;

    /**
     * 出错的列名
     */
    private final String column;

    /**
     * 出错的取值
     */
    private final String value;

    public UnknownValueException(String column, String value, String expected) {
        super(DEFAULT_ERROR_CODE, String.format("Unknown %s: '%s'. Expected one of: %s.", column, value, expected));
        this.column = column;
        this.value = value;
    }
}
