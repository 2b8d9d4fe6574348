package enums.ntp;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 可再生能源产品类型（product_type 列取值）
 * <p>
 * 声明顺序即端点展开时的外层循环顺序。
 *
 * @author hli
 * @date 2026-10-18
 */
@Getter
@AllArgsConstructor
public enum ProductTypeEnum {

    SOLAR("solar"),

    WIND_ONSHORE("wind_onshore"),

    WIND_OFFSHORE("wind_offshore");

    private final String code;

    public static Optional<ProductTypeEnum> fromCode(String code) {
        return Arrays.stream(values())
                .filter(e -> e.code.equals(code))
                .findFirst();
    }

    /**
     * 全部取值，逗号分隔，用于错误提示
     */
    public static String codes() {
        return Arrays.stream(values()).map(ProductTypeEnum::getCode).collect(Collectors.joining(", "));
    }
}
