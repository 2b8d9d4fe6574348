package enums.ntp;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 可再生能源数据类别（data_category 列取值）
 * <p>
 * 每个类别对应一个远端接口，声明顺序即端点展开时的内层循环顺序。
 *
 * @author hli
 * @date 2026-10-18
 */
@Getter
@AllArgsConstructor
public enum DataCategoryEnum {

    /**
     * 预测值
     */
    FORECAST("forecast", NtpEndpointEnum.PROGNOSE),

    /**
     * 外推值
     */
    EXTRAPOLATION("extrapolation", NtpEndpointEnum.HOCHRECHNUNG),

    /**
     * 在线实测
     */
    ONLINE_ACTUAL("online_actual", NtpEndpointEnum.ONLINEHOCHRECHNUNG);

    private final String code;

    private final NtpEndpointEnum endpoint;

    public static Optional<DataCategoryEnum> fromCode(String code) {
        return Arrays.stream(values())
                .filter(e -> e.code.equals(code))
                .findFirst();
    }

    public static String codes() {
        return Arrays.stream(values()).map(DataCategoryEnum::getCode).collect(Collectors.joining(", "));
    }
}
