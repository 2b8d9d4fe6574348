package enums.ntp;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 电价类型（price_type 列取值）
 * <p>
 * 每个取值唯一对应一个远端接口，声明顺序即展开顺序。
 *
 * @author hli
 * @date 2026-10-18
 */
@Getter
@AllArgsConstructor
public enum PriceTypeEnum {

    SPOT_MARKET("spot_market", NtpEndpointEnum.SPOTMARKTPREISE),

    NEGATIVE_FLAG("negative_flag", NtpEndpointEnum.NEGATIVE_PREISE),

    MARKET_PREMIUM("market_premium", NtpEndpointEnum.MARKTPRAEMIE),

    ANNUAL_MARKET_VALUE("annual_market_value", NtpEndpointEnum.JAHRESMARKTPRAEMIE);

    private final String code;

    private final NtpEndpointEnum endpoint;

    public static Optional<PriceTypeEnum> fromCode(String code) {
        return Arrays.stream(values())
                .filter(e -> e.code.equals(code))
                .findFirst();
    }

    public static String codes() {
        return Arrays.stream(values()).map(PriceTypeEnum::getCode).collect(Collectors.joining(", "));
    }
}
