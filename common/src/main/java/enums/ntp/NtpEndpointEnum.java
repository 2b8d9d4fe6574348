package enums.ntp;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * NTP 远端接口枚举
 * <p>
 * endpointId 即远端地址中的路径段，大小写与远端保持一致，不可修改。
 *
 * @author hli
 * @date 2026-10-18
 */
@Getter
@AllArgsConstructor
public enum NtpEndpointEnum {

    /**
     * 可再生能源日前预测
     */
    PROGNOSE("prognose", RequestTargetShape.STANDARD),

    /**
     * 可再生能源外推值
     */
    HOCHRECHNUNG("hochrechnung", RequestTargetShape.STANDARD),

    /**
     * 可再生能源在线实测外推
     */
    ONLINEHOCHRECHNUNG("onlinehochrechnung", RequestTargetShape.STANDARD),

    /**
     * 日前现货价格
     */
    SPOTMARKTPREISE("Spotmarktpreise", RequestTargetShape.STANDARD),

    /**
     * 负电价标记
     */
    NEGATIVE_PREISE("NegativePreise", RequestTargetShape.STANDARD),

    /**
     * 月度市场溢价，按月区间寻址
     */
    MARKTPRAEMIE("marktpraemie", RequestTargetShape.MONTH_RANGE),

    /**
     * 年度市场价值，仅按年份寻址
     */
    JAHRESMARKTPRAEMIE("Jahresmarktpraemie", RequestTargetShape.YEAR_ONLY),

    /**
     * 再调度事件
     */
    REDISPATCH("redispatch", RequestTargetShape.STANDARD),

    /**
     * 电网状态（红绿灯）
     */
    TRAFFIC_LIGHT("TrafficLight", RequestTargetShape.STANDARD);

    /**
     * 远端路径段
     */
    private final String endpointId;

    /**
     * 地址形态
     */
    private final RequestTargetShape shape;
}
