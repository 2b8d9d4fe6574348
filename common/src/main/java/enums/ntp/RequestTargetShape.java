package enums.ntp;

/**
 * 请求地址形态
 * <p>
 * NTP 各接口对日期参数的编码方式不同，由该枚举区分：
 * <ul>
 *   <li>STANDARD: /{endpoint}[/{parameter}]/{dateFrom}/{dateTo}，ISO 日期</li>
 *   <li>MONTH_RANGE: /{endpoint}/{MM}/{yyyy}/{MM}/{yyyy}，按月区间</li>
 *   <li>YEAR_ONLY: /{endpoint}/{yyyy}，仅起始年份</li>
 * </ul>
 *
 * @author hli
 * @date 2026-10-18
 */
public enum RequestTargetShape {

    STANDARD,

    MONTH_RANGE,

    YEAR_ONLY
}
