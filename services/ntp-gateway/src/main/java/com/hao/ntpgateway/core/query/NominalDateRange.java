package com.hao.ntpgateway.core.query;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDate;

/**
 * 名义日期范围
 * <p>
 * 由时间条件折算出的按天粒度证据，两端均可缺失，尚未经过 DateRangeResolver 调整。
 *
 * @author hli
 * @date 2026-10-18
 */
@Data
@AllArgsConstructor
public class NominalDateRange {

    /**
     * 下界所在 UTC 日期，可为空
     */
    private LocalDate start;

    /**
     * 上界所在 UTC 日期，可为空
     */
    private LocalDate end;

    public boolean isEmpty() {
        return start == null && end == null;
    }
}
