package com.hao.ntpgateway.core.query;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 行过滤器
 * <p>
 * 远端只接受按天的窗口，拉回的数据可能超出原始谓词的范围，
 * 这里按完整精度的时间边界逐行复核。
 * <ul>
 *   <li>bounds 为空：原样返回</li>
 *   <li>时间戳无法解析：丢弃该行</li>
 *   <li>保持输入顺序，重复过滤结果不变</li>
 * </ul>
 *
 * @author hli
 * @date 2026-10-18
 */
@Slf4j
@Component
public class RowFilter {

    public <T extends ParsedRow> List<T> filterRows(List<T> rows, TimestampBounds bounds) {
        if (bounds == null) {
            return rows;
        }
        List<T> kept = new ArrayList<>(rows.size());
        int unparseable = 0;
        for (T row : rows) {
            Optional<Instant> timestamp = TimestampLiterals.parseRowTimestamp(row.getTimestampUtc());
            if (timestamp.isEmpty()) {
                unparseable++;
                log.debug("行时间戳无法解析_丢弃|Row_timestamp_unparseable_dropped,timestamp={}", row.getTimestampUtc());
                continue;
            }
            if (bounds.matches(timestamp.get())) {
                kept.add(row);
            }
        }
        if (unparseable > 0) {
            log.warn("存在无法解析的行时间戳|Row_filter_dropped_unparseable,input={},kept={},unparseable={}",
                    rows.size(), kept.size(), unparseable);
        } else {
            log.debug("行过滤完成|Row_filter_done,input={},kept={}", rows.size(), kept.size());
        }
        return kept;
    }
}
