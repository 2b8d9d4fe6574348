package com.hao.ntpgateway.core.scan;

import com.hao.ntpgateway.core.query.FetchPlan;
import com.hao.ntpgateway.core.query.LogicalTable;
import com.hao.ntpgateway.core.query.QualFilters;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 单次扫描的会话状态
 * <p>
 * 持有本次扫描的表、过滤条件、拉取计划与过滤后的行缓冲，由宿主驱动游标。
 * 每次扫描一个实例，不跨扫描共享，也不做线程安全保证。
 *
 * @param <T> 行类型
 * @author hli
 * @date 2026-10-18
 */
public class ScanSession<T> {

    @Getter
    private final LogicalTable table;

    @Getter
    private final QualFilters filters;

    @Getter
    private final List<FetchPlan> plans;

    private final List<T> rows;

    @Getter
    private int position;

    public ScanSession(LogicalTable table, QualFilters filters, List<FetchPlan> plans, List<T> rows) {
        this.table = table;
        this.filters = filters;
        this.plans = List.copyOf(plans);
        this.rows = new ArrayList<>(rows);
    }

    /**
     * 取下一行并推进游标
     *
     * @return 已读完时返回空
     */
    public Optional<T> next() {
        if (position >= rows.size()) {
            return Optional.empty();
        }
        return Optional.of(rows.get(position++));
    }

    /**
     * 游标回到起点，缓冲保留
     */
    public void reScan() {
        position = 0;
    }

    /**
     * 结束扫描，释放缓冲
     */
    public void end() {
        rows.clear();
        position = 0;
    }

    public int size() {
        return rows.size();
    }
}
