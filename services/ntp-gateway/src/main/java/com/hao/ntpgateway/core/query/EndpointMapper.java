package com.hao.ntpgateway.core.query;

import enums.ntp.DataCategoryEnum;
import enums.ntp.NtpEndpointEnum;
import enums.ntp.PriceTypeEnum;
import enums.ntp.ProductTypeEnum;
import exception.UnknownCategoryException;
import exception.UnknownValueException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 端点映射器
 * <p>
 * 职责：根据逻辑表与分类过滤，展开出需要调用的 (接口, 产品参数) 列表。
 * <p>
 * 展开规则：
 * <ul>
 *   <li>未约束的维度取全部已知取值，按表声明的维度顺序做笛卡尔积</li>
 *   <li>可再生能源表：产品为外层循环、数据类别为内层循环；
 *       海上风电只有在线实测接口，其余组合直接丢弃</li>
 *   <li>价格表：每种价格类型对应一个接口</li>
 *   <li>再调度、电网状态：各自固定一个接口</li>
 * </ul>
 * 输出顺序只取决于输入，多次调用结果一致。
 *
 * @author hli
 * @date 2026-10-18
 */
@Slf4j
@Component
public class EndpointMapper {

    /**
     * 按表名展开
     *
     * @throws UnknownCategoryException 表名未知
     * @throws UnknownValueException    过滤取值未知
     */
    public List<EndpointTarget> map(String tableName, CategoricalFilters filters) {
        return map(LogicalTable.fromTableName(tableName), filters);
    }

    /**
     * 展开端点
     *
     * @param table   逻辑表
     * @param filters 分类过滤
     * @return 有序的端点列表
     * @throws UnknownValueException 过滤取值未知
     */
    public List<EndpointTarget> map(LogicalTable table, CategoricalFilters filters) {
        List<EndpointTarget> targets = switch (table) {
            case RENEWABLE_ENERGY_TIMESERIES -> mapRenewable(filters);
            case ELECTRICITY_MARKET_PRICES -> mapPrices(filters);
            case REDISPATCH_EVENTS -> List.of(new EndpointTarget(NtpEndpointEnum.REDISPATCH, null));
            case GRID_STATUS_TIMESERIES -> List.of(new EndpointTarget(NtpEndpointEnum.TRAFFIC_LIGHT, null));
        };
        log.debug("端点展开完成|Endpoint_map_done,table={},filters={},targetCount={}",
                table.getTableName(), filters, targets.size());
        return targets;
    }

    private List<EndpointTarget> mapRenewable(CategoricalFilters filters) {
        List<ProductTypeEnum> products = filters.get(CategoricalColumn.PRODUCT_TYPE)
                .map(code -> List.of(ProductTypeEnum.fromCode(code).orElseThrow(() -> new UnknownValueException(
                        CategoricalColumn.PRODUCT_TYPE.getColumnName(), code, ProductTypeEnum.codes()))))
                .orElseGet(() -> Arrays.asList(ProductTypeEnum.values()));
        List<DataCategoryEnum> categories = filters.get(CategoricalColumn.DATA_CATEGORY)
                .map(code -> List.of(DataCategoryEnum.fromCode(code).orElseThrow(() -> new UnknownValueException(
                        CategoricalColumn.DATA_CATEGORY.getColumnName(), code, DataCategoryEnum.codes()))))
                .orElseGet(() -> Arrays.asList(DataCategoryEnum.values()));

        List<EndpointTarget> targets = new ArrayList<>();
        for (ProductTypeEnum product : products) {
            for (DataCategoryEnum category : categories) {
                Optional<String> parameter = productParameter(product, category);
                if (parameter.isPresent()) {
                    targets.add(new EndpointTarget(category.getEndpoint(), parameter.get()));
                } else {
                    log.debug("组合无对应接口_跳过|No_endpoint_for_combination,product={},category={}",
                            product.getCode(), category.getCode());
                }
            }
        }
        return targets;
    }

    private List<EndpointTarget> mapPrices(CategoricalFilters filters) {
        List<PriceTypeEnum> priceTypes = filters.get(CategoricalColumn.PRICE_TYPE)
                .map(code -> List.of(PriceTypeEnum.fromCode(code).orElseThrow(() -> new UnknownValueException(
                        CategoricalColumn.PRICE_TYPE.getColumnName(), code, PriceTypeEnum.codes()))))
                .orElseGet(() -> Arrays.asList(PriceTypeEnum.values()));

        List<EndpointTarget> targets = new ArrayList<>(priceTypes.size());
        for (PriceTypeEnum priceType : priceTypes) {
            targets.add(new EndpointTarget(priceType.getEndpoint(), null));
        }
        return targets;
    }

    /**
     * 产品在远端路径中的参数名
     * <p>
     * 陆上风电在预测/外推接口上叫 Wind，在在线实测接口上叫 Windonshore；
     * 海上风电只有在线实测数据。
     */
    private static Optional<String> productParameter(ProductTypeEnum product, DataCategoryEnum category) {
        return switch (product) {
            case SOLAR -> Optional.of("Solar");
            case WIND_ONSHORE -> Optional.of(category == DataCategoryEnum.ONLINE_ACTUAL ? "Windonshore" : "Wind");
            case WIND_OFFSHORE -> category == DataCategoryEnum.ONLINE_ACTUAL
                    ? Optional.of("Windoffshore")
                    : Optional.empty();
        };
    }
}
