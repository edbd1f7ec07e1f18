package com.guno.orderpipeline.schema;

import com.guno.orderpipeline.entity.CampaignFlag;
import com.guno.orderpipeline.entity.CampaignInfo;
import com.guno.orderpipeline.mapper.FlatRowColumns;
import com.guno.orderpipeline.repository.AnalyticsStore;
import com.guno.orderpipeline.repository.ColumnFilter;
import com.guno.orderpipeline.repository.ColumnType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Adds campaign_flag to a flattened table and fills it from the order-level coupon.
 * Running it again recomputes every row.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CampaignFlagMigration {

    private final AnalyticsStore store;

    /**
     * @return number of rows assigned a flag
     */
    public int apply(String table) {
        store.alterAddColumn(table, FlatRowColumns.CAMPAIGN_FLAG, ColumnType.TEXT);

        String coupon = FlatRowColumns.ORDER_CAMPAIGN_COUPON;
        int notUsing = store.updateWhere(table,
                List.of(ColumnFilter.eq(coupon, CampaignInfo.NO_CAMPAIGN)),
                flag(CampaignFlag.NOT_USING_CAMPAIGNS));
        notUsing += store.updateWhere(table,
                List.of(ColumnFilter.isNull(coupon)),
                flag(CampaignFlag.NOT_USING_CAMPAIGNS));
        int used = store.updateWhere(table,
                List.of(ColumnFilter.ne(coupon, CampaignInfo.NO_CAMPAIGN)),
                flag(CampaignFlag.CAMPAIGN_USED));

        log.info("🏷️ campaign_flag on {}: {} used, {} not using", table, used, notUsing);
        return used + notUsing;
    }

    public void revert(String table) {
        store.dropColumn(table, FlatRowColumns.CAMPAIGN_FLAG);
    }

    private Map<String, Object> flag(CampaignFlag flag) {
        return Map.of(FlatRowColumns.CAMPAIGN_FLAG, flag.getLabel());
    }
}
