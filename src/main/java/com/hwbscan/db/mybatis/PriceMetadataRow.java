package com.hwbscan.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceMetadataRow {
    private String symbol;
    private String firstDate;
    private String lastDate;
    private String lastUpdated;
    private Integer dailyCount;
    private Integer weeklyCount;
}
