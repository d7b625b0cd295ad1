package com.hwbscan.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceRow {
    private String symbol;
    private String barDate;
    private Double open;
    private Double high;
    private Double low;
    private Double close;
    private Long volume;
    private Double sma200;
    private Double ema200;
}
