package com.hwbscan.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface PriceCacheMapper {
    @Select("SELECT symbol, first_date, last_date, last_updated, daily_count, weekly_count " +
            "FROM metadata WHERE symbol=#{symbol}")
    PriceMetadataRow selectMetadata(@Param("symbol") String symbol);

    @Select("SELECT symbol, date AS bar_date, open, high, low, close, volume, sma200, ema200 " +
            "FROM daily_prices WHERE symbol=#{symbol} ORDER BY date ASC")
    List<PriceRow> selectDaily(@Param("symbol") String symbol);

    @Select("SELECT symbol, week_start AS bar_date, open, high, low, close, volume, sma200, NULL AS ema200 " +
            "FROM weekly_prices WHERE symbol=#{symbol} ORDER BY week_start ASC")
    List<PriceRow> selectWeekly(@Param("symbol") String symbol);
}
