package com.gymtracker.dto;

import lombok.Value;

/**
 * 一次区间查询请求，带上发起它的导航状态作为标记
 */
@Value
public class RangeFetch {
    NavigationState tag;
    DateRange range;

    public boolean isStale(NavigationState current) {
        return !tag.equals(current);
    }
}
