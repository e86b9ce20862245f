package com.mudhub.realtime.dispatch;

/**
 * 本地投递统计。
 */
public record DeliveryStats(int live, int pending, int dropped) {

    public static final DeliveryStats EMPTY = new DeliveryStats(0, 0, 0);
}
