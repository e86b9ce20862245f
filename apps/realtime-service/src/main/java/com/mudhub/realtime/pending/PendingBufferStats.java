package com.mudhub.realtime.pending;

/**
 * 暂存缓冲统计。
 *
 * @param identities 有暂存消息的玩家数
 * @param messages   暂存消息总数
 * @param evicted    因超出上限被丢弃的消息累计数
 * @param expired    因过期被丢弃的消息累计数
 */
public record PendingBufferStats(int identities, long messages, long evicted, long expired) {
}
