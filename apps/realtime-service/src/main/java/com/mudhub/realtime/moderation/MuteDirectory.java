package com.mudhub.realtime.moderation;

import com.mudhub.realtime.routing.ChannelKind;

/**
 * 屏蔽关系查询。系统频道不经过这里。
 */
public interface MuteDirectory {

    /**
     * @return recipient 是否屏蔽了 sender（或屏蔽了整个频道）
     */
    boolean isMuted(String recipient, String sender, ChannelKind kind);
}
