package com.mudhub.realtime.dispatch;

import com.mudhub.session.PresenceTransition;
import com.mudhub.session.RegistryListener;
import com.mudhub.session.model.ConnectionInfo;
import lombok.RequiredArgsConstructor;

/**
 * 把注册表事件接到分发器上：
 * - 新连接：补发暂存消息；
 * - 上下线：通知同一位置的玩家。
 *
 * 回调在当事人的注册表锁内执行，因此同一玩家的 LEFT 一定先于随后的 ENTERED 发出。
 */
@RequiredArgsConstructor
public class PresenceNotifier implements RegistryListener {

    private final BroadcastDispatcher dispatcher;

    @Override
    public void onConnectionOpened(ConnectionInfo connection) {
        dispatcher.deliverPending(connection);
    }

    @Override
    public void onPresenceChanged(PresenceTransition transition) {
        dispatcher.announce(transition);
    }
}
