package com.mudhub.session;

import com.mudhub.session.model.CloseReason;
import com.mudhub.session.model.ConnectionInfo;

/**
 * 注册表事件监听器。
 *
 * 回调在该玩家的临界区内同步执行，因此同一玩家的事件严格有序
 * （先 LEFT 再 ENTERED）。实现方不要在回调里再去获取其他玩家的锁。
 */
public interface RegistryListener {

    /** 新连接登记完成（已在 connectionsFor 中可见） */
    default void onConnectionOpened(ConnectionInfo connection) {
    }

    /** 连接已移除 */
    default void onConnectionClosed(ConnectionInfo connection, CloseReason reason) {
    }

    /** 在线状态切换：0→1 个连接为 ENTERED，1→0 为 LEFT */
    default void onPresenceChanged(PresenceTransition transition) {
    }
}
