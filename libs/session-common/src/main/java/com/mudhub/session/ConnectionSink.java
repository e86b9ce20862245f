package com.mudhub.session;

import com.mudhub.session.model.CloseReason;
import com.mudhub.session.model.RealtimeEnvelope;

import java.io.IOException;

/**
 * 传输层提供的连接句柄。
 *
 * 注册表自身不做任何 IO，只在踢出/回收连接时调用 {@link #close}。
 */
public interface ConnectionSink {

    /**
     * 向该连接推送一条消息。
     *
     * @throws IOException 传输层写失败（调用方会把连接标记为不健康）
     */
    void send(RealtimeEnvelope envelope) throws IOException;

    /**
     * 关闭连接。实现方不得抛出异常，失败时记录日志即可。
     */
    void close(CloseReason reason, String message);
}
