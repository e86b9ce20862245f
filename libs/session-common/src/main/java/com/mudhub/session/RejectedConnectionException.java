package com.mudhub.session;

/**
 * 连接被拒绝：身份/会话为空，或会话与该玩家当前的权威会话不一致。
 *
 * 只影响本次连接尝试，调用方负责关闭对应的传输连接。
 */
public class RejectedConnectionException extends RuntimeException {

    private final String identity;
    private final String sessionId;

    public RejectedConnectionException(String identity, String sessionId, String message) {
        super(message);
        this.identity = identity;
        this.sessionId = sessionId;
    }

    public String getIdentity() {
        return identity;
    }

    public String getSessionId() {
        return sessionId;
    }
}
