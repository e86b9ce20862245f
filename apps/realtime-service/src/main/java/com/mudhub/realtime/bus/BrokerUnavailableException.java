package com.mudhub.realtime.bus;

/**
 * Broker 暂时不可用。由发布线程捕获并退避重试，不会传到业务调用方。
 */
public class BrokerUnavailableException extends RuntimeException {

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public BrokerUnavailableException(String message) {
        super(message);
    }
}
