package com.ryuqq.resilience.core.error;

/**
 * 연결 실패 오류 (재시도 가능).
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class NetworkException extends ResilienceException {

    private static final long serialVersionUID = 1L;

    private final boolean timeout;

    public NetworkException(String message) {
        this(message, null, false);
    }

    public NetworkException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private NetworkException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    /**
     * 시도 타임아웃을 나타내는 네트워크 오류 생성.
     *
     * @param message 메시지
     * @param cause 원인 (null 허용)
     * @return kind가 TIMEOUT인 NetworkException
     */
    public static NetworkException timeout(String message, Throwable cause) {
        return new NetworkException(message, cause, true);
    }

    @Override
    public ErrorKind kind() {
        return timeout ? ErrorKind.TIMEOUT : ErrorKind.NETWORK;
    }
}
