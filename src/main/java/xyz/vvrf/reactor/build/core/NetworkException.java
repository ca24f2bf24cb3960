package xyz.vvrf.reactor.build.core;

import lombok.Getter;

/**
 * 远程缓存网络错误。只有 {@link #isRetryable()} 为 true 的错误会被重试。
 *
 * @author ruifeng.wen
 */
@Getter
public class NetworkException extends BuildException {

    private final boolean retryable;
    /** HTTP 状态码，连接级错误为 -1。*/
    private final int status;

    public NetworkException(String message, boolean retryable, int status) {
        super(ErrorKind.NETWORK, message);
        this.retryable = retryable;
        this.status = status;
    }

    public NetworkException(String message, boolean retryable, Throwable cause) {
        super(ErrorKind.NETWORK, message, cause);
        this.retryable = retryable;
        this.status = -1;
    }

    public static boolean isRetryable(Throwable error) {
        return error instanceof NetworkException && ((NetworkException) error).isRetryable();
    }
}
