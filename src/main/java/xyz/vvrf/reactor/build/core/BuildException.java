package xyz.vvrf.reactor.build.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 构建引擎所有错误的基类（非受检异常，便于在 Reactor 流中传递）。
 *
 * @author ruifeng.wen
 */
@Getter
public class BuildException extends RuntimeException {

    private final ErrorKind kind;

    public BuildException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "错误类别不能为空");
    }

    public BuildException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "错误类别不能为空");
    }

    public boolean isIntegrityViolation() {
        return kind == ErrorKind.CAS_INTEGRITY;
    }
}
