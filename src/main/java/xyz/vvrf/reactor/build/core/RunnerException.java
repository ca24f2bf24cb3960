package xyz.vvrf.reactor.build.core;

import lombok.Getter;

/**
 * Runner 执行指令失败。
 *
 * @author ruifeng.wen
 */
@Getter
public class RunnerException extends BuildException {

    private final int exitCode;
    private final String stderr;

    public RunnerException(String message, int exitCode, String stderr) {
        super(ErrorKind.RUNNER, message);
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public RunnerException(String message, Throwable cause) {
        super(ErrorKind.RUNNER, message, cause);
        this.exitCode = -1;
        this.stderr = "";
    }
}
