package xyz.vvrf.reactor.build.core;

/**
 * 构建会话已被取消。
 *
 * @author ruifeng.wen
 */
public class BuildCancelledException extends BuildException {

    public BuildCancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }
}
