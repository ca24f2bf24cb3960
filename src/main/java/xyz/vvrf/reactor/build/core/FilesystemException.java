package xyz.vvrf.reactor.build.core;

import lombok.Getter;

import java.nio.file.Path;

/**
 * 指纹计算时无法读取路径。
 *
 * @author ruifeng.wen
 */
@Getter
public class FilesystemException extends BuildException {

    private final Path path;

    public FilesystemException(Path path, Throwable cause) {
        super(ErrorKind.FILESYSTEM, "Failed to read '" + path + "': " + cause.getMessage(), cause);
        this.path = path;
    }
}
