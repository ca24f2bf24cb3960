package xyz.vvrf.reactor.build.core;

import lombok.Getter;

/**
 * 节点引用了不存在的输入。
 *
 * @author ruifeng.wen
 */
@Getter
public class UnknownInputException extends BuildException {

    private final String input;

    public UnknownInputException(String input) {
        super(ErrorKind.UNKNOWN_INPUT, "Unknown input node: " + input);
        this.input = input;
    }
}
