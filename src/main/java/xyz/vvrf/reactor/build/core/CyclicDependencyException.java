package xyz.vvrf.reactor.build.core;

import lombok.Getter;

/**
 * 添加边会使图产生循环。
 *
 * @author ruifeng.wen
 */
@Getter
public class CyclicDependencyException extends BuildException {

    private final int nodeId;
    private final int inputId;

    public CyclicDependencyException(int nodeId, int inputId) {
        super(ErrorKind.CYCLIC_DEPENDENCY,
                String.format("Cycle detected! Adding input %d to node %d closes a cycle.", inputId, nodeId));
        this.nodeId = nodeId;
        this.inputId = inputId;
    }
}
