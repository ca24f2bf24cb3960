package xyz.vvrf.reactor.build.execution;

import lombok.Getter;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.NodeResult;

/**
 * 解析得到的产物及其来源。
 *
 * @author ruifeng.wen
 */
@Getter
final class Resolution {

    private final Artifact artifact;
    private final NodeResult.Origin origin;

    Resolution(Artifact artifact, NodeResult.Origin origin) {
        this.artifact = artifact;
        this.origin = origin;
    }
}
