package xyz.vvrf.reactor.build.cache;

import lombok.Getter;

/**
 * 一次垃圾回收的统计。
 *
 * @author ruifeng.wen
 */
@Getter
public final class GcStats {

    private final int scanned;
    private final int deletedBlobs;
    private final int deletedActions;
    private final long freedBytes;
    private final long remainingBytes;

    public GcStats(int scanned, int deletedBlobs, int deletedActions, long freedBytes, long remainingBytes) {
        this.scanned = scanned;
        this.deletedBlobs = deletedBlobs;
        this.deletedActions = deletedActions;
        this.freedBytes = freedBytes;
        this.remainingBytes = remainingBytes;
    }

    @Override
    public String toString() {
        return String.format("GcStats{scanned=%d, deletedBlobs=%d, deletedActions=%d, freed=%d bytes, remaining=%d bytes}",
                scanned, deletedBlobs, deletedActions, freedBytes, remainingBytes);
    }
}
