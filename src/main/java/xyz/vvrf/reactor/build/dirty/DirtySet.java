package xyz.vvrf.reactor.build.dirty;

import xyz.vvrf.reactor.build.core.Digest;

import java.util.*;

/**
 * 一次脏标记的结果：每个节点的摘要以及是否需要重新解析。
 *
 * @author ruifeng.wen
 */
public final class DirtySet {

    /**
     * 节点的脏标记原因。
     */
    public enum Reason {
        /** 摘要与历史记录一致，且所有输入干净。*/
        CLEAN,
        /** 历史中没有该节点的记录。*/
        NO_RECORD,
        /** 摘要与上一次构建不同。*/
        DIGEST_CHANGED,
        /** 至少一个输入是脏的。*/
        INPUT_DIRTY
    }

    private final Map<Integer, Digest> digests;
    private final Map<Integer, Reason> reasons;

    DirtySet(Map<Integer, Digest> digests, Map<Integer, Reason> reasons) {
        this.digests = Collections.unmodifiableMap(new TreeMap<>(digests));
        this.reasons = Collections.unmodifiableMap(new TreeMap<>(reasons));
    }

    public boolean isDirty(int id) {
        Reason reason = reasons.get(id);
        if (reason == null) {
            throw new NoSuchElementException("Node " + id + " was not part of dirty marking.");
        }
        return reason != Reason.CLEAN;
    }

    public Reason reasonOf(int id) {
        return reasons.get(id);
    }

    public Digest digestOf(int id) {
        Digest digest = digests.get(id);
        if (digest == null) {
            throw new NoSuchElementException("Node " + id + " has no digest.");
        }
        return digest;
    }

    public Map<Integer, Digest> getDigests() {
        return digests;
    }

    public SortedSet<Integer> dirtyIds() {
        SortedSet<Integer> result = new TreeSet<>();
        reasons.forEach((id, reason) -> {
            if (reason != Reason.CLEAN) {
                result.add(id);
            }
        });
        return Collections.unmodifiableSortedSet(result);
    }

    public int dirtyCount() {
        return dirtyIds().size();
    }

    public int size() {
        return reasons.size();
    }

    @Override
    public String toString() {
        return "DirtySet{dirty=" + dirtyIds() + ", total=" + reasons.size() + '}';
    }
}
