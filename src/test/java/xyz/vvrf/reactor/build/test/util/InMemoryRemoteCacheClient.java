package xyz.vvrf.reactor.build.test.util;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.build.cache.remote.RemoteCacheClient;
import xyz.vvrf.reactor.build.core.CasIntegrityException;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.Digests;
import xyz.vvrf.reactor.build.core.NetworkException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存中的远程缓存客户端，行为与远程缓存服务一致（上传时校验内容）。
 * 可以模拟整体不可用、前 N 次调用失败、以及返回被篡改的内容。
 */
public class InMemoryRemoteCacheClient implements RemoteCacheClient {

    private final Map<Digest, byte[]> blobs = new ConcurrentHashMap<>();
    private final Map<Digest, Digest> actions = new ConcurrentHashMap<>();
    private final AtomicBoolean unavailable = new AtomicBoolean(false);
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private final AtomicBoolean corruptReads = new AtomicBoolean(false);
    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public Mono<Boolean> hasBlob(Digest digest) {
        return guard().then(Mono.fromSupplier(() -> blobs.containsKey(digest)));
    }

    @Override
    public Mono<byte[]> getBlob(Digest digest) {
        return guard().then(Mono.fromSupplier(() -> {
            byte[] bytes = blobs.get(digest);
            if (bytes != null && corruptReads.get()) {
                byte[] tampered = bytes.clone();
                if (tampered.length == 0) {
                    return new byte[]{42};
                }
                tampered[0] ^= 0x01;
                return tampered;
            }
            return bytes;
        }));
    }

    @Override
    public Mono<Void> putBlob(Digest digest, byte[] bytes) {
        return guard().then(Mono.fromRunnable(() -> {
            Digest actual = Digests.ofContent(bytes);
            if (!actual.equals(digest)) {
                throw new CasIntegrityException(digest, actual, bytes.length);
            }
            blobs.putIfAbsent(digest, bytes.clone());
        }));
    }

    @Override
    public Mono<Digest> getAction(Digest nodeDigest) {
        return guard().then(Mono.fromSupplier(() -> actions.get(nodeDigest)));
    }

    @Override
    public Mono<Void> putAction(Digest nodeDigest, Digest contentDigest) {
        return guard().then(Mono.fromRunnable(() -> actions.putIfAbsent(nodeDigest, contentDigest)));
    }

    private Mono<Void> guard() {
        return Mono.defer(() -> {
            calls.incrementAndGet();
            if (unavailable.get()) {
                return Mono.error(new NetworkException("remote cache unavailable", true, 503));
            }
            if (failuresRemaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                return Mono.error(new NetworkException("transient failure", true, 503));
            }
            return Mono.empty();
        });
    }

    public void setUnavailable(boolean value) {
        unavailable.set(value);
    }

    public void failNext(int count) {
        failuresRemaining.set(count);
    }

    public void setCorruptReads(boolean value) {
        corruptReads.set(value);
    }

    /**
     * 直接写入一条不经校验的记录，用于模拟存储中已有的坏数据。
     */
    public void seedUnchecked(Digest nodeDigest, Digest contentDigest, byte[] bytes) {
        blobs.put(contentDigest, bytes.clone());
        actions.put(nodeDigest, contentDigest);
    }

    public boolean containsAction(Digest nodeDigest) {
        return actions.containsKey(nodeDigest);
    }

    public int blobCount() {
        return blobs.size();
    }

    public int getCalls() {
        return calls.get();
    }
}
