package xyz.vvrf.reactor.build.cache.remote;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.build.core.Digest;

/**
 * 远程缓存存储的客户端。
 * 未找到时返回空 Mono；网络错误以 NetworkException 结束；
 * 服务端拒绝上传的内容时以 CasIntegrityException 结束。
 * 实现不做重试，重试策略由 {@link xyz.vvrf.reactor.build.cache.RemoteCacheTier} 负责。
 *
 * @author ruifeng.wen
 */
public interface RemoteCacheClient {

    Mono<Boolean> hasBlob(Digest digest);

    Mono<byte[]> getBlob(Digest digest);

    Mono<Void> putBlob(Digest digest, byte[] bytes);

    Mono<Digest> getAction(Digest nodeDigest);

    Mono<Void> putAction(Digest nodeDigest, Digest contentDigest);
}
