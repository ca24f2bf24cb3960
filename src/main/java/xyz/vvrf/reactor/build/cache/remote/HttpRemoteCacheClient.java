package xyz.vvrf.reactor.build.cache.remote;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.build.core.CasIntegrityException;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.NetworkException;

import java.util.Objects;

/**
 * 基于 Spring WebClient 的远程缓存客户端。
 * <p>
 * 状态码映射：404 → 空；5xx、429 与连接错误 → 可重试的 NetworkException；
 * 400 且 error=CASIntegrityFailure → CasIntegrityException；其余 4xx → 不可重试的 NetworkException。
 * 成功响应缺少或携带不匹配的协议版本头时视为不可重试错误。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class HttpRemoteCacheClient implements RemoteCacheClient {

    private final WebClient webClient;
    private final String baseUrl;

    public HttpRemoteCacheClient(WebClient.Builder builder, String baseUrl) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "远程缓存地址不能为空");
        this.webClient = Objects.requireNonNull(builder, "WebClient.Builder 不能为空")
                .baseUrl(baseUrl)
                .defaultHeader(CacheProtocol.VERSION_HEADER, CacheProtocol.VERSION)
                .build();
        log.info("HttpRemoteCacheClient initialized. Base URL: {}", baseUrl);
    }

    public HttpRemoteCacheClient(String baseUrl) {
        this(WebClient.builder(), baseUrl);
    }

    @Override
    public Mono<Boolean> hasBlob(Digest digest) {
        return webClient.head()
                .uri(CacheProtocol.BLOB_PATH, digest.hex())
                .exchangeToMono(response -> {
                    if (isNotFound(response)) {
                        return response.releaseBody().thenReturn(false);
                    }
                    if (isSuccess(response)) {
                        return checkVersion(response).then(response.releaseBody()).thenReturn(true);
                    }
                    return toError(response, "HEAD blob " + digest.shortHex(), digest);
                })
                .onErrorMap(WebClientRequestException.class, e -> connectionError("HEAD blob", e));
    }

    @Override
    public Mono<byte[]> getBlob(Digest digest) {
        return webClient.get()
                .uri(CacheProtocol.BLOB_PATH, digest.hex())
                .accept(MediaType.APPLICATION_OCTET_STREAM)
                .exchangeToMono(response -> {
                    if (isNotFound(response)) {
                        return response.releaseBody().then(Mono.<byte[]>empty());
                    }
                    if (isSuccess(response)) {
                        return checkVersion(response).then(response.bodyToMono(byte[].class).defaultIfEmpty(new byte[0]));
                    }
                    return toError(response, "GET blob " + digest.shortHex(), digest);
                })
                .onErrorMap(WebClientRequestException.class, e -> connectionError("GET blob", e));
    }

    @Override
    public Mono<Void> putBlob(Digest digest, byte[] bytes) {
        return webClient.put()
                .uri(CacheProtocol.BLOB_PATH, digest.hex())
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(bytes)
                .exchangeToMono(response -> {
                    if (isSuccess(response)) {
                        return checkVersion(response).then(response.releaseBody());
                    }
                    return toError(response, "PUT blob " + digest.shortHex(), digest);
                })
                .onErrorMap(WebClientRequestException.class, e -> connectionError("PUT blob", e))
                .then();
    }

    @Override
    public Mono<Digest> getAction(Digest nodeDigest) {
        return webClient.get()
                .uri(CacheProtocol.ACTION_PATH, nodeDigest.hex())
                .accept(MediaType.TEXT_PLAIN)
                .exchangeToMono(response -> {
                    if (isNotFound(response)) {
                        return response.releaseBody().then(Mono.<Digest>empty());
                    }
                    if (isSuccess(response)) {
                        return checkVersion(response)
                                .then(response.bodyToMono(String.class).defaultIfEmpty(""))
                                .flatMap(body -> parseDigest(body, nodeDigest));
                    }
                    return toError(response, "GET action " + nodeDigest.shortHex(), nodeDigest);
                })
                .onErrorMap(WebClientRequestException.class, e -> connectionError("GET action", e));
    }

    @Override
    public Mono<Void> putAction(Digest nodeDigest, Digest contentDigest) {
        return webClient.put()
                .uri(CacheProtocol.ACTION_PATH, nodeDigest.hex())
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue(contentDigest.hex())
                .exchangeToMono(response -> {
                    if (isSuccess(response)) {
                        return checkVersion(response).then(response.releaseBody());
                    }
                    return toError(response, "PUT action " + nodeDigest.shortHex(), contentDigest);
                })
                .onErrorMap(WebClientRequestException.class, e -> connectionError("PUT action", e))
                .then();
    }

    private static boolean isNotFound(ClientResponse response) {
        return response.rawStatusCode() == HttpStatus.NOT_FOUND.value();
    }

    private static boolean isSuccess(ClientResponse response) {
        int status = response.rawStatusCode();
        return status >= 200 && status < 300;
    }

    private static Mono<Digest> parseDigest(String body, Digest nodeDigest) {
        String hex = body.trim();
        if (!Digest.isValidHex(hex)) {
            return Mono.error(new NetworkException(
                    "Malformed action entry for " + nodeDigest.shortHex() + ": '" + hex + "'", false, 200));
        }
        return Mono.just(Digest.fromHex(hex));
    }

    private static Mono<Void> checkVersion(ClientResponse response) {
        String version = response.headers().asHttpHeaders().getFirst(CacheProtocol.VERSION_HEADER);
        if (!CacheProtocol.VERSION.equals(version)) {
            return response.releaseBody().then(Mono.error(new NetworkException(
                    "Remote cache protocol version mismatch: expected " + CacheProtocol.VERSION + ", got " + version,
                    false, response.rawStatusCode())));
        }
        return Mono.empty();
    }

    private static <T> Mono<T> toError(ClientResponse response, String operation, Digest digest) {
        int status = response.rawStatusCode();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    if (status == HttpStatus.BAD_REQUEST.value() && body.contains(CacheProtocol.ERROR_CAS_INTEGRITY)) {
                        log.error("Remote cache rejected {}: CAS integrity failure. Body: {}", operation, body);
                        return Mono.error(new CasIntegrityException(digest, "rejected by remote cache: " + body));
                    }
                    boolean retryable = status >= 500 || status == HttpStatus.TOO_MANY_REQUESTS.value();
                    String message = String.format("%s failed with HTTP %d%s", operation, status,
                            body.isEmpty() ? "" : ": " + body);
                    return Mono.error(new NetworkException(message, retryable, status));
                });
    }

    private static NetworkException connectionError(String operation, WebClientRequestException e) {
        return new NetworkException(operation + " failed: " + e.getMessage(), true, e);
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
