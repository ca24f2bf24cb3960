package xyz.vvrf.reactor.build.cache.remote;

/**
 * 远程缓存 HTTP 协议常量。客户端与服务端共用。
 *
 * @author ruifeng.wen
 */
public final class CacheProtocol {

    private CacheProtocol() {}

    /** 每个请求与响应都必须携带的协议版本头。*/
    public static final String VERSION_HEADER = "X-Reactor-Build-Cache-Version";
    public static final String VERSION = "1";

    public static final String BLOB_PATH = "/cache/{digest}";
    public static final String ACTION_PATH = "/ac/{digest}";
    public static final String GC_PATH = "/gc";

    /** 错误响应 JSON 中的 error 字段取值。*/
    public static final String ERROR_FIELD = "error";
    public static final String ERROR_CAS_INTEGRITY = "CASIntegrityFailure";
    public static final String ERROR_UNSUPPORTED_VERSION = "UnsupportedVersion";
    public static final String ERROR_INVALID_DIGEST = "InvalidDigest";
    public static final String ERROR_MISSING_BLOB = "MissingBlob";
}
