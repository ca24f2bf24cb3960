package xyz.vvrf.reactor.build.server.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.build.cache.remote.CacheProtocol;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 远程缓存协议版本检查。
 * 缓存接口的每个请求都必须携带匹配的版本头，否则返回 400 UnsupportedVersion；每个响应都带上版本头。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CacheProtocolVersionFilter implements WebFilter {

    private final ObjectMapper objectMapper;

    public CacheProtocolVersionFilter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (!isCachePath(path)) {
            return chain.filter(exchange);
        }
        ServerHttpResponse response = exchange.getResponse();
        response.getHeaders().set(CacheProtocol.VERSION_HEADER, CacheProtocol.VERSION);

        String version = exchange.getRequest().getHeaders().getFirst(CacheProtocol.VERSION_HEADER);
        if (CacheProtocol.VERSION.equals(version)) {
            return chain.filter(exchange);
        }
        log.warn("Rejected {} {}: unsupported protocol version '{}'.", exchange.getRequest().getMethodValue(), path, version);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(CacheProtocol.ERROR_FIELD, CacheProtocol.ERROR_UNSUPPORTED_VERSION);
        body.put("expected", CacheProtocol.VERSION);
        body.put("actual", version);
        response.setStatusCode(HttpStatus.BAD_REQUEST);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = response.bufferFactory().wrap(serialize(body));
        return response.writeWith(Mono.just(buffer));
    }

    private byte[] serialize(Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize error body: {}", e.getMessage());
            return ("{\"" + CacheProtocol.ERROR_FIELD + "\":\"" + CacheProtocol.ERROR_UNSUPPORTED_VERSION + "\"}")
                    .getBytes(StandardCharsets.UTF_8);
        }
    }

    static boolean isCachePath(String path) {
        return path.startsWith("/cache/") || path.startsWith("/ac/") || path.equals(CacheProtocol.GC_PATH);
    }
}
