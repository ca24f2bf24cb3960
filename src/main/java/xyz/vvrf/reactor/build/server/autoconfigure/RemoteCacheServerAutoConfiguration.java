package xyz.vvrf.reactor.build.server.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.build.cache.DiskCacheStore;
import xyz.vvrf.reactor.build.server.controller.RemoteCacheController;
import xyz.vvrf.reactor.build.server.filter.CacheProtocolVersionFilter;
import xyz.vvrf.reactor.build.spring.boot.BuildEngineAutoConfiguration;
import xyz.vvrf.reactor.build.spring.boot.BuildEngineProperties;

import java.nio.file.Paths;

/**
 * 以响应式 Web 应用运行且 {@code build.server.enabled=true} 时，暴露远程缓存 HTTP 接口。
 * 服务端存储目录为 {@code build.server.storage-directory}。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Configuration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
@ConditionalOnProperty(prefix = "build.server", name = "enabled", havingValue = "true")
@AutoConfigureAfter(BuildEngineAutoConfiguration.class)
public class RemoteCacheServerAutoConfiguration {

    @Bean(name = "remoteCacheServerStore")
    @ConditionalOnMissingBean(name = "remoteCacheServerStore")
    public DiskCacheStore remoteCacheServerStore(BuildEngineProperties properties) {
        String directory = properties.getServer().getStorageDirectory();
        log.info("正在创建远程缓存服务端存储，目录: {}", directory);
        return new DiskCacheStore(Paths.get(directory));
    }

    @Bean
    @ConditionalOnMissingBean
    public RemoteCacheController remoteCacheController(@Qualifier("remoteCacheServerStore") DiskCacheStore store,
                                                       @Qualifier("buildIoScheduler") Scheduler scheduler) {
        return new RemoteCacheController(store, scheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheProtocolVersionFilter cacheProtocolVersionFilter(ObjectProvider<ObjectMapper> objectMapper) {
        return new CacheProtocolVersionFilter(objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
