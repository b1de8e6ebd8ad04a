package com.pnode.pnode_analytics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pnode.pnode_analytics.core.cache.LocalCacheTier;
import com.pnode.pnode_analytics.core.cache.RedisCacheTier;
import com.pnode.pnode_analytics.core.cache.TieredCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import java.time.Clock;

@Configuration
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LocalCacheTier localCacheTier(PNodeProperties properties, Clock clock) {
        return new LocalCacheTier(properties.getCache().getLocalMaxEntries(), clock);
    }

    @Bean
    public RedisCacheTier redisCacheTier(ReactiveStringRedisTemplate redisTemplate, PNodeProperties properties) {
        PNodeProperties.RemoteProperties remote = properties.getCache().getRemote();
        return new RedisCacheTier(redisTemplate, remote.isEnabled(), remote.getTimeout());
    }

    // Remote tier stays unused until BackgroundJobsInitializer has probed it
    @Bean
    public TieredCache tieredCache(RedisCacheTier redisCacheTier, LocalCacheTier localCacheTier,
                                   ObjectMapper objectMapper, Clock clock, PNodeProperties properties) {
        return new TieredCache(redisCacheTier, localCacheTier, objectMapper, clock,
                properties.getCache().getRemote().getRetryInterval());
    }
}
