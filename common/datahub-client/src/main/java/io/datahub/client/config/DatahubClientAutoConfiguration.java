package io.datahub.client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.datahub.cache.InMemoryKeyValueCache;
import io.datahub.cache.KeyValueCache;
import io.datahub.cache.RedisKeyValueCache;
import io.datahub.client.ResilientApiClient;
import io.datahub.client.ResponseStore;
import io.datahub.client.auth.Credentials;
import io.datahub.client.auth.TokenEndpoint;
import io.datahub.client.auth.TokenManager;
import io.datahub.client.auth.TokenStore;
import io.datahub.client.metrics.ClientMetrics;
import io.datahub.client.query.QueryBuilder;
import io.datahub.client.transport.ApacheHttpTransport;
import io.datahub.client.transport.HttpTransport;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Auto-configuration for the data API client. The token manager and the client itself are only
 * created once {@code datahub.client.username} is set.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@EnableConfigurationProperties(DatahubClientProperties.class)
@ConditionalOnProperty(prefix = "datahub.client", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DatahubClientAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(HttpTransport.class)
    public ApacheHttpTransport datahubHttpTransport(DatahubClientProperties properties) {
        return ApacheHttpTransport.create(
            properties.getHttp().getConnectTimeout(),
            properties.getHttp().getReadTimeout()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock datahubClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ClientMetrics datahubClientMetrics(ObjectProvider<MeterRegistry> registry) {
        MeterRegistry meterRegistry = registry.getIfAvailable();
        return meterRegistry == null ? ClientMetrics.noop() : new ClientMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenStore datahubTokenStore(KeyValueCache cache,
                                        ObjectProvider<ObjectMapper> mapper,
                                        DatahubClientProperties properties) {
        return new TokenStore(cache, mapper.getIfAvailable(ObjectMapper::new), properties.getCache().getRetention());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseStore datahubResponseStore(KeyValueCache cache, DatahubClientProperties properties) {
        return new ResponseStore(cache, properties.getCache().getRetention());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "datahub.client", name = "username")
    public TokenManager datahubTokenManager(DatahubClientProperties properties,
                                            HttpTransport transport,
                                            TokenStore tokenStore,
                                            ObjectProvider<ObjectMapper> mapper,
                                            Clock clock,
                                            ClientMetrics metrics) {
        return new TokenManager(
            new Credentials(properties.getUsername(), properties.getPassword()),
            new TokenEndpoint(properties.getTokenUrl(), properties.getGrantType(), properties.getClientId()),
            transport,
            tokenStore,
            mapper.getIfAvailable(ObjectMapper::new),
            clock,
            metrics
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryBuilder datahubQueryBuilder(Clock clock, DatahubClientProperties properties) {
        return new QueryBuilder(clock, ZoneId.of(properties.getQuery().getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "datahub.client", name = "username")
    public ResilientApiClient resilientApiClient(DatahubClientProperties properties,
                                                 TokenManager tokenManager,
                                                 HttpTransport transport,
                                                 ResponseStore responseStore,
                                                 QueryBuilder queryBuilder,
                                                 ObjectProvider<ObjectMapper> mapper,
                                                 ClientMetrics metrics) {
        return new ResilientApiClient(
            properties.getApiBaseUrl(),
            tokenManager,
            transport,
            responseStore,
            queryBuilder,
            mapper.getIfAvailable(ObjectMapper::new),
            properties.getHttp().getReadTimeout(),
            properties.getMaxAuthRetries(),
            metrics
        );
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "datahub.client.cache", name = "type", havingValue = "memory", matchIfMissing = true)
    static class InMemoryCacheConfiguration {

        @Bean
        @ConditionalOnMissingBean(KeyValueCache.class)
        public InMemoryKeyValueCache datahubInMemoryCache(Clock clock) {
            return new InMemoryKeyValueCache(clock);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(StringRedisTemplate.class)
    @ConditionalOnProperty(prefix = "datahub.client.cache", name = "type", havingValue = "redis")
    static class RedisCacheConfiguration {

        @Bean
        @ConditionalOnMissingBean(KeyValueCache.class)
        @ConditionalOnBean(StringRedisTemplate.class)
        public RedisKeyValueCache datahubRedisCache(StringRedisTemplate redis) {
            return new RedisKeyValueCache(redis);
        }
    }
}
