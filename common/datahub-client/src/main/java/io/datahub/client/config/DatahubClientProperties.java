package io.datahub.client.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the data API client.
 */
@ConfigurationProperties(prefix = "datahub.client")
public class DatahubClientProperties {

    private boolean enabled = true;
    private String apiBaseUrl = "https://datenhub.ulm.de/api/datasets";
    private String tokenUrl = "https://datenhub.ulm.de/auth/realms/datenhubulm/protocol/openid-connect/token";
    private String grantType = "password";
    private String clientId = "admin-cli";
    private String username;
    private String password;
    private int maxAuthRetries = 5;
    private HttpProperties http = new HttpProperties();
    private CacheProperties cache = new CacheProperties();
    private QueryProperties query = new QueryProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public void setApiBaseUrl(String apiBaseUrl) {
        this.apiBaseUrl = apiBaseUrl;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public void setTokenUrl(String tokenUrl) {
        this.tokenUrl = tokenUrl;
    }

    public String getGrantType() {
        return grantType;
    }

    public void setGrantType(String grantType) {
        this.grantType = grantType;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getMaxAuthRetries() {
        return maxAuthRetries;
    }

    public void setMaxAuthRetries(int maxAuthRetries) {
        this.maxAuthRetries = maxAuthRetries;
    }

    public HttpProperties getHttp() {
        return http;
    }

    public void setHttp(HttpProperties http) {
        this.http = http;
    }

    public CacheProperties getCache() {
        return cache;
    }

    public void setCache(CacheProperties cache) {
        this.cache = cache;
    }

    public QueryProperties getQuery() {
        return query;
    }

    public void setQuery(QueryProperties query) {
        this.query = query;
    }

    public static class HttpProperties {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(5);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class CacheProperties {
        /** {@code memory} or {@code redis}. */
        private String type = "memory";
        private Duration retention = Duration.ofHours(72);

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }

    public static class QueryProperties {
        /** Zone whose midnight starts a since-midnight window. */
        private String zone = "UTC";

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }
}
