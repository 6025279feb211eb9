package dev.aparikh.msgexplorer.config;

import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.impl.HttpSolrClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({SolrConfigurationProperties.class, EngineProperties.class})
class SolrConfig {

    private final SolrConfigurationProperties properties;

    SolrConfig(SolrConfigurationProperties properties) {
        this.properties = properties;
    }

    @Bean
    SolrClient solrClient() {
        // One client for all cores; callers pass the core name per request
        String baseUrl = properties.getBaseUrl();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }

        // Use default BinaryResponseParser for SolrJ 9
        return new HttpSolrClient.Builder(baseUrl).build();
    }
}
