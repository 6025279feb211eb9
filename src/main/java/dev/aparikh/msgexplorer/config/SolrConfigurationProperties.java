package dev.aparikh.msgexplorer.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed configuration properties for the Solr cores the engine reads from.
 */
@Validated
@ConfigurationProperties(prefix = "solr")
public class SolrConfigurationProperties {

    @NotBlank
    private String baseUrl;

    @NotBlank
    private String messagesCore = "messages";

    @NotBlank
    private String distributionsCore = "distributions";

    @NotBlank
    private String datasetsCore = "datasets";

    @NotBlank
    private String groupsCore = "groups";

    @Positive
    private int fetchBatchSize = 1000; // rows per cursor page when scanning the corpus

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getMessagesCore() {
        return messagesCore;
    }

    public void setMessagesCore(String messagesCore) {
        this.messagesCore = messagesCore;
    }

    public String getDistributionsCore() {
        return distributionsCore;
    }

    public void setDistributionsCore(String distributionsCore) {
        this.distributionsCore = distributionsCore;
    }

    public String getDatasetsCore() {
        return datasetsCore;
    }

    public void setDatasetsCore(String datasetsCore) {
        this.datasetsCore = datasetsCore;
    }

    public String getGroupsCore() {
        return groupsCore;
    }

    public void setGroupsCore(String groupsCore) {
        this.groupsCore = groupsCore;
    }

    public int getFetchBatchSize() {
        return fetchBatchSize;
    }

    public void setFetchBatchSize(int fetchBatchSize) {
        this.fetchBatchSize = fetchBatchSize;
    }
}
