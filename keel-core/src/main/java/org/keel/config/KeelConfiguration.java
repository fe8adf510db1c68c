package org.keel.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

import java.util.HashMap;
import java.util.Map;

@Data
public class KeelConfiguration {

    /**
     * Settings per profile name.
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    public static class ProfileConfiguration {

        @JsonProperty("datasource")
        private DatasourceConfiguration datasource;

        @JsonProperty("schema")
        private String schema;

        @JsonProperty("migrations")
        private MigrationsConfiguration migrations;

        @JsonProperty("diff")
        private DiffConfiguration diff;
    }

    @Data
    public static class DatasourceConfiguration {

        @ToString.Exclude
        @JsonProperty("url")
        private String url;

        @ToString.Exclude
        @JsonProperty("shadowUrl")
        private String shadowUrl;
    }

    @Data
    public static class MigrationsConfiguration {

        @JsonProperty("directory")
        private String directory;
    }

    /**
     * Diff tuning; {@code indexColumnOrder} is one of provider, significant, ignored.
     */
    @Data
    public static class DiffConfiguration {

        @JsonProperty("indexColumnOrder")
        private String indexColumnOrder;
    }
}
