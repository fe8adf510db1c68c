package org.keel.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.keel.options.KeelOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = KeelOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = KeelOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = KeelOptions.Profile.ENV_VAR;
    private static final Pattern ENV_REFERENCE = Pattern.compile("^env\\(\\s*\"([^\"]+)\"\\s*\\)$");

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final UnaryOperator<String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath(), System::getenv);
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    public ConfigurationLoader(Path startDirectory, UnaryOperator<String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * Loads the configuration file and flattens the active profile into a key/value map.
     * Profile precedence: CLI option, then {@code KEEL_PROFILE}, then {@code dev}.
     *
     * @param cliProfile profile given on the command line, may be null
     * @return resolved settings keyed by the {@link KeelOptions} keys
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<KeelConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    /**
     * Resolves {@code env("NAME")} references. Other values are returned unchanged.
     */
    public String resolveValue(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = ENV_REFERENCE.matcher(value.trim());
        if (!m.matches()) {
            return value;
        }
        String resolved = environment.apply(m.group(1));
        if (resolved == null) {
            log.warn("Environment variable '{}' is not set", m.group(1));
        }
        return resolved;
    }

    private String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * Walks up from the start directory looking for {@code keel.yaml}.
     */
    private Optional<KeelConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    KeelConfiguration config = yamlMapper.readValue(configFile.toFile(), KeelConfiguration.class);
                    log.debug("Loaded configuration from {}", configFile);
                    return Optional.of(config);
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(KeelConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        if (profileConfig.getSchema() != null) {
            configMap.put(KeelOptions.Schema.PATH_KEY, profileConfig.getSchema());
        }

        var datasource = profileConfig.getDatasource();
        if (datasource != null) {
            putResolved(configMap, KeelOptions.Datasource.URL_KEY, datasource.getUrl());
            putResolved(configMap, KeelOptions.Datasource.SHADOW_URL_KEY, datasource.getShadowUrl());
        }

        if (profileConfig.getMigrations() != null && profileConfig.getMigrations().getDirectory() != null) {
            configMap.put(KeelOptions.Migrations.DIRECTORY_KEY, profileConfig.getMigrations().getDirectory());
        }

        if (profileConfig.getDiff() != null && profileConfig.getDiff().getIndexColumnOrder() != null) {
            configMap.put(KeelOptions.Diff.INDEX_COLUMN_ORDER_KEY, profileConfig.getDiff().getIndexColumnOrder());
        }

        return configMap;
    }

    private void putResolved(Map<String, String> target, String key, String raw) {
        String value = resolveValue(raw);
        if (value != null) {
            target.put(key, value);
        }
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                KeelOptions.Schema.PATH_KEY, KeelOptions.Schema.DEFAULT_FILE,
                KeelOptions.Migrations.DIRECTORY_KEY, KeelOptions.Migrations.DEFAULT_DIRECTORY
        );
    }
}
