package it.unimib.datai.fnship.cli.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

public final class ConfigStore {
    static final String ENV_CONTEXT = "FNSHIP_CONTEXT";
    static final String ENV_REGION = "FNSHIP_REGION";
    static final String ENV_ENDPOINT = "FNSHIP_ENDPOINT";
    static final String ENV_PROFILE = "FNSHIP_PROFILE";

    private final Path path;
    private final ObjectMapper yaml;
    private final Function<String, String> getenv;

    public ConfigStore() {
        this(defaultPath(), System::getenv);
    }

    public ConfigStore(Path path) {
        this(path, System::getenv);
    }

    public ConfigStore(Path path, Function<String, String> getenv) {
        this.path = path;
        this.getenv = getenv;
        this.yaml = new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Config load() {
        if (!Files.exists(path)) {
            return new Config();
        }
        try {
            Config config = yaml.readValue(path.toFile(), Config.class);
            return config == null ? new Config() : config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config: " + path, e);
        }
    }

    public void save(Config config) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            yaml.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), config);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write config: " + path, e);
        }
    }

    public ResolvedContext loadResolvedContext() {
        Config cfg = load();

        String contextName = firstNonBlank(getenv.apply(ENV_CONTEXT), cfg.getCurrentContext());
        Context ctx = (contextName == null || cfg.getContexts() == null) ? null : cfg.getContexts().get(contextName);

        String region = firstNonBlank(getenv.apply(ENV_REGION), ctx == null ? null : ctx.getRegion());
        String endpoint = firstNonBlank(getenv.apply(ENV_ENDPOINT), ctx == null ? null : ctx.getEndpoint());
        String profile = firstNonBlank(getenv.apply(ENV_PROFILE), ctx == null ? null : ctx.getProfile());

        return new ResolvedContext(contextName, region, endpoint, profile,
                ctx == null ? null : ctx.getRoleName(),
                ctx == null ? null : ctx.getActivationTimeoutSeconds());
    }

    public Path getPath() {
        return path;
    }

    private static Path defaultPath() {
        String home = System.getProperty("user.home");
        return Path.of(home, ".config", "fnship", "config.yaml");
    }

    static String firstNonBlank(String... values) {
        if (values == null) {
            return null;
        }
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }
}
