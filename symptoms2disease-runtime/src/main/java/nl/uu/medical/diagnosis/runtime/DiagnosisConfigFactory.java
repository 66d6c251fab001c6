package nl.uu.medical.diagnosis.runtime;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

import java.util.Map;

/**
 * Builds a {@link DiagnosisConfig} outside a Quarkus application, e.g. from a command line tool
 * or a test. System properties and environment variables apply; {@code overrides} win over both.
 */
public final class DiagnosisConfigFactory {

    private static final int OVERRIDE_ORDINAL = 500;

    private DiagnosisConfigFactory() {
    }

    public static DiagnosisConfig create() {
        return create(Map.of());
    }

    public static DiagnosisConfig create(Map<String, String> overrides) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .withMapping(DiagnosisConfig.class)
                .addDefaultSources()
                .withSources(new PropertiesConfigSource(overrides, "diagnosis-overrides", OVERRIDE_ORDINAL))
                .build();
        return config.getConfigMapping(DiagnosisConfig.class);
    }
}
