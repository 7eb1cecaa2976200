package com.slicer.infrastructure.config;

import com.slicer.domain.exception.ConfigurationException;
import com.slicer.domain.model.SlicerSettings;
import com.slicer.engine.cut.CutParser;
import com.slicer.engine.cut.StringCutParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.List;

/**
 * Server option wiring.
 *
 * The engine {@link com.slicer.engine.Workspace} is not created here; the
 * deployment embedding the slicer registers it as a bean.
 */
@Slf4j
@Configuration
public class SlicerConfiguration {

    @Bean
    public ConfigurationStore configurationStore(Environment environment) {
        return new ConfigurationStore(environment);
    }

    /**
     * Options are resolved while the context starts, so an invalid value
     * prevents the server from accepting requests.
     */
    @Bean
    public SlicerSettings slicerSettings(ConfigurationStore store) {
        return createSettings(store);
    }

    @Bean
    @ConditionalOnMissingBean
    public CutParser cutParser() {
        return new StringCutParser();
    }

    public static SlicerSettings createSettings(ConfigurationStore store) {
        boolean prettyPrint = store.configureBoolean("prettyprint", false);
        int jsonRecordLimit = store.configureInt("json_record_limit", 1000);
        String authorizationMethod = store.configureString("authorization_method",
                SlicerSettings.HTTP_BASIC, List.of(SlicerSettings.HTTP_BASIC));

        if (jsonRecordLimit < 1) {
            throw new ConfigurationException("Option 'json_record_limit' should be positive, got " + jsonRecordLimit);
        }

        log.info("Slicer configured: prettyprint={}, json_record_limit={}, authorization_method={}",
                prettyPrint, jsonRecordLimit, authorizationMethod);

        return SlicerSettings.builder()
                .prettyPrint(prettyPrint)
                .jsonRecordLimit(jsonRecordLimit)
                .authorizationMethod(authorizationMethod)
                .build();
    }
}
