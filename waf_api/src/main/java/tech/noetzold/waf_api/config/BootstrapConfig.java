package tech.noetzold.waf_api.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.noetzold.waf_api.client.DeepEngineClient;
import tech.noetzold.waf_api.client.FastEngineClient;
import tech.noetzold.waf_api.model.RuleVersion;
import tech.noetzold.waf_api.service.RuleStore;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class BootstrapConfig {

    private final RuleStore ruleStore;
    private final FastEngineClient fastEngine;
    private final DeepEngineClient deepEngine;

    /** Seeds rule version 1 on an empty store and reports which engines are live. */
    @Bean
    public ApplicationRunner ruleStoreSeeder() {
        return args -> {
            RuleVersion current = ruleStore.seedIfEmpty();
            log.info("Rules v{} in effect; fast engine {} {}, deep engine {} {}",
                    current.getVersion(),
                    fastEngine.name(), fastEngine.isConfigured() ? "configured" : "not configured",
                    deepEngine.name(), deepEngine.isConfigured() ? "configured" : "not configured");
        };
    }
}
