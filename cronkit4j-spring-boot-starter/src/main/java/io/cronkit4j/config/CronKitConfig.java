package io.cronkit4j.config;

import io.cronkit4j.CronService;
import io.cronkit4j.PayloadHandler;
import io.cronkit4j.core.JobStore;
import io.cronkit4j.core.PayloadHandlerRegistry;
import io.cronkit4j.hooks.HookRegistration;
import io.cronkit4j.hooks.HookRegistry;
import io.cronkit4j.internal.DefaultCronService;
import io.cronkit4j.internal.file.FileJobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for cronkit components.
 */
@AutoConfiguration
@ConditionalOnClass(CronService.class)
@EnableConfigurationProperties(CronProperties.class)
@ConditionalOnProperty(prefix = "cronkit", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CronKitConfig {

    @Bean
    @ConditionalOnMissingBean
    public JobStore cronJobStore(CronProperties props) {
        return new FileJobStore(props.getStorePath());
    }

    @Bean
    @ConditionalOnMissingBean
    public PayloadHandlerRegistry payloadHandlerRegistry(ObjectProvider<List<PayloadHandler<?>>> handlersProvider) {
        List<PayloadHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new PayloadHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronService cronService(CronProperties props,
                                   JobStore jobStore,
                                   PayloadHandlerRegistry registry,
                                   ObjectProvider<HookRegistration> hookRegistrations) {
        HookRegistry hooks = new HookRegistry(props.getHookTimeout());
        hookRegistrations.orderedStream().forEach(hooks::register);
        return new DefaultCronService(props, jobStore, registry, hooks, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public CronKitLifecycle cronKitLifecycle(CronService cronService) {
        return new CronKitLifecycle(cronService);
    }
}
