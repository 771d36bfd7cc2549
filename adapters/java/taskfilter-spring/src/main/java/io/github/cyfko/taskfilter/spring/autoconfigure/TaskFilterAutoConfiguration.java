package io.github.cyfko.taskfilter.spring.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.taskfilter.core.cache.FilterCache;
import io.github.cyfko.taskfilter.core.cache.FilterCacheSweeper;
import io.github.cyfko.taskfilter.core.compiler.ConditionCompiler;
import io.github.cyfko.taskfilter.core.compiler.FilterQueryCompiler;
import io.github.cyfko.taskfilter.core.config.CachePolicy;
import io.github.cyfko.taskfilter.core.config.CompilerConfig;
import io.github.cyfko.taskfilter.core.spi.FilterDefinitionStore;
import io.github.cyfko.taskfilter.jpa.JpaFilterDefinitionStore;
import io.github.cyfko.taskfilter.jpa.JpaFilteredTaskQuery;
import io.github.cyfko.taskfilter.jpa.JpaPresetFilterInstaller;
import io.github.cyfko.taskfilter.spring.event.FilterCacheInvalidationListener;
import io.github.cyfko.taskfilter.spring.service.TaskFilterService;
import io.github.cyfko.taskfilter.spring.service.impl.TaskFilterServiceImpl;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.orm.jpa.SharedEntityManagerCreator;

/**
 * Wires the filter compiler into a Spring Boot application.
 *
 * <p>With an {@link EntityManagerFactory} in the context the JPA store, preset installer
 * and filtered listing are registered as well. Without one, the application provides its
 * own {@link FilterDefinitionStore} bean.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration")
@ConditionalOnClass(FilterQueryCompiler.class)
@EnableConfigurationProperties(TaskFilterProperties.class)
public class TaskFilterAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CachePolicy taskFilterCachePolicy(TaskFilterProperties properties) {
        return properties.toCachePolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public CompilerConfig taskFilterCompilerConfig(TaskFilterProperties properties) {
        return properties.toCompilerConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterCache filterCache(CachePolicy policy) {
        return new FilterCache(policy);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "taskfilter.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
    public FilterCacheSweeper filterCacheSweeper(FilterCache cache) {
        return FilterCacheSweeper.start(cache);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionCompiler conditionCompiler() {
        return new ConditionCompiler();
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterQueryCompiler filterQueryCompiler(FilterDefinitionStore store, FilterCache cache,
                                                   ConditionCompiler conditionCompiler, CompilerConfig config) {
        return new FilterQueryCompiler(store, cache, conditionCompiler, config);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskFilterService taskFilterService(FilterQueryCompiler compiler, FilterCache cache) {
        return new TaskFilterServiceImpl(compiler, cache);
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterCacheInvalidationListener filterCacheInvalidationListener(FilterCache cache) {
        return new FilterCacheInvalidationListener(cache);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(EntityManager.class)
    @ConditionalOnBean(EntityManagerFactory.class)
    static class JpaConfiguration {

        @Bean
        @ConditionalOnMissingBean(FilterDefinitionStore.class)
        public JpaFilterDefinitionStore jpaFilterDefinitionStore(EntityManagerFactory entityManagerFactory,
                                                                 ObjectProvider<ObjectMapper> objectMapper) {
            return new JpaFilterDefinitionStore(
                    SharedEntityManagerCreator.createSharedEntityManager(entityManagerFactory),
                    objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        @ConditionalOnMissingBean
        public JpaPresetFilterInstaller jpaPresetFilterInstaller(EntityManagerFactory entityManagerFactory,
                                                                 ObjectProvider<ObjectMapper> objectMapper,
                                                                 FilterCache cache) {
            return new JpaPresetFilterInstaller(
                    SharedEntityManagerCreator.createSharedEntityManager(entityManagerFactory),
                    objectMapper.getIfAvailable(ObjectMapper::new),
                    cache);
        }

        @Bean
        @ConditionalOnMissingBean
        public JpaFilteredTaskQuery jpaFilteredTaskQuery(EntityManagerFactory entityManagerFactory,
                                                         FilterDefinitionStore store, FilterCache cache) {
            return JpaFilteredTaskQuery.create(
                    SharedEntityManagerCreator.createSharedEntityManager(entityManagerFactory), store, cache);
        }
    }
}
