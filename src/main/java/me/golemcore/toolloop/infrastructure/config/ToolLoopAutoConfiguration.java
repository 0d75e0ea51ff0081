/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.toolloop.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolloop.adapter.outbound.llm.Langchain4jToolRegistry;
import me.golemcore.toolloop.domain.registry.ToolRegistry;
import me.golemcore.toolloop.domain.schema.SchemaResolver;
import me.golemcore.toolloop.domain.schema.SchemaSanitizer;
import me.golemcore.toolloop.domain.schema.ToolParameterIntrospector;
import me.golemcore.toolloop.domain.system.toolloop.ArgumentErrorFormatter;
import me.golemcore.toolloop.domain.system.toolloop.ToolExecutionLoop;
import me.golemcore.toolloop.domain.system.toolloop.ToolLoopSystem;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Spring Boot auto-configuration for the schema engine, a default tool
 * registry and the tool loop.
 *
 * <p>
 * Every bean backs off when the application defines its own. The fallback
 * {@link ObjectMapper} is only created when Boot's Jackson auto-configuration
 * has not provided one. Applications
 * targeting a different provider declare their own {@link ToolRegistry}
 * (e.g. {@code OpenAiToolRegistry}) and the loop picks it up.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(ToolLoopProperties.class)
@Slf4j
public class ToolLoopAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolParameterIntrospector toolParameterIntrospector(ObjectMapper objectMapper) {
        return new ToolParameterIntrospector(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaResolver schemaResolver(ToolLoopProperties properties) {
        return new SchemaResolver(properties.getSchema().getMaxDepth());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaSanitizer schemaSanitizer() {
        return new SchemaSanitizer();
    }

    @Bean
    @ConditionalOnMissingBean(ToolRegistry.class)
    public Langchain4jToolRegistry langchain4jToolRegistry(ToolParameterIntrospector introspector,
            SchemaResolver resolver, SchemaSanitizer sanitizer) {
        return new Langchain4jToolRegistry(introspector, resolver, sanitizer);
    }

    @Bean(name = "toolLoopExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "toolLoopExecutor")
    public ExecutorService toolLoopExecutor(ToolLoopProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(
                properties.getExecutor().getThreadNamePrefix());
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolLoopSystem toolLoopSystem(ToolRegistry<?> toolRegistry, ToolLoopProperties properties,
            ObjectMapper objectMapper, ExecutorService toolLoopExecutor,
            ObjectProvider<ArgumentErrorFormatter> argumentErrorFormatter) {
        log.info("[ToolLoop] Max iterations: {}, tool timeout: {}", properties.getMaxIterations(),
                properties.getToolTimeout());
        return ToolExecutionLoop.builder()
                .registry(toolRegistry)
                .maxIterations(properties.getMaxIterations())
                .toolTimeout(properties.getToolTimeout())
                .argumentErrorFormatter(argumentErrorFormatter.getIfAvailable())
                .objectMapper(objectMapper)
                .executor(toolLoopExecutor)
                .build();
    }
}
