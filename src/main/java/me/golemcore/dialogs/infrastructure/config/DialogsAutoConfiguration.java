package me.golemcore.dialogs.infrastructure.config;

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

import me.golemcore.dialogs.adapter.outbound.rpc.HttpRpcTransportAdapter;
import me.golemcore.dialogs.domain.service.DialogService;
import me.golemcore.dialogs.domain.service.UpdateHandlerRegistry;
import me.golemcore.dialogs.infrastructure.http.OkHttpConfig;
import me.golemcore.dialogs.port.outbound.RpcTransportPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Spring Boot auto-configuration of the dialogs client.
 *
 * <p>
 * Registers:
 * <ul>
 * <li>{@link RpcTransportPort} - the HTTP gateway adapter, when
 * {@code dialogs.gateway.url} is set and the application has no transport of
 * its own</li>
 * <li>{@link DialogService} - whenever a transport is available</li>
 * <li>{@link UpdateHandlerRegistry} - always</li>
 * </ul>
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(DialogsProperties.class)
@Import(OkHttpConfig.class)
@Slf4j
public class DialogsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(RpcTransportPort.class)
    @ConditionalOnProperty(prefix = "dialogs.gateway", name = "url")
    public RpcTransportPort httpRpcTransportAdapter(DialogsProperties properties, OkHttpClient okHttpClient,
            ObjectProvider<ObjectMapper> objectMapper) {
        log.info("[Dialogs] Using HTTP gateway at {}", properties.getGateway().getUrl());
        return new HttpRpcTransportAdapter(properties, okHttpClient, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnBean(RpcTransportPort.class)
    @ConditionalOnMissingBean
    public DialogService dialogService(RpcTransportPort transport, DialogsProperties properties) {
        return new DialogService(transport, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public UpdateHandlerRegistry updateHandlerRegistry() {
        return new UpdateHandlerRegistry();
    }
}
