package me.golemcore.dialogs.infrastructure.config;

import me.golemcore.dialogs.adapter.outbound.rpc.HttpRpcTransportAdapter;
import me.golemcore.dialogs.domain.service.DialogService;
import me.golemcore.dialogs.domain.service.UpdateHandlerRegistry;
import me.golemcore.dialogs.port.outbound.RpcTransportPort;
import me.golemcore.dialogs.testsupport.ScriptedRpcTransport;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DialogsAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DialogsAutoConfiguration.class));

    @Test
    void shouldApplyDefaultsWhenNothingConfigured() {
        runner.run(context -> {
            DialogsProperties properties = context.getBean(DialogsProperties.class);
            assertNull(properties.getGateway().getUrl());
            assertEquals(100, properties.getIteration().getPageSize());
            assertEquals(10000, properties.getHttp().getConnectTimeout());
            assertEquals(5, properties.getHttp().getMaxIdleConnections());

            assertTrue(context.containsBean("updateHandlerRegistry"));
            assertEquals(1, context.getBeanNamesForType(OkHttpClient.class).length);
            assertEquals(0, context.getBeanNamesForType(RpcTransportPort.class).length);
            assertEquals(0, context.getBeanNamesForType(DialogService.class).length);
        });
    }

    @Test
    void shouldCreateGatewayTransportWhenUrlIsSet() {
        runner.withPropertyValues(
                "dialogs.gateway.url=http://localhost:8081/api/",
                "dialogs.gateway.api-key=secret",
                "dialogs.iteration.page-size=40",
                "dialogs.http.read-timeout=5000")
                .run(context -> {
                    assertInstanceOf(HttpRpcTransportAdapter.class, context.getBean(RpcTransportPort.class));
                    assertEquals(1, context.getBeanNamesForType(DialogService.class).length);

                    DialogsProperties properties = context.getBean(DialogsProperties.class);
                    assertEquals("secret", properties.getGateway().getApiKey());
                    assertEquals(40, properties.getIteration().resolvePageSize());
                    assertEquals(5000, context.getBean(OkHttpClient.class).readTimeoutMillis());
                });
    }

    @Test
    void shouldPreferApplicationTransport() {
        runner.withUserConfiguration(CustomTransportConfig.class)
                .withPropertyValues("dialogs.gateway.url=http://localhost:8081")
                .run(context -> {
                    RpcTransportPort transport = context.getBean(RpcTransportPort.class);
                    assertInstanceOf(ScriptedRpcTransport.class, transport);
                    assertFalse(context.containsBean("httpRpcTransportAdapter"));
                    assertEquals(1, context.getBeanNamesForType(DialogService.class).length);
                });
    }

    @Test
    void shouldKeepApplicationRegistry() {
        runner.withUserConfiguration(CustomRegistryConfig.class)
                .run(context -> assertSame(CustomRegistryConfig.REGISTRY,
                        context.getBean(UpdateHandlerRegistry.class)));
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomTransportConfig {

        @Bean
        RpcTransportPort scriptedTransport() {
            return new ScriptedRpcTransport();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomRegistryConfig {

        static final UpdateHandlerRegistry REGISTRY = new UpdateHandlerRegistry();

        @Bean
        UpdateHandlerRegistry customRegistry() {
            return REGISTRY;
        }
    }
}
