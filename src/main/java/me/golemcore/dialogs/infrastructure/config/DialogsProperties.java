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

import me.golemcore.dialogs.domain.service.DialogIterator;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties of the dialogs client, bound from the
 * {@code dialogs.*} prefix.
 *
 * <ul>
 * <li>{@link GatewayProperties} - HTTP gateway the transport adapter talks
 * to</li>
 * <li>{@link HttpProperties} - timeouts and pooling of the shared OkHttp
 * client</li>
 * <li>{@link IterationProperties} - paging of dialog iterators</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "dialogs")
@Data
public class DialogsProperties {

    private GatewayProperties gateway = new GatewayProperties();
    private HttpProperties http = new HttpProperties();
    private IterationProperties iteration = new IterationProperties();

    @Data
    public static class GatewayProperties {
        private String url;
        private String apiKey;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class IterationProperties {
        private int pageSize = DialogIterator.MAX_PAGE_SIZE;

        /**
         * Page size clamped to what the server accepts.
         */
        public int resolvePageSize() {
            return Math.max(1, Math.min(pageSize, DialogIterator.MAX_PAGE_SIZE));
        }
    }
}
