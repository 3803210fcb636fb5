package org.buaa.imagesearch.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Elasticsearch搜索引擎配置
 */
@Configuration
@ConditionalOnProperty(prefix = "ingestion.index", name = "backend", havingValue = "elasticsearch", matchIfMissing = true)
public class EsConfiguration {

    @Value("${elasticsearch.host}")
    private String esHost;

    @Value("${elasticsearch.port}")
    private int esPort;

    @Value("${elasticsearch.scheme:http}")
    private String protocol;

    @Value("${elasticsearch.username:}")
    private String userName;

    @Value("${elasticsearch.password:}")
    private String userPassword;

    /**
     * 构建Elasticsearch客户端实例
     *
     * @return ES客户端
     */
    @Bean
    public ElasticsearchClient elasticsearchClient() {
        RestClientBuilder clientBuilder = RestClient.builder(
            new HttpHost(esHost, esPort, protocol)
        );

        if (userName != null && !userName.isBlank()) {
            BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(
                AuthScope.ANY,
                new UsernamePasswordCredentials(userName, userPassword)
            );
            clientBuilder.setHttpClientConfigCallback(httpClientBuilder ->
                httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider));
        }

        RestClient restClient = clientBuilder.build();
        RestClientTransport transport = new RestClientTransport(
            restClient,
            new JacksonJsonpMapper()
        );

        return new ElasticsearchClient(transport);
    }
}
