package org.buaa.imagesearch.ingest;

import io.netty.channel.ChannelOption;
import org.buaa.imagesearch.common.convention.exception.SetupException;
import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.service.Indexer;
import org.buaa.imagesearch.service.MediaTransformer;
import org.buaa.imagesearch.service.Persister;
import org.buaa.imagesearch.service.VectorDeriver;
import org.buaa.imagesearch.service.impl.HttpMediaFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.util.List;

/**
 * 默认会话工厂
 */
@Component
public class DefaultPipelineSessionFactory implements PipelineSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(DefaultPipelineSessionFactory.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;

    private final MediaTransformer transformer;
    private final VectorDeriver deriver;
    private final Persister persister;
    private final Indexer indexer;
    private final IngestionProperties properties;

    public DefaultPipelineSessionFactory(MediaTransformer transformer,
                                         VectorDeriver deriver,
                                         Persister persister,
                                         Indexer indexer,
                                         IngestionProperties properties) {
        this.transformer = transformer;
        this.deriver = deriver;
        this.persister = persister;
        this.indexer = indexer;
        this.properties = properties;
    }

    @Override
    public PipelineSession open(String jobId) {
        try {
            persister.ensureNamespace()
                .then(indexer.ensureIndex())
                .block(properties.getTimeouts().getSetup());
        } catch (RuntimeException e) {
            throw new SetupException("存储或索引初始化失败: " + e.getMessage(), e);
        }

        ConnectionProvider connectionProvider = ConnectionProvider.builder("media-fetch-" + jobId)
            .maxConnections(Math.max(1, properties.resolveConcurrency(properties.getMaxBatchSize())))
            .build();
        HttpClient httpClient = HttpClient.create(connectionProvider)
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);
        int maxFileSize = (int) Math.min(Integer.MAX_VALUE, properties.getMedia().getMaxFileSize());
        WebClient fetchClient = WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxFileSize))
                .build())
            .build();

        HttpMediaFetcher fetcher = new HttpMediaFetcher(fetchClient,
            properties.getMedia().getMaxFileSize(), properties.getTimeouts().getFetch());
        log.info("流水线会话已打开 - 任务: {}", jobId);
        return new PipelineSession(jobId, fetcher, transformer, deriver, persister, indexer,
            List.of(connectionProvider::dispose));
    }
}
