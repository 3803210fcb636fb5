package org.buaa.imagesearch.service.impl;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.util.StrUtil;
import org.buaa.imagesearch.common.consts.SystemConstants;
import org.buaa.imagesearch.common.convention.errorcode.ImageSearchErrorCode;
import org.buaa.imagesearch.common.convention.exception.ClientException;
import org.buaa.imagesearch.common.convention.exception.NotFoundException;
import org.buaa.imagesearch.common.convention.exception.ServiceException;
import org.buaa.imagesearch.common.convention.result.Result;
import org.buaa.imagesearch.common.convention.result.Results;
import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.dto.IndexStats;
import org.buaa.imagesearch.dto.ProcessedMedia;
import org.buaa.imagesearch.dto.ScoredRecord;
import org.buaa.imagesearch.dto.Vector;
import org.buaa.imagesearch.dto.req.TextSearchReqDTO;
import org.buaa.imagesearch.dto.resp.ImageSearchRespDTO;
import org.buaa.imagesearch.dto.resp.SimilarImageRespDTO;
import org.buaa.imagesearch.dto.resp.StatsRespDTO;
import org.buaa.imagesearch.dto.resp.TextSearchRespDTO;
import org.buaa.imagesearch.dto.resp.UploadSearchRespDTO;
import org.buaa.imagesearch.ingest.ProgressTracker;
import org.buaa.imagesearch.service.ImageSearchService;
import org.buaa.imagesearch.service.Indexer;
import org.buaa.imagesearch.service.MediaTransformer;
import org.buaa.imagesearch.service.Persister;
import org.buaa.imagesearch.service.VectorDeriver;
import org.buaa.imagesearch.tool.RetryableCaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 相似图片检索服务实现
 * 查询路径同步执行，共用摄取流水线的归一化、向量生成与索引组件
 */
@Service
public class ImageSearchServiceImpl implements ImageSearchService {

    private static final Logger log = LoggerFactory.getLogger(ImageSearchServiceImpl.class);
    private static final Set<String> ALLOWED_EXTENSIONS = Set.of("jpg", "jpeg", "png", "webp", "bmp", "gif");
    private static final int EXPLAIN_CONCURRENCY = 4;

    private final MediaTransformer transformer;
    private final VectorDeriver deriver;
    private final Persister persister;
    private final Indexer indexer;
    private final RetryableCaller retryableCaller;
    private final ProgressTracker progressTracker;
    private final IngestionProperties properties;

    public ImageSearchServiceImpl(MediaTransformer transformer,
                                  VectorDeriver deriver,
                                  Persister persister,
                                  Indexer indexer,
                                  RetryableCaller retryableCaller,
                                  ProgressTracker progressTracker,
                                  IngestionProperties properties) {
        this.transformer = transformer;
        this.deriver = deriver;
        this.persister = persister;
        this.indexer = indexer;
        this.retryableCaller = retryableCaller;
        this.progressTracker = progressTracker;
        this.properties = properties;
    }

    @Override
    public Result<ImageSearchRespDTO> searchByImage(MultipartFile file, int topK, boolean explain) {
        long startTime = System.currentTimeMillis();
        ProcessedMedia query = readQueryImage(file);

        Vector vector = deriver.derive(query.getContent()).block();
        List<ScoredRecord> matches = searchIndex(vector, topK);
        List<SimilarImageRespDTO> similarImages = explain
            ? explainMatches(query.getContent(), matches)
            : toResponses(matches);

        double elapsed = (System.currentTimeMillis() - startTime) / 1000.0;
        log.info("以图搜图完成 - 文件: {}, 命中: {}, 耗时: {}s", file.getOriginalFilename(), similarImages.size(), elapsed);
        return Results.success(new ImageSearchRespDTO(file.getOriginalFilename(), similarImages,
            similarImages.size(), elapsed));
    }

    @Override
    public Result<TextSearchRespDTO> searchByText(TextSearchReqDTO request) {
        long startTime = System.currentTimeMillis();
        int topK = request.getTopK() == null ? 5 : request.getTopK();

        Vector vector = deriver.deriveFromText(request.getQuery().trim()).block();
        List<SimilarImageRespDTO> similarImages = toResponses(searchIndex(vector, topK));

        double elapsed = (System.currentTimeMillis() - startTime) / 1000.0;
        log.info("文本检索完成 - 查询: {}, 命中: {}", request.getQuery(), similarImages.size());
        return Results.success(new TextSearchRespDTO(request.getQuery(), similarImages, similarImages.size(), elapsed));
    }

    @Override
    public Result<UploadSearchRespDTO> uploadAndSearch(MultipartFile file, int topK) {
        ProcessedMedia query = readQueryImage(file);
        Vector vector = deriver.derive(query.getContent()).block();
        List<ScoredRecord> matches = searchIndex(vector, topK);

        String fileName = UUID.randomUUID() + SystemConstants.PROCESSED_EXTENSION;
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("original_name", URLEncoder.encode(StrUtil.nullToEmpty(file.getOriginalFilename()),
            StandardCharsets.UTF_8));
        metadata.put("upload_time", Instant.now().toString());
        metadata.put("content_type", StrUtil.nullToEmpty(file.getContentType()));

        String fileUrl = persister.ensureNamespace()
            .then(retryableCaller.call("store", () -> persister.store(fileName, query.getContent(), metadata)))
            .block();
        log.info("上传图片已保存 - 文件: {}, 地址: {}", fileName, fileUrl);

        List<SimilarImageRespDTO> similarImages = explainMatches(query.getContent(), matches);
        return Results.success(new UploadSearchRespDTO(fileUrl, fileName, similarImages));
    }

    @Override
    public Result<Void> deleteImage(String imageId) {
        Boolean deleted = indexer.delete(imageId).block();
        if (!Boolean.TRUE.equals(deleted)) {
            throw new NotFoundException("图片不存在: " + imageId);
        }
        Boolean removed = persister.delete(imageId + SystemConstants.PROCESSED_EXTENSION).block();
        if (!Boolean.TRUE.equals(removed)) {
            log.warn("索引记录已删除，但存储对象不存在 - 图片ID: {}", imageId);
        }
        log.info("图片已删除 - 图片ID: {}", imageId);
        return Results.success();
    }

    @Override
    public Result<StatsRespDTO> stats() {
        IndexStats indexStats = indexer.stats().block();
        long count = indexStats == null ? 0 : indexStats.getCount();
        long size = indexStats == null ? 0 : indexStats.getSizeInBytes();
        return Results.success(new StatsRespDTO(count, size, progressTracker.trackedJobs(), "healthy"));
    }

    /**
     * 校验上传文件并归一化
     */
    private ProcessedMedia readQueryImage(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ClientException(ImageSearchErrorCode.PARAM_EMPTY);
        }
        String extension = StrUtil.nullToEmpty(FileUtil.extName(file.getOriginalFilename())).toLowerCase(Locale.ROOT);
        if (!ALLOWED_EXTENSIONS.contains(extension)) {
            throw new ClientException("不支持的图片类型: " + file.getOriginalFilename(),
                ImageSearchErrorCode.FILE_TYPE_NOT_SUPPORTED);
        }
        if (file.getSize() > properties.getMedia().getMaxFileSize()) {
            throw new ClientException(ImageSearchErrorCode.FILE_SIZE_EXCEEDED);
        }
        try {
            return transformer.transform(file.getBytes(),
                Map.of("original_name", StrUtil.nullToEmpty(file.getOriginalFilename())));
        } catch (IOException e) {
            throw new ServiceException("读取上传文件失败", e, ImageSearchErrorCode.SERVICE_ERROR);
        }
    }

    private List<ScoredRecord> searchIndex(Vector vector, int topK) {
        List<ScoredRecord> matches = indexer.search(vector, topK).block();
        return matches == null ? Collections.emptyList() : matches;
    }

    /**
     * 并发生成相似原因，保持检索结果顺序
     */
    private List<SimilarImageRespDTO> explainMatches(byte[] query, List<ScoredRecord> matches) {
        List<SimilarImageRespDTO> responses = Flux.fromIterable(matches)
            .flatMapSequential(match -> explainMatch(query, match), EXPLAIN_CONCURRENCY)
            .collectList()
            .block();
        return responses == null ? Collections.emptyList() : responses;
    }

    private Mono<SimilarImageRespDTO> explainMatch(byte[] query, ScoredRecord match) {
        return persister.retrieve(match.getSecondaryAddress())
            .flatMap(stored -> deriver.explain(query, stored))
            .onErrorResume(error -> {
                log.warn("读取相似图片失败，使用默认说明 - 图片ID: {}, 原因: {}", match.getId(), error.getMessage());
                return Mono.just(SystemConstants.FALLBACK_EXPLANATION);
            })
            .defaultIfEmpty(SystemConstants.FALLBACK_EXPLANATION)
            .map(explanation -> toResponse(match, explanation));
    }

    private List<SimilarImageRespDTO> toResponses(List<ScoredRecord> matches) {
        return matches.stream().map(match -> toResponse(match, null)).collect(Collectors.toList());
    }

    private SimilarImageRespDTO toResponse(ScoredRecord match, String explanation) {
        return SimilarImageRespDTO.builder()
            .imageId(match.getId())
            .imageUrl(match.getPrimaryAddress())
            .similarityScore(match.getScore())
            .explanation(explanation)
            .metadata(match.getMetadata())
            .build();
    }
}
