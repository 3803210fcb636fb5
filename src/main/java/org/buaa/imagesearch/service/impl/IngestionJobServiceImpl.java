package org.buaa.imagesearch.service.impl;

import cn.hutool.core.io.IORuntimeException;
import cn.hutool.core.util.StrUtil;
import cn.hutool.core.text.csv.CsvData;
import cn.hutool.core.text.csv.CsvReader;
import cn.hutool.core.text.csv.CsvRow;
import cn.hutool.core.text.csv.CsvUtil;
import org.buaa.imagesearch.common.consts.SystemConstants;
import org.buaa.imagesearch.common.convention.errorcode.ImageSearchErrorCode;
import org.buaa.imagesearch.common.convention.exception.ClientException;
import org.buaa.imagesearch.common.convention.exception.ServiceException;
import org.buaa.imagesearch.common.convention.exception.ValidationException;
import org.buaa.imagesearch.common.convention.result.Result;
import org.buaa.imagesearch.common.convention.result.Results;
import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.dto.SourceItem;
import org.buaa.imagesearch.dto.req.IndexImagesReqDTO;
import org.buaa.imagesearch.dto.resp.IndexJobRespDTO;
import org.buaa.imagesearch.ingest.BatchJob;
import org.buaa.imagesearch.ingest.BatchOrchestrator;
import org.buaa.imagesearch.ingest.ProgressRecord;
import org.buaa.imagesearch.ingest.ProgressTracker;
import org.buaa.imagesearch.service.IngestionJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 批量索引任务服务实现
 */
@Service
public class IngestionJobServiceImpl implements IngestionJobService {

    private static final Logger log = LoggerFactory.getLogger(IngestionJobServiceImpl.class);
    private static final String BOM = "\uFEFF";

    private final BatchOrchestrator batchOrchestrator;
    private final ProgressTracker progressTracker;
    private final IngestionProperties properties;

    public IngestionJobServiceImpl(BatchOrchestrator batchOrchestrator,
                                   ProgressTracker progressTracker,
                                   IngestionProperties properties) {
        this.batchOrchestrator = batchOrchestrator;
        this.progressTracker = progressTracker;
        this.properties = properties;
    }

    @Override
    public Result<IndexJobRespDTO> submit(IndexImagesReqDTO request) {
        List<SourceItem> items = request.getImageUrls() == null
            ? List.of()
            : request.getImageUrls().stream()
                .filter(StrUtil::isNotBlank)
                .map(SourceItem::of)
                .collect(Collectors.toList());
        return Results.success(startJob(items, request.getBatchSize()));
    }

    @Override
    public Result<IndexJobRespDTO> submitCsv(MultipartFile file, Integer batchSize) {
        if (file == null || file.isEmpty()) {
            throw new ClientException(ImageSearchErrorCode.PARAM_EMPTY);
        }
        String filename = file.getOriginalFilename();
        if (filename != null && !filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new ClientException("仅支持 CSV 文件: " + filename, ImageSearchErrorCode.FILE_TYPE_NOT_SUPPORTED);
        }

        List<String> urls;
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            urls = extractUrls(reader);
        } catch (IOException | IORuntimeException e) {
            throw new ClientException("CSV 文件读取失败: " + e.getMessage(), e, ImageSearchErrorCode.CSV_PARSE_FAILED);
        }
        log.info("CSV 解析完成 - 文件: {}, 图片地址数: {}", filename, urls.size());

        List<SourceItem> items = urls.stream().map(SourceItem::of).collect(Collectors.toList());
        return Results.success(startJob(items, batchSize));
    }

    @Override
    public Result<ProgressRecord> getProgress(String jobId) {
        return Results.success(progressTracker.get(jobId));
    }

    @Override
    public Result<ProgressRecord> cancel(String jobId) {
        boolean accepted = batchOrchestrator.cancel(jobId);
        if (!accepted) {
            log.info("任务已结束，忽略取消请求 - 任务: {}", jobId);
        }
        return Results.success(progressTracker.get(jobId));
    }

    @Override
    public Result<Void> delete(String jobId) {
        batchOrchestrator.cancel(jobId);
        progressTracker.remove(jobId);
        log.info("任务进度已删除 - 任务: {}", jobId);
        return Results.success();
    }

    private IndexJobRespDTO startJob(List<SourceItem> items, Integer requestedBatchSize) {
        if (items.isEmpty()) {
            throw new ValidationException("没有有效的图片地址");
        }
        int batchSize = resolveBatchSize(requestedBatchSize);
        BatchJob job = BatchJob.create(items, batchSize);
        ProgressRecord record = progressTracker.create(job);

        try {
            batchOrchestrator.runAsync(job);
        } catch (TaskRejectedException e) {
            progressTracker.markFailed(job.getId(), job.getItems(), "任务队列已满");
            throw new ServiceException("任务队列已满，请稍后重试", e, ImageSearchErrorCode.SERVICE_ERROR);
        }

        log.info("索引任务已提交 - 任务: {}, 图片数: {}, 批大小: {}", job.getId(), job.size(), batchSize);
        return new IndexJobRespDTO(job.getId(), job.size(), batchSize, record.getStatus(),
            String.format("Started indexing %d images in background", job.size()));
    }

    private int resolveBatchSize(Integer requested) {
        int batchSize = requested == null ? properties.getDefaultBatchSize() : requested;
        if (batchSize < 1 || batchSize > properties.getMaxBatchSize()) {
            throw new ValidationException(String.format("批大小必须在 1 到 %d 之间", properties.getMaxBatchSize()));
        }
        return batchSize;
    }

    /**
     * 表头包含 photo_image_url 时读取该列，否则读取第一列；首行不是地址时视为表头
     */
    List<String> extractUrls(Reader reader) {
        CsvReader csvReader = CsvUtil.getReader();
        CsvData data = csvReader.read(reader);
        List<CsvRow> rows = data.getRows();
        List<String> urls = new ArrayList<>();
        if (rows == null || rows.isEmpty()) {
            return urls;
        }

        List<String> firstRow = rows.get(0).getRawList();
        int column = 0;
        int start = 0;
        for (int i = 0; i < firstRow.size(); i++) {
            String header = StrUtil.trim(StrUtil.removePrefix(firstRow.get(i), BOM));
            if (SystemConstants.CSV_URL_COLUMN.equalsIgnoreCase(header)) {
                column = i;
                start = 1;
                break;
            }
        }
        if (start == 0 && !firstRow.isEmpty() && !looksLikeUrl(StrUtil.removePrefix(firstRow.get(0), BOM))) {
            start = 1;
        }

        for (int i = start; i < rows.size(); i++) {
            List<String> cells = rows.get(i).getRawList();
            if (column < cells.size() && StrUtil.isNotBlank(cells.get(column))) {
                urls.add(StrUtil.removePrefix(cells.get(column).trim(), BOM));
            }
        }
        return urls;
    }

    private boolean looksLikeUrl(String value) {
        String trimmed = StrUtil.trimToEmpty(value).toLowerCase(Locale.ROOT);
        return trimmed.startsWith("http://") || trimmed.startsWith("https://");
    }
}
