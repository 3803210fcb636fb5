package org.buaa.imagesearch.controller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.buaa.imagesearch.common.convention.result.Result;
import org.buaa.imagesearch.dto.req.IndexImagesReqDTO;
import org.buaa.imagesearch.dto.resp.IndexJobRespDTO;
import org.buaa.imagesearch.ingest.ProgressRecord;
import org.buaa.imagesearch.service.IngestionJobService;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * 批量索引任务接口
 */
@Validated
@RestController
@RequestMapping("/api/index")
public class IndexController {

    private final IngestionJobService ingestionJobService;

    public IndexController(IngestionJobService ingestionJobService) {
        this.ingestionJobService = ingestionJobService;
    }

    @PostMapping
    public Result<IndexJobRespDTO> submit(@Valid @RequestBody IndexImagesReqDTO request) {
        return ingestionJobService.submit(request);
    }

    @PostMapping("/csv")
    public Result<IndexJobRespDTO> submitCsv(@RequestParam("file") MultipartFile file,
                                             @RequestParam(required = false) @Min(1) @Max(100) Integer batchSize) {
        return ingestionJobService.submitCsv(file, batchSize);
    }

    @GetMapping("/{jobId}/progress")
    public Result<ProgressRecord> getProgress(@PathVariable String jobId) {
        return ingestionJobService.getProgress(jobId);
    }

    @PostMapping("/{jobId}/cancel")
    public Result<ProgressRecord> cancel(@PathVariable String jobId) {
        return ingestionJobService.cancel(jobId);
    }

    @DeleteMapping("/{jobId}")
    public Result<Void> delete(@PathVariable String jobId) {
        return ingestionJobService.delete(jobId);
    }
}
