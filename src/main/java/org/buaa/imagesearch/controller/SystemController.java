package org.buaa.imagesearch.controller;

import org.buaa.imagesearch.common.convention.result.Result;
import org.buaa.imagesearch.common.convention.result.Results;
import org.buaa.imagesearch.dto.resp.StatsRespDTO;
import org.buaa.imagesearch.service.ImageSearchService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class SystemController {

    private final ImageSearchService imageSearchService;

    public SystemController(ImageSearchService imageSearchService) {
        this.imageSearchService = imageSearchService;
    }

    @GetMapping("/health")
    public Result<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", LocalDateTime.now().toString());
        return Results.success(body);
    }

    @GetMapping("/stats")
    public Result<StatsRespDTO> stats() {
        return imageSearchService.stats();
    }
}
