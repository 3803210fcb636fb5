package org.buaa.imagesearch.controller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.buaa.imagesearch.common.convention.result.Result;
import org.buaa.imagesearch.dto.req.TextSearchReqDTO;
import org.buaa.imagesearch.dto.resp.ImageSearchRespDTO;
import org.buaa.imagesearch.dto.resp.TextSearchRespDTO;
import org.buaa.imagesearch.dto.resp.UploadSearchRespDTO;
import org.buaa.imagesearch.service.ImageSearchService;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * 图片检索接口
 */
@Validated
@RestController
@RequestMapping("/api")
public class ImageController {

    private final ImageSearchService imageSearchService;

    public ImageController(ImageSearchService imageSearchService) {
        this.imageSearchService = imageSearchService;
    }

    @PostMapping("/search/image")
    public Result<ImageSearchRespDTO> searchByImage(@RequestParam("file") MultipartFile file,
                                                    @RequestParam(defaultValue = "5") @Min(1) @Max(20) int topK,
                                                    @RequestParam(defaultValue = "true") boolean explain) {
        return imageSearchService.searchByImage(file, topK, explain);
    }

    @PostMapping("/search/text")
    public Result<TextSearchRespDTO> searchByText(@Valid @RequestBody TextSearchReqDTO request) {
        return imageSearchService.searchByText(request);
    }

    @PostMapping("/upload")
    public Result<UploadSearchRespDTO> upload(@RequestParam("file") MultipartFile file,
                                              @RequestParam(defaultValue = "5") @Min(1) @Max(20) int topK) {
        return imageSearchService.uploadAndSearch(file, topK);
    }

    @DeleteMapping("/images/{imageId}")
    public Result<Void> deleteImage(@PathVariable String imageId) {
        return imageSearchService.deleteImage(imageId);
    }
}
