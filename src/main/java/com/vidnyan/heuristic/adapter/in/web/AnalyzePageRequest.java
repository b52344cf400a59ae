package com.vidnyan.heuristic.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.heuristic.application.port.in.AnalyzePageUseCase.AnalysisRequest;
import com.vidnyan.heuristic.application.port.in.DeviceType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.util.Map;

/**
 * Feature document for one page: its URL, capture device and the raw output of
 * the HTML and image extractors. Also the file format read by the CLI runner.
 */
public record AnalyzePageRequest(
    @JsonProperty("url")
    @NotBlank(message = "url is required")
    @Pattern(regexp = "^https?://[^\\s/$.?#][^\\s]*$", message = "url must be an absolute http(s) URL")
    String url,

    @JsonProperty("device_type")
    DeviceType deviceType,

    @JsonProperty("features")
    PageFeatures features
) {

    /**
     * Extractor output by namespace; a missing namespace means its extractor failed.
     */
    public record PageFeatures(
        @JsonProperty("html") Map<String, Object> html,
        @JsonProperty("image") Map<String, Object> image
    ) {}

    public AnalysisRequest toAnalysisRequest(DeviceType defaultDeviceType) {
        DeviceType device = deviceType != null ? deviceType : defaultDeviceType;
        if (features == null) {
            return new AnalysisRequest(url, device, null, null);
        }
        return new AnalysisRequest(url, device, features.html(), features.image());
    }
}
