package com.vidnyan.heuristic;

import com.vidnyan.heuristic.application.port.in.DeviceType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the analysis engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "heuristic.analysis")
public class AnalysisProperties {

    /**
     * Feature document scored by the command line runner.
     * Default: none, the runner stays idle
     */
    private String featuresPath = "";

    /**
     * Device type assumed when a request does not name one.
     */
    private DeviceType defaultDeviceType = DeviceType.DESKTOP;
}
