package com.phillippitts.styleswap;

import com.phillippitts.styleswap.config.model.FeatureExtractorConfig;
import com.phillippitts.styleswap.config.model.InverseNetworkConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        FeatureExtractorConfig.class,
        InverseNetworkConfig.class,
        com.phillippitts.styleswap.config.properties.ImageBoundsProperties.class,
        com.phillippitts.styleswap.config.properties.TransferConcurrencyProperties.class,
        com.phillippitts.styleswap.config.properties.OutputStorageProperties.class
})
public class StyleSwapApplication {

    public static void main(String[] args) {
        SpringApplication.run(StyleSwapApplication.class, args);
    }

}
