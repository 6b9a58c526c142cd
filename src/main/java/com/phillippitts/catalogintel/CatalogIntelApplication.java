package com.phillippitts.catalogintel;

import com.phillippitts.catalogintel.config.properties.GuardrailProperties;
import com.phillippitts.catalogintel.config.properties.PipelineProperties;
import com.phillippitts.catalogintel.config.properties.SinkProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        GuardrailProperties.class,
        PipelineProperties.class,
        SinkProperties.class
})
@EnableScheduling
public class CatalogIntelApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatalogIntelApplication.class, args);
    }

}
