package com.f1.prediction;

import com.f1.prediction.config.ModelBundleProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ModelBundleProperties.class)
public class F1PredictionApplication {

    public static void main(String[] args) {
        SpringApplication.run(F1PredictionApplication.class, args);
    }
}
