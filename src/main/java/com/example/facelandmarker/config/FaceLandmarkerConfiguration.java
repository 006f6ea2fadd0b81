package com.example.facelandmarker.config;

import com.example.facelandmarker.engine.InferenceEngineFactory;
import com.example.facelandmarker.engine.onnx.OnnxInferenceEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FaceLandmarkerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FaceLandmarkerConfiguration.class);

    @Bean
    public InferenceEngineFactory inferenceEngineFactory(FaceLandmarkerProperties properties) {
        log.info("Using ONNX Runtime inference engine for model {}", properties.getModelPath());
        return config -> OnnxInferenceEngine.open(config);
    }
}
