package com.example.facelandmarker.engine;

@FunctionalInterface
public interface InferenceEngineFactory {

    InferenceEngine create(EngineConfig config) throws EngineException;
}
