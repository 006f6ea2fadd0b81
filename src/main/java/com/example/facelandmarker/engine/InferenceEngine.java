package com.example.facelandmarker.engine;

/**
 * Opaque handle to a loaded face landmark model. Implementations are not required to be thread
 * safe; callers issue at most one {@link #process(EngineRequest)} at a time.
 */
public interface InferenceEngine extends AutoCloseable {

    /**
     * Runs face landmark inference on the request image.
     *
     * @return landmarks for every face found; empty lists when there is none
     * @throws EngineException when the input is rejected or inference fails
     */
    EngineOutput process(EngineRequest request) throws EngineException;

    @Override
    void close();
}
