package com.phillippitts.poseidon.service.extraction.vision;

/**
 * Sends one image plus an instruction to a vision-capable generative model and returns the
 * model's reply text. Implementations throw
 * {@link com.phillippitts.poseidon.exception.ExtractionException} on transport failure.
 */
public interface VisionModelClient {

    /**
     * @param image       PNG or JPEG bytes
     * @param instruction fixed instruction describing the reply schema
     * @return raw reply text (may wrap the JSON payload in prose or code fences)
     */
    String describe(byte[] image, String instruction);
}
