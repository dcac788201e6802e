package com.example.faceclusters.ai.clustering;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Little-endian float32 encoding of embedding vectors, the layout the detection
 * pipeline writes.
 */
public final class EmbeddingCodec {

    private EmbeddingCodec() {}

    public static byte[] encode(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : vector) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    /**
     * @throws MalformedEmbeddingException if the bytes are empty, not a whole number of
     *         floats, or decode to a non-finite or all-zero vector
     */
    public static float[] decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new MalformedEmbeddingException(MalformedEmbeddingException.Reason.EMPTY, "embedding is empty");
        }
        if (bytes.length % Float.BYTES != 0) {
            throw new MalformedEmbeddingException(MalformedEmbeddingException.Reason.TRUNCATED,
                    "embedding length " + bytes.length + " is not a multiple of " + Float.BYTES);
        }

        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[bytes.length / Float.BYTES];
        double squaredNorm = 0.0;
        for (int i = 0; i < vector.length; i++) {
            float v = buffer.getFloat();
            if (!Float.isFinite(v)) {
                throw new MalformedEmbeddingException(MalformedEmbeddingException.Reason.NON_FINITE,
                        "embedding has a non-finite value at index " + i);
            }
            vector[i] = v;
            squaredNorm += (double) v * v;
        }
        if (squaredNorm == 0.0) {
            throw new MalformedEmbeddingException(MalformedEmbeddingException.Reason.ZERO_NORM,
                    "embedding is the zero vector");
        }
        return vector;
    }
}
