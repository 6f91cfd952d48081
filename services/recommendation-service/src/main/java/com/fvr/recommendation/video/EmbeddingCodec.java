package com.fvr.recommendation.video;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Embeddings are stored as little-endian float32 blobs next to an explicit
 * dimension column.
 */
public final class EmbeddingCodec {
    private EmbeddingCodec() {
    }

    public static float[] decode(byte[] blob, int expectedDim) {
        if (blob == null || blob.length == 0 || blob.length % Float.BYTES != 0) {
            return null;
        }
        int dim = blob.length / Float.BYTES;
        if (expectedDim > 0 && dim != expectedDim) {
            return null;
        }
        float[] vector = new float[dim];
        ByteBuffer.wrap(blob).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(vector);
        return vector;
    }

    public static byte[] encode(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asFloatBuffer().put(vector);
        return buffer.array();
    }
}
