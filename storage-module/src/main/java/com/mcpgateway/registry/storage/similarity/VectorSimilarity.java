package com.mcpgateway.registry.storage.similarity;

import org.springframework.stereotype.Component;

@Component
public class VectorSimilarity {

    /** Вычислить косинусное сходство между векторами. Для нулевого вектора сходство равно 0 */
    public double cosineSimilarity(float[] vector1, float[] vector2) {
        if (vector1.length != vector2.length) {
            throw new IllegalArgumentException(String.format(
                "Vectors must have the same dimension: %d vs %d", vector1.length, vector2.length));
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < vector1.length; i++) {
            dotProduct += vector1[i] * vector2[i];
            normA += vector1[i] * vector1[i];
            normB += vector2[i] * vector2[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        double cosine = dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
        // rounding can push |cos| slightly above 1
        return Math.max(-1.0, Math.min(1.0, cosine));
    }

    /** Проверить, что все компоненты вектора равны нулю */
    public boolean isZero(float[] vector) {
        for (float v : vector) {
            if (v != 0.0f) {
                return false;
            }
        }
        return true;
    }
}
