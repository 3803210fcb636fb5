package org.buaa.imagesearch.dto;

import org.buaa.imagesearch.common.convention.exception.DimensionMismatchException;
import org.buaa.imagesearch.common.convention.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class VectorTest {

    @Test
    void testCosineSimilarityOfParallelAndOppositeVectors() {
        Vector a = Vector.of(1f, 2f, 3f);

        assertEquals(1.0, a.cosineSimilarity(Vector.of(2f, 4f, 6f)), 1e-6);
        assertEquals(-1.0, a.cosineSimilarity(Vector.of(-1f, -2f, -3f)), 1e-6);
        assertEquals(0.0, Vector.of(1f, 0f).cosineSimilarity(Vector.of(0f, 1f)), 1e-6);
    }

    @Test
    void testSimilarityScoreIsMappedToUnitInterval() {
        Vector a = Vector.of(1f, 0f);

        assertEquals(1.0, a.similarityScore(Vector.of(3f, 0f)), 1e-6);
        assertEquals(0.5, a.similarityScore(Vector.of(0f, 5f)), 1e-6);
        assertEquals(0.0, a.similarityScore(Vector.of(-1f, 0f)), 1e-6);
    }

    @Test
    void testZeroVectorScoresZeroCosine() {
        assertEquals(0.0, Vector.of(0f, 0f).cosineSimilarity(Vector.of(1f, 1f)), 1e-9);
    }

    @Test
    void testDimensionMismatchIsRejected() {
        DimensionMismatchException error = assertThrows(DimensionMismatchException.class,
            () -> Vector.of(1f, 2f).cosineSimilarity(Vector.of(1f, 2f, 3f)));

        assertEquals(2, error.getExpected());
        assertEquals(3, error.getActual());
        assertThrows(DimensionMismatchException.class, () -> Vector.of(1f).requireDimension(1536));
    }

    @Test
    void testEmptyVectorIsRejected() {
        assertThrows(ValidationException.class, () -> Vector.of());
        assertThrows(ValidationException.class, () -> Vector.fromList(List.of()));
    }

    @Test
    void testValuesAreDefensivelyCopied() {
        float[] source = {1f, 2f};
        Vector vector = Vector.of(source);
        source[0] = 9f;

        assertEquals(1f, vector.get(0));
        assertNotSame(vector.toArray(), vector.toArray());
        assertArrayEquals(new float[]{1f, 2f}, vector.toArray());
        assertEquals(Vector.fromList(List.of(1.0, 2.0)), vector);
    }
}
