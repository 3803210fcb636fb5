package org.buaa.imagesearch.dto;

import org.buaa.imagesearch.common.convention.exception.DimensionMismatchException;
import org.buaa.imagesearch.common.convention.exception.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 定长浮点向量，创建后不可变
 *
 * <p>不同维度的向量之间不允许比较，直接抛出 {@link DimensionMismatchException}。</p>
 */
public final class Vector {

    private final float[] values;

    private Vector(float[] values) {
        this.values = values;
    }

    public static Vector of(float... values) {
        if (values == null || values.length == 0) {
            throw new ValidationException("向量不能为空");
        }
        return new Vector(Arrays.copyOf(values, values.length));
    }

    public static Vector fromList(List<? extends Number> values) {
        if (values == null || values.isEmpty()) {
            throw new ValidationException("向量不能为空");
        }
        float[] array = new float[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i).floatValue();
        }
        return new Vector(array);
    }

    public int dimension() {
        return values.length;
    }

    public float get(int index) {
        return values[index];
    }

    public float[] toArray() {
        return Arrays.copyOf(values, values.length);
    }

    public List<Float> toList() {
        List<Float> list = new ArrayList<>(values.length);
        for (float value : values) {
            list.add(value);
        }
        return Collections.unmodifiableList(list);
    }

    /**
     * 校验维度
     *
     * @param expected 期望维度
     * @return 当前向量
     */
    public Vector requireDimension(int expected) {
        if (values.length != expected) {
            throw new DimensionMismatchException(expected, values.length);
        }
        return this;
    }

    /**
     * 余弦相似度，范围 [-1, 1]；任一向量为零向量时返回 0
     */
    public double cosineSimilarity(Vector other) {
        other.requireDimension(values.length);
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < values.length; i++) {
            dot += (double) values[i] * other.values[i];
            normA += (double) values[i] * values[i];
            normB += (double) other.values[i] * other.values[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * 映射到 [0, 1] 的相似度得分，与 Elasticsearch cosine 打分一致
     */
    public double similarityScore(Vector other) {
        return (1.0 + cosineSimilarity(other)) / 2.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Vector)) {
            return false;
        }
        return Arrays.equals(values, ((Vector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Vector[dimension=" + values.length + "]";
    }
}
