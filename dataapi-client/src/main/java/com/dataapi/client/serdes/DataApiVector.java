/*
 * Copyright (c) 2023-2025 Kronotop
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.dataapi.client.serdes;

import com.google.common.base.Preconditions;

import java.nio.ByteBuffer;
import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;
import java.util.RandomAccess;

/**
 * An immutable vector of 32-bit floats. It is a {@code List<Float>} backed by a primitive array, so it compares
 * equal to any other list holding the same values.
 */
public final class DataApiVector extends AbstractList<Float> implements RandomAccess {
    private final float[] values;

    public DataApiVector(float[] values) {
        Preconditions.checkNotNull(values, "values cannot be null");
        this.values = values.clone();
    }

    public static DataApiVector of(List<? extends Number> values) {
        float[] array = new float[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i).floatValue();
        }
        return new DataApiVector(array);
    }

    /**
     * Decodes a vector from its packed binary form: consecutive big-endian IEEE-754 float32 values.
     *
     * @param bytes the packed vector
     * @return the decoded vector
     */
    public static DataApiVector fromBytes(byte[] bytes) {
        if (bytes.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("Binary vector length must be a multiple of " + Float.BYTES);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        float[] array = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < array.length; i++) {
            array[i] = buffer.getFloat();
        }
        return new DataApiVector(array);
    }

    public byte[] toBytes() {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Float.BYTES);
        for (float value : values) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    public float[] toFloatArray() {
        return values.clone();
    }

    @Override
    public Float get(int index) {
        return values[index];
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public String toString() {
        if (values.length <= 5) {
            return "DataApiVector(" + Arrays.toString(values) + ")";
        }
        return String.format("DataApiVector([%s, %s, %s, ...], dimension=%d)", values[0], values[1], values[2], values.length);
    }
}
