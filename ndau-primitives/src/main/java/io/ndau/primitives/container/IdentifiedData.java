// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.primitives.container;

import java.util.Arrays;
import java.util.Objects;

/**
 * A byte string tagged with the one-byte id of the algorithm that produced it.
 *
 * @param algorithmId algorithm id, 0 to 255
 * @param data        the tagged bytes
 * @since 0.1.0
 */
public record IdentifiedData(int algorithmId, byte[] data) {

    public IdentifiedData {
        if (algorithmId < 0 || algorithmId > 0xFF) {
            throw new IllegalArgumentException("algorithm id must be in range 0-255: " + algorithmId);
        }
        Objects.requireNonNull(data, "data cannot be null");
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IdentifiedData other)) {
            return false;
        }
        return algorithmId == other.algorithmId && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * algorithmId + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "IdentifiedData[algorithmId=" + algorithmId + ", length=" + data.length + "]";
    }
}
