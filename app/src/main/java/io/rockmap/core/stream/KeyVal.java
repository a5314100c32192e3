package io.rockmap.core.stream;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One key/value entry pulled from a cursor. The arrays are copies taken when the
 * cursor stepped, so they stay valid after the cursor moves on.
 */
public record KeyVal(byte[] key, byte[] value) {

    public KeyVal {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public String keyUtf8() {
        return new String(key, StandardCharsets.UTF_8);
    }

    public String valueUtf8() {
        return new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyVal other)) return false;
        return Arrays.equals(key, other.key) && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(key) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "KeyVal{" + keyUtf8() + "=" + value.length + " bytes}";
    }
}
