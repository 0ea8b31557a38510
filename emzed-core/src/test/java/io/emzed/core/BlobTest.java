package io.emzed.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BlobTest {

    @Test
    void shouldCopyDataDefensively() {
        byte[] data = {1, 2, 3};
        Blob blob = new Blob(data, "raw");
        data[0] = 9;

        assertThat(blob.data()).containsExactly((byte) 1, (byte) 2, (byte) 3);
        blob.data()[1] = 9;
        assertThat(blob.data()).containsExactly((byte) 1, (byte) 2, (byte) 3);
    }

    @Test
    void shouldCompareByContent() {
        Blob blob = new Blob(new byte[]{4, 5}, "png");

        assertThat(blob.copy()).isEqualTo(blob).isNotSameAs(blob);
        assertThat(blob.copy().hashCode()).isEqualTo(blob.hashCode());
        assertThat(blob).isNotEqualTo(new Blob(new byte[]{4, 5}));
        assertThat(blob.size()).isEqualTo(2);
        assertThat(blob.toString()).contains("png").contains("size=2");
    }
}
