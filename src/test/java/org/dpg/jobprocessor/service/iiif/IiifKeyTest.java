package org.dpg.jobprocessor.service.iiif;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IiifKeyTest {

    @Test
    void oddLengthPidLeavesSingleDigitDirectory() {
        final IiifKey key = IiifKey.forPid("tsm:12345");

        assertThat(key.prefix()).isEqualTo("tsm/12/34/5");
        assertThat(key.fileName()).isEqualTo("12345.jp2");
        assertThat(key.s3Key()).isEqualTo("tsm/12/34/5/12345.jp2");
    }

    @Test
    void evenLengthPidSplitsIntoPairs() {
        assertThat(IiifKey.forPid("uva-lib:1234").s3Key()).isEqualTo("uva-lib/12/34/1234.jp2");
    }

    @Test
    void pidWithoutNamespaceIsRejected() {
        assertThatThrownBy(() -> IiifKey.forPid("12345")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IiifKey.forPid("tsm:")).isInstanceOf(IllegalArgumentException.class);
    }
}
