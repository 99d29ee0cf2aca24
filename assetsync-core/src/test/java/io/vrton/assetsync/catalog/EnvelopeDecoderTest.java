package io.vrton.assetsync.catalog;

/*
 * Copyright (c) vrton
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.vrton.assetsync.ErrorKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EnvelopeDecoderTest {

    private static String base64(String text) {
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void unwrapsBase64Content() throws Exception {
        String envelope = "{\"content\":\"" + base64("{\"assets\":[]}") + "\",\"encoding\":\"base64\"}";
        assertThat(EnvelopeDecoder.unwrap(envelope)).isEqualTo("{\"assets\":[]}");
    }

    @Test
    public void toleratesLineWrappedContentAndMissingEncoding() throws Exception {
        String encoded = base64("{\"assets\":[{\"name\":\"Jacket\"}]}");
        String wrapped = encoded.substring(0, 10) + "\\n" + encoded.substring(10);
        String envelope = "{\"sha\":\"abc\",\"content\":\"" + wrapped + "\"}";
        assertThat(EnvelopeDecoder.unwrap(envelope)).isEqualTo("{\"assets\":[{\"name\":\"Jacket\"}]}");
    }

    @Test
    public void stripsByteOrderMark() throws Exception {
        String envelope = "{\"content\":\"" + base64("\uFEFF{\"assets\":[]}") + "\",\"encoding\":\"base64\"}";
        assertThat(EnvelopeDecoder.unwrap(envelope)).isEqualTo("{\"assets\":[]}");
    }

    @Test
    public void missingOrEmptyContentIsAnEnvelopeError() {
        assertThatThrownBy(() -> EnvelopeDecoder.unwrap("{\"encoding\":\"base64\"}"))
            .isInstanceOf(EnvelopeException.class)
            .hasMessageContaining("no content");
        assertThatThrownBy(() -> EnvelopeDecoder.unwrap("{\"content\":\"\",\"encoding\":\"base64\"}"))
            .isInstanceOf(EnvelopeException.class);
    }

    @Test
    public void invalidBase64IsAnEnvelopeError() {
        assertThatThrownBy(() -> EnvelopeDecoder.unwrap("{\"content\":\"%%%not base64%%%\"}"))
            .isInstanceOf(EnvelopeException.class)
            .satisfies(e -> assertThat(((EnvelopeException) e).kind()).isEqualTo(ErrorKind.ENVELOPE));
    }

    @Test
    public void unsupportedEncodingIsAnEnvelopeError() {
        assertThatThrownBy(() -> EnvelopeDecoder.unwrap("{\"content\":\"abc\",\"encoding\":\"utf-8\"}"))
            .isInstanceOf(EnvelopeException.class)
            .hasMessageContaining("utf-8");
    }

    @Test
    public void nonObjectBodiesAreEnvelopeErrors() {
        assertThatThrownBy(() -> EnvelopeDecoder.unwrap("[1,2,3]")).isInstanceOf(EnvelopeException.class);
        assertThatThrownBy(() -> EnvelopeDecoder.unwrap("{not json")).isInstanceOf(EnvelopeException.class);
        assertThatThrownBy(() -> EnvelopeDecoder.unwrap("  ")).isInstanceOf(EnvelopeException.class);
    }
}
