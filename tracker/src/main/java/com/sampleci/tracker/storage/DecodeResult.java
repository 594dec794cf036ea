package com.sampleci.tracker.storage;

import java.nio.charset.Charset;
import java.util.List;

/**
 * Outcome of decoding a result file: its lines, or why neither encoding worked.
 */
public sealed interface DecodeResult permits DecodeResult.Decoded, DecodeResult.Undecodable {

    record Decoded(List<String> lines, Charset charset) implements DecodeResult {
        public Decoded {
            lines = List.copyOf(lines);
        }
    }

    record Undecodable(String reason) implements DecodeResult {}
}
