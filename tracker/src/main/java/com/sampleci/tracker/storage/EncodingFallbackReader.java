package com.sampleci.tracker.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes result files that may have been written by tools using either
 * UTF-8 or the legacy Windows-1252 code page.
 *
 * Both attempts decode strictly. A file that fails UTF-8 is retried as
 * Windows-1252; only when that fails too is the file reported as undecodable.
 */
public final class EncodingFallbackReader {

    private static final Logger log = LoggerFactory.getLogger(EncodingFallbackReader.class);

    public static final Charset FALLBACK = Charset.forName("windows-1252");

    private static final List<Charset> ATTEMPTS = List.of(StandardCharsets.UTF_8, FALLBACK);

    private static final char BOM = '\uFEFF';

    private EncodingFallbackReader() {}

    /**
     * Read and decode a stored result file.
     *
     * @throws ArtifactNotFoundException if the file is missing
     * @throws DecodingFailureException  if neither encoding applies
     */
    public static List<String> readLines(ArtifactStore store, String basePath, String fileName) {
        DecodeResult result = decode(store.read(basePath, fileName));
        if (result instanceof DecodeResult.Decoded decoded) {
            if (decoded.charset() != StandardCharsets.UTF_8) {
                log.debug("{} decoded with fallback charset {}", fileName, decoded.charset());
            }
            return decoded.lines();
        }
        throw new DecodingFailureException(fileName, ((DecodeResult.Undecodable) result).reason());
    }

    /** Try UTF-8, then Windows-1252. */
    public static DecodeResult decode(byte[] content) {
        StringBuilder reasons = new StringBuilder();
        for (Charset charset : ATTEMPTS) {
            try {
                String text = charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(content))
                        .toString();
                return new DecodeResult.Decoded(splitLines(text), charset);
            } catch (CharacterCodingException e) {
                if (reasons.length() > 0) reasons.append("; ");
                reasons.append(charset.name()).append(": ").append(e);
            }
        }
        return new DecodeResult.Undecodable(reasons.toString());
    }

    /**
     * Split on \n, \r\n or \r. Terminators are dropped and a trailing
     * terminator does not produce an extra empty line.
     */
    public static List<String> splitLines(String text) {
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        List<String> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                lines.add(text.substring(start, i));
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                start = i + 1;
            }
            i++;
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }
}
