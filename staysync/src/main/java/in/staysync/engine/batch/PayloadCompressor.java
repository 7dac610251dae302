package in.staysync.engine.batch;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * gzip + base64 codec for oversized batch payloads.
 */
public final class PayloadCompressor {

    public String compress(String json) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(Math.max(64, json.length() / 4));
        try (GZIPOutputStream gzip = new GZIPOutputStream(bytes)) {
            gzip.write(json.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to gzip payload", e);
        }
        return Base64.getEncoder().encodeToString(bytes.toByteArray());
    }

    public String decompress(String base64) {
        byte[] raw = Base64.getDecoder().decode(base64);
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(raw))) {
            return new String(gzip.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to gunzip payload", e);
        }
    }
}
