package com.github.deemusic.service.pipeline;

import com.github.deemusic.exception.DecryptionException;
import com.github.deemusic.exception.DiskException;
import com.github.deemusic.exception.PipelineException;
import com.github.deemusic.exception.TransientDownloadException;
import com.github.deemusic.util.DownloadConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Streams a locator into a local file, passing every block through the {@link StreamDecryptor}.
 * Network failures are transient; local write failures are disk errors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreamFetcher {

    private final OkHttpClient httpClient;
    private final StreamDecryptor decryptor;

    /**
     * @return number of encrypted bytes read from the stream
     */
    public long fetch(String locator, String key, Path target, TransferListener listener) {
        Request request = new Request.Builder().url(locator).get().build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw HttpFailures.forStatus(response.code(), "stream " + locator);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new TransientDownloadException("Empty stream response from " + locator);
            }
            return copy(body.byteStream(), body.contentLength(), key, target, listener);
        } catch (IOException e) {
            throw new TransientDownloadException("Stream request failed: " + e.getMessage(), e);
        }
    }

    private long copy(InputStream in, long totalBytes, String key, Path target, TransferListener listener) {
        OutputStream out;
        try {
            out = Files.newOutputStream(target);
        } catch (IOException e) {
            throw new DiskException("Cannot open " + target + ": " + e.getMessage(), e);
        }

        byte[] buffer = new byte[DownloadConstants.STREAM_CHUNK_SIZE];
        long downloaded = 0;
        try {
            int read;
            while ((read = readBlock(in, buffer)) > 0) {
                byte[] block = read == buffer.length ? buffer : Arrays.copyOf(buffer, read);
                byte[] plain = decrypt(block, key);
                try {
                    out.write(plain);
                } catch (IOException e) {
                    throw new DiskException("Cannot write " + target + ": " + e.getMessage(), e);
                }
                downloaded += read;
                listener.onProgress(downloaded, totalBytes);
            }
        } finally {
            try {
                out.close();
            } catch (IOException e) {
                log.warn("Failed to close {}: {}", target, e.getMessage());
            }
        }

        if (totalBytes > 0 && downloaded < totalBytes) {
            throw new TransientDownloadException(
                    String.format("Stream ended early: %d of %d bytes", downloaded, totalBytes));
        }
        return downloaded;
    }

    /**
     * Fill {@code buffer} completely unless the stream ends first.
     */
    private int readBlock(InputStream in, byte[] buffer) {
        int filled = 0;
        try {
            while (filled < buffer.length) {
                int n = in.read(buffer, filled, buffer.length - filled);
                if (n < 0) {
                    break;
                }
                filled += n;
            }
        } catch (IOException e) {
            throw new TransientDownloadException("Stream read failed: " + e.getMessage(), e);
        }
        return filled;
    }

    private byte[] decrypt(byte[] block, String key) {
        try {
            return decryptor.decrypt(block, key);
        } catch (PipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DecryptionException("Decryption failed: " + e.getMessage(), e);
        }
    }
}
