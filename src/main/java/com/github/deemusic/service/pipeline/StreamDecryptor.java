package com.github.deemusic.service.pipeline;

/**
 * Turns one encrypted stream chunk into plaintext.
 * Throws {@link com.github.deemusic.exception.DecryptionException} on failure.
 */
public interface StreamDecryptor {

    byte[] decrypt(byte[] encryptedChunk, String key);
}
