package com.github.deemusic.service.pipeline;

import org.springframework.stereotype.Component;

/**
 * Decryptor for locators that serve plaintext audio.
 */
@Component
public class PassThroughDecryptor implements StreamDecryptor {

    @Override
    public byte[] decrypt(byte[] encryptedChunk, String key) {
        return encryptedChunk;
    }
}
