package com.marketpool.infra;

import com.marketpool.error.CryptoException;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Arrays;
import java.util.Base64;

/**
 * Whole-buffer Fernet tokens: AES-128-CBC encrypted and HMAC-SHA256 signed.
 * <p>
 * Token layout before base64: {@code 0x80 ‖ timestamp(8) ‖ iv(16) ‖ ciphertext ‖ hmac(32)}.
 * Token age is not checked on decrypt.
 */
public class FernetCipher {

    private static final byte VERSION = (byte) 0x80;
    private static final int TIMESTAMP_LENGTH = 8;
    private static final int IV_LENGTH = 16;
    private static final int HMAC_LENGTH = 32;
    private static final int BLOCK_LENGTH = 16;
    private static final int MIN_TOKEN_LENGTH = 1 + TIMESTAMP_LENGTH + IV_LENGTH + BLOCK_LENGTH + HMAC_LENGTH;

    private final FernetKey key;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public FernetCipher(FernetKey key) {
        this(key, Clock.systemUTC());
    }

    public FernetCipher(FernetKey key, Clock clock) {
        this.key = key;
        this.clock = clock;
    }

    public byte[] encrypt(byte[] plaintext) {
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        long timestamp = clock.instant().getEpochSecond();

        byte[] ciphertext;
        try {
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key.encryptionKey(), "AES"), new IvParameterSpec(iv));
            ciphertext = cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Encryption failed", e);
        }

        // version ‖ timestamp ‖ iv ‖ ciphertext, then the HMAC over all of it
        ByteBuffer signed = ByteBuffer.allocate(1 + TIMESTAMP_LENGTH + IV_LENGTH + ciphertext.length);
        signed.put(VERSION);
        signed.putLong(timestamp);
        signed.put(iv);
        signed.put(ciphertext);

        byte[] token = concat(signed.array(), sign(signed.array()));
        return Base64.getUrlEncoder().encode(token);
    }

    public byte[] decrypt(byte[] encodedToken) {
        byte[] token;
        try {
            String text = new String(encodedToken, StandardCharsets.US_ASCII).trim();
            token = Base64.getUrlDecoder().decode(text);
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Token is not url-safe base64", e);
        }
        if (token.length < MIN_TOKEN_LENGTH || token[0] != VERSION) {
            throw new CryptoException("Token is truncated or has an unknown version");
        }
        int signedLength = token.length - HMAC_LENGTH;
        if ((signedLength - 1 - TIMESTAMP_LENGTH - IV_LENGTH) % BLOCK_LENGTH != 0) {
            throw new CryptoException("Token ciphertext is not block aligned");
        }

        byte[] signed = Arrays.copyOfRange(token, 0, signedLength);
        byte[] hmac = Arrays.copyOfRange(token, signedLength, token.length);
        if (!MessageDigest.isEqual(sign(signed), hmac)) {
            throw new CryptoException("Token signature mismatch (wrong key or corrupted data)");
        }

        int ivStart = 1 + TIMESTAMP_LENGTH;
        byte[] iv = Arrays.copyOfRange(signed, ivStart, ivStart + IV_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key.encryptionKey(), "AES"), new IvParameterSpec(iv));
            return cipher.doFinal(signed, ivStart + IV_LENGTH, signed.length - ivStart - IV_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Decryption failed", e);
        }
    }

    private byte[] sign(byte[] data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key.signingKey(), "HmacSHA256"));
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("HMAC computation failed", e);
        }
    }

    private byte[] concat(byte[]... arrays) {
        int totalLength = Arrays.stream(arrays).mapToInt(a -> a.length).sum();
        ByteBuffer buffer = ByteBuffer.allocate(totalLength);
        for (byte[] array : arrays) {
            buffer.put(array);
        }
        return buffer.array();
    }
}
