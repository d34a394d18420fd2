package uk.gegc.coursesync.shared.hash;

/**
 * Keys raw bytes by a prefix of their MD5 digest. Collision resistance at course scale is all that is needed.
 */
public class ByteContentDigester implements ContentDigester<byte[]> {

    private final int keyLength;

    public ByteContentDigester(int keyLength) {
        if (keyLength < 8 || keyLength > 32) {
            throw new IllegalArgumentException("Key length must be between 8 and 32, was " + keyLength);
        }
        this.keyLength = keyLength;
    }

    @Override
    public String digest(byte[] value) {
        return Digests.md5Hex(value).substring(0, keyLength);
    }
}
