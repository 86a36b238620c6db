package cal.prim.transforms;

import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.AEADBlockCipher;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;

import java.io.InputStream;
import java.util.Arrays;

/**
 * AES-256-GCM decryption with a detached IV and authentication tag, the
 * format backup artifacts are written in.
 */
public class AesGcmDecryption implements StreamDecoder {

  public static final int KEY_LENGTH = 32;

  private final byte[] key;
  private final byte[] iv;
  private final byte[] tag;

  public AesGcmDecryption(byte[] key, byte[] iv, byte[] tag) {
    if (key.length != KEY_LENGTH) {
      throw new IllegalArgumentException("AES-256 key must be " + KEY_LENGTH + " bytes, was " + key.length);
    }
    if (iv.length == 0) {
      throw new IllegalArgumentException("IV must not be empty");
    }
    if (tag.length < 12 || tag.length > 16) {
      throw new IllegalArgumentException("authentication tag must be 12 to 16 bytes, was " + tag.length);
    }
    this.key = key.clone();
    this.iv = iv.clone();
    this.tag = tag.clone();
  }

  private AEADBlockCipher newCipher() {
    AEADBlockCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(false, new AEADParameters(new KeyParameter(key), tag.length * 8, iv));
    return cipher;
  }

  @Override
  public InputStream decode(InputStream data) {
    return new GcmDecryptingInputStream(data, newCipher(), tag);
  }

  /**
   * Decrypt a leading sample of the ciphertext without authenticating it.
   * GCM is a counter mode, so the plaintext of a prefix is available before
   * the tag can be checked; a few trailing bytes of the sample may be held
   * back by the cipher and are not returned.
   *
   * <p>If <code>wholeCiphertext</code> is true the sample is the complete
   * ciphertext and the tag is verified as well.
   *
   * @throws InvalidCipherTextException if <code>wholeCiphertext</code> is true and the tag does not match
   */
  public byte[] decryptSample(byte[] sample, int length, boolean wholeCiphertext) throws InvalidCipherTextException {
    AEADBlockCipher cipher = newCipher();
    byte[] out = new byte[cipher.getOutputSize(length + tag.length)];
    int n = cipher.processBytes(sample, 0, length, out, 0);
    if (wholeCiphertext) {
      n += cipher.processBytes(tag, 0, tag.length, out, n);
      n += cipher.doFinal(out, n);
    }
    return Arrays.copyOf(out, n);
  }

}
