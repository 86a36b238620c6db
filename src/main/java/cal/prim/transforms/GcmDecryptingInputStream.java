package cal.prim.transforms;

import cal.restore.Util;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.modes.AEADBlockCipher;
import org.checkerframework.checker.mustcall.qual.MustCallAlias;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Streams the plaintext of an AES-GCM ciphertext whose authentication tag is
 * stored separately.  Plaintext is released as it is decrypted; the tag is
 * checked when the underlying stream is exhausted, and a mismatch surfaces as
 * an {@link IOException} from the final read.  Consumers must therefore read
 * to end of stream before trusting what they received.
 */
public class GcmDecryptingInputStream extends FilterInputStream {

  private final AEADBlockCipher cipher;
  private final byte[] tag;
  private final byte[] inBuf = new byte[Util.SUGGESTED_BUFFER_SIZE];
  private byte[] outBuf = new byte[0];
  private int outPos = 0;
  private int outLen = 0;
  private boolean finished = false;

  public @MustCallAlias GcmDecryptingInputStream(@MustCallAlias InputStream in, AEADBlockCipher initializedCipher, byte[] tag) {
    super(in);
    this.cipher = initializedCipher;
    this.tag = tag.clone();
  }

  /**
   * @return false at end of plaintext
   */
  private boolean fill() throws IOException {
    while (outPos >= outLen) {
      if (finished) {
        return false;
      }
      int n = in.read(inBuf);
      outPos = 0;
      if (n < 0) {
        finished = true;
        ensureCapacity(cipher.getOutputSize(tag.length));
        try {
          int len = cipher.processBytes(tag, 0, tag.length, outBuf, 0);
          outLen = len + cipher.doFinal(outBuf, len);
        } catch (InvalidCipherTextException e) {
          outLen = 0;
          throw new IOException("authentication tag mismatch; wrong key or corrupted data", e);
        }
      } else {
        ensureCapacity(cipher.getUpdateOutputSize(n));
        outLen = cipher.processBytes(inBuf, 0, n, outBuf, 0);
      }
    }
    return true;
  }

  private void ensureCapacity(int size) {
    if (outBuf.length < size) {
      outBuf = new byte[size];
    }
  }

  @Override
  public int read() throws IOException {
    if (!fill()) {
      return -1;
    }
    return Byte.toUnsignedInt(outBuf[outPos++]);
  }

  @Override
  public int read(byte[] b, int off, int len) throws IOException {
    if (len == 0) {
      return 0;
    }
    if (!fill()) {
      return -1;
    }
    int n = Math.min(len, outLen - outPos);
    System.arraycopy(outBuf, outPos, b, off, n);
    outPos += n;
    return n;
  }

  @Override
  public long skip(long n) throws IOException {
    long skipped = 0;
    while (skipped < n && fill()) {
      int step = (int) Math.min(n - skipped, outLen - outPos);
      outPos += step;
      skipped += step;
    }
    return skipped;
  }

  @Override
  public int available() {
    return outLen - outPos;
  }

  @Override
  public boolean markSupported() {
    return false;
  }

  @Override
  public synchronized void mark(int readlimit) {
  }

  @Override
  public synchronized void reset() throws IOException {
    throw new IOException("mark/reset not supported");
  }

}
