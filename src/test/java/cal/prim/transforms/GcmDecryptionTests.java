package cal.prim.transforms;

import cal.restore.TestCrypto;
import cal.restore.Util;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

@Test
public class GcmDecryptionTests {

  private static byte[] decrypt(byte[] key, TestCrypto.Sealed sealed, InputStream ciphertext) throws IOException {
    AesGcmDecryption decryption = new AesGcmDecryption(key, sealed.iv(), sealed.tag());
    try (InputStream in = decryption.decode(ciphertext)) {
      return Util.read(in);
    }
  }

  /**
   * Returns at most one byte per read, to exercise partial-block handling.
   */
  private static class SlowStream extends FilterInputStream {
    SlowStream(InputStream in) {
      super(in);
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      return super.read(b, off, Math.min(len, 1));
    }
  }

  @Test
  public void testRoundTripManyLengths() throws Exception {
    Random random = new Random(42);
    byte[] key = TestCrypto.randomKey();
    for (int len : new int[] { 0, 1, 15, 16, 17, 1000, 3 * Util.SUGGESTED_BUFFER_SIZE + 5 }) {
      byte[] plaintext = new byte[len];
      random.nextBytes(plaintext);
      TestCrypto.Sealed sealed = TestCrypto.encrypt(key, plaintext);
      Assert.assertEquals(decrypt(key, sealed, new ByteArrayInputStream(sealed.ciphertext())), plaintext, "len=" + len);
      Assert.assertEquals(decrypt(key, sealed, new SlowStream(new ByteArrayInputStream(sealed.ciphertext()))), plaintext, "slow len=" + len);
    }
  }

  @Test
  public void testWrongTagFailsAtEnd() throws Exception {
    byte[] key = TestCrypto.randomKey();
    TestCrypto.Sealed sealed = TestCrypto.encrypt(key, "hello world".getBytes(StandardCharsets.UTF_8));
    byte[] badTag = sealed.tag().clone();
    badTag[0] ^= 1;
    TestCrypto.Sealed tampered = new TestCrypto.Sealed(sealed.ciphertext(), sealed.iv(), badTag);
    Assert.assertThrows(IOException.class, () -> decrypt(key, tampered, new ByteArrayInputStream(sealed.ciphertext())));
  }

  @Test
  public void testWrongKeyFails() throws Exception {
    TestCrypto.Sealed sealed = TestCrypto.encrypt(TestCrypto.randomKey(), new byte[100]);
    Assert.assertThrows(IOException.class, () -> decrypt(TestCrypto.randomKey(), sealed, new ByteArrayInputStream(sealed.ciphertext())));
  }

  @Test
  public void testSampleOfLongCiphertext() throws Exception {
    byte[] key = TestCrypto.randomKey();
    byte[] plaintext = "SELECT 1;\n".repeat(500).getBytes(StandardCharsets.US_ASCII);
    TestCrypto.Sealed sealed = TestCrypto.encrypt(key, plaintext);
    AesGcmDecryption decryption = new AesGcmDecryption(key, sealed.iv(), sealed.tag());
    byte[] sample = decryption.decryptSample(sealed.ciphertext(), 1024, false);
    Assert.assertTrue(sample.length > 0 && sample.length <= 1024);
    Assert.assertEquals(sample, Arrays.copyOf(plaintext, sample.length));
  }

  @Test
  public void testSampleOfWholeCiphertextIsAuthenticated() throws Exception {
    byte[] key = TestCrypto.randomKey();
    byte[] plaintext = "short".getBytes(StandardCharsets.US_ASCII);
    TestCrypto.Sealed sealed = TestCrypto.encrypt(key, plaintext);
    byte[] ct = sealed.ciphertext();
    Assert.assertEquals(new AesGcmDecryption(key, sealed.iv(), sealed.tag()).decryptSample(ct, ct.length, true), plaintext);
    AesGcmDecryption wrong = new AesGcmDecryption(TestCrypto.randomKey(), sealed.iv(), sealed.tag());
    Assert.assertThrows(InvalidCipherTextException.class, () -> wrong.decryptSample(ct, ct.length, true));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testRejectsShortKey() {
    new AesGcmDecryption(new byte[16], new byte[16], new byte[16]);
  }

}
