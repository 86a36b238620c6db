package cal.restore.impls;

import cal.prim.transforms.AesGcmDecryption;
import cal.prim.transforms.Compression;
import cal.restore.Util;
import cal.restore.config.EncryptionProfileRepository;
import cal.restore.errors.DecryptionFailed;
import cal.restore.types.EncryptionInfo;
import cal.restore.types.EncryptionProfile;
import com.google.common.io.ByteStreams;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.InvalidCipherTextException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Finds the key that decrypts a backup.
 *
 * <p>Normally that is the key of the profile the sidecar names.  When that
 * profile is gone (deleted, or replaced during a key rotation) every
 * configured profile is tried in turn: a bounded prefix of the ciphertext is
 * decrypted with the candidate key and the result is judged.  For gzip
 * backups the candidate is right if the decompressor accepts it and produces
 * output; for uncompressed backups, if it is mostly printable text.  Brotli
 * backups are judged on the whole ciphertext instead.  The first
 * candidate that passes wins.
 */
@Slf4j
public class SmartKeyRecovery {

  /**
   * @param recovered true if the key came from a profile other than the one the sidecar names
   */
  public record ResolvedKey(EncryptionProfile profile, byte[] key, boolean recovered) {
  }

  private static final int FIRST_READ = 64;

  private final EncryptionProfileRepository profiles;
  private final ProfileKeys keys;
  private final int sampleBytes;
  private final double printableThreshold;

  public SmartKeyRecovery(EncryptionProfileRepository profiles, ProfileKeys keys, int sampleBytes, double printableThreshold) {
    if (sampleBytes <= 0) {
      throw new IllegalArgumentException("sample size must be positive");
    }
    this.profiles = profiles;
    this.keys = keys;
    this.sampleBytes = sampleBytes;
    this.printableThreshold = printableThreshold;
  }

  public ResolvedKey resolve(EncryptionInfo encryption, Path ciphertext, Compression compression) throws DecryptionFailed, IOException {
    if (!encryption.hasParameters()) {
      throw new DecryptionFailed("Encryption metadata missing (IV/AuthTag); cannot decrypt");
    }
    byte[] iv;
    byte[] tag;
    try {
      iv = Util.fromHex(encryption.iv());
      tag = Util.fromHex(encryption.authTag());
    } catch (IllegalArgumentException e) {
      throw new DecryptionFailed("Encryption metadata is malformed: " + e.getMessage(), e);
    }

    String profileId = encryption.profileId();
    if (profileId != null) {
      Optional<EncryptionProfile> named = profiles.findProfile(profileId);
      if (named.isPresent()) {
        try {
          return new ResolvedKey(named.get(), keys.keyFor(named.get()), false);
        } catch (DecryptionFailed e) {
          log.warn("Profile '{}' is configured but its key is unusable; trying all profiles", profileId, e);
        }
      } else {
        log.info("Encryption profile '{}' not found; trying all profiles", profileId);
      }
    }

    byte[] sample = new byte[sampleBytes];
    int n;
    try (InputStream in = Files.newInputStream(ciphertext)) {
      n = Util.readChunk(in, sample);
    }
    boolean whole = Files.size(ciphertext) <= n;

    for (EncryptionProfile candidate : profiles.profiles()) {
      byte[] key;
      try {
        key = keys.keyFor(candidate);
      } catch (DecryptionFailed e) {
        log.debug("Skipping profile '{}': {}", candidate.name(), e.getMessage());
        continue;
      }
      if (accepts(new AesGcmDecryption(key, iv, tag), sample, n, whole, compression, ciphertext)) {
        log.info("Backup decrypts with profile '{}'", candidate.name());
        return new ResolvedKey(candidate, key, true);
      }
    }
    throw new DecryptionFailed("Smart recovery failed: no candidate profile decrypts this backup");
  }

  private boolean accepts(AesGcmDecryption decryption, byte[] sample, int length, boolean whole,
                          Compression compression, Path ciphertext) throws IOException {
    if (compression == Compression.BROTLI) {
      return decodesAndAuthenticates(decryption, ciphertext, compression);
    }
    byte[] plaintext;
    try {
      plaintext = decryption.decryptSample(sample, length, whole);
    } catch (InvalidCipherTextException e) {
      return false;
    }
    if (compression == Compression.NONE) {
      return printableRatio(plaintext) > printableThreshold;
    }
    return decompresses(plaintext, compression);
  }

  /**
   * A brotli decoder emits nothing until it has a window's worth of input,
   * so a sample is not enough to judge it, and random bytes parse as a valid
   * stream header far too often.  The candidate has to start a stream that
   * decodes when fed the whole ciphertext, and then the ciphertext has to
   * authenticate under it.
   */
  private boolean decodesAndAuthenticates(AesGcmDecryption decryption, Path ciphertext, Compression compression) throws IOException {
    try (InputStream raw = Util.buffered(Files.newInputStream(ciphertext))) {
      try {
        InputStream decoded = compression.decode(decryption.decode(raw));
        if (decoded.read(new byte[FIRST_READ]) <= 0) {
          return false;
        }
      } catch (IOException | RuntimeException e) {
        log.debug("Candidate rejected by {} decoder: {}", compression, e.toString());
        return false;
      }
    }
    try (InputStream in = decryption.decode(Util.buffered(Files.newInputStream(ciphertext)))) {
      ByteStreams.exhaust(in);
      return true;
    } catch (IOException e) {
      if (e.getCause() instanceof InvalidCipherTextException) {
        log.debug("Candidate decodes but does not authenticate");
        return false;
      }
      throw e;
    }
  }

  /**
   * True if the decoder produces at least one byte from the candidate.  The
   * candidate is usually a truncated stream, so an error after the first
   * output does not count against it.
   */
  static boolean decompresses(byte[] candidate, Compression compression) {
    try (InputStream in = compression.decode(new ByteArrayInputStream(candidate))) {
      return in.read(new byte[FIRST_READ]) > 0;
    } catch (IOException | RuntimeException e) {
      // decoders report garbage input with unchecked exceptions too
      log.debug("Candidate rejected by {} decoder: {}", compression, e.toString());
      return false;
    }
  }

  /**
   * The share of bytes that are printable ASCII or common whitespace.
   * Zero for an empty sample.
   */
  static double printableRatio(byte[] sample) {
    if (sample.length == 0) {
      return 0;
    }
    int printable = 0;
    for (byte b : sample) {
      if ((b >= 0x20 && b <= 0x7E) || b == '\t' || b == '\n' || b == '\r') {
        ++printable;
      }
    }
    return (double) printable / sample.length;
  }

}
