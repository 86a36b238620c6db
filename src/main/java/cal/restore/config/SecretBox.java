package cal.restore.config;

import cal.restore.Util;
import cal.restore.errors.ConfigurationMissing;
import cal.restore.errors.DecryptionFailed;
import cal.restore.types.AdapterSettings;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Opens secrets stored in configuration.  A sealed secret is the string
 * <code>ivHex:authTagHex:ciphertextHex</code>, AES-256-GCM under the system key.
 */
public class SecretBox {

  public static final String ENV_VAR = "ENCRYPTION_KEY";

  private static final int IV_LENGTH = 16;
  private static final int TAG_BITS = 128;

  /** Connection parameter names whose values are stored sealed. Compared lower-case. */
  private static final ImmutableSet<String> SENSITIVE_KEYS = ImmutableSet.of(
      "password", "secretaccesskey", "accesskeyid", "privatekey", "passphrase",
      "clientsecret", "refreshtoken", "token", "connectionstring");

  private final SecretKeySpec key;
  private final SecureRandom random = new SecureRandom();

  public SecretBox(byte[] key) {
    if (key.length != 32) {
      throw new IllegalArgumentException("system key must be 32 bytes, was " + key.length);
    }
    this.key = new SecretKeySpec(key, "AES");
  }

  public static SecretBox fromHex(String hexKey) {
    return new SecretBox(Util.fromHex(hexKey.trim()));
  }

  public static SecretBox fromEnvironment() throws ConfigurationMissing {
    String value = System.getenv(ENV_VAR);
    if (value == null || value.isBlank()) {
      throw new ConfigurationMissing(ENV_VAR + " is not set; it must hold the 64-hex-digit system key");
    }
    try {
      return fromHex(value);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationMissing(ENV_VAR + " is not a 64-hex-digit key", e);
    }
  }

  public static boolean isSealed(String value) {
    String[] parts = value.split(":", -1);
    if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty()) {
      return false;
    }
    for (String part : parts) {
      if (part.length() % 2 != 0 || !part.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
        return false;
      }
    }
    return true;
  }

  public String open(String sealed) throws GeneralSecurityException {
    String[] parts = sealed.split(":", -1);
    if (parts.length != 3) {
      throw new GeneralSecurityException("sealed value must have the form iv:authTag:ciphertext");
    }
    byte[] iv = Util.fromHex(parts[0]);
    byte[] tag = Util.fromHex(parts[1]);
    byte[] ciphertext = Util.fromHex(parts[2]);

    Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
    cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(tag.length * 8, iv));
    // JCA expects the tag after the ciphertext
    byte[] input = Arrays.copyOf(ciphertext, ciphertext.length + tag.length);
    System.arraycopy(tag, 0, input, ciphertext.length, tag.length);
    byte[] plaintext = cipher.doFinal(input);
    return new String(plaintext, StandardCharsets.UTF_8);
  }

  @VisibleForTesting
  public String seal(String plaintext) throws GeneralSecurityException {
    byte[] iv = new byte[IV_LENGTH];
    random.nextBytes(iv);
    Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
    cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
    byte[] out = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
    int ctLen = out.length - TAG_BITS / 8;
    return Util.toHex(iv) + ':' + Util.toHex(Arrays.copyOfRange(out, ctLen, out.length)) + ':' + Util.toHex(Arrays.copyOf(out, ctLen));
  }

  /**
   * Open every sealed sensitive value in a configuration's parameters,
   * descending into nested maps and lists.
   */
  public AdapterSettings openSettings(Map<String, Object> parameters) throws DecryptionFailed {
    return new AdapterSettings(openMap(parameters));
  }

  private Map<String, Object> openMap(Map<String, ?> map) throws DecryptionFailed {
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<String, ?> e : map.entrySet()) {
      Object value = e.getValue();
      if (value == null) {
        continue;
      }
      result.put(e.getKey(), openValue(e.getKey(), value));
    }
    return result;
  }

  private Object openValue(String name, Object value) throws DecryptionFailed {
    if (value instanceof Map<?, ?> nested) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : nested.entrySet()) {
        copy.put(String.valueOf(e.getKey()), e.getValue());
      }
      return openMap(copy);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object element : list) {
        copy.add(element == null ? "" : openValue(name, element));
      }
      return copy;
    }
    if (value instanceof String s && SENSITIVE_KEYS.contains(name.toLowerCase(Locale.ROOT)) && isSealed(s)) {
      try {
        return open(s);
      } catch (GeneralSecurityException | IllegalArgumentException e) {
        throw new DecryptionFailed("Cannot decrypt connection parameter '" + name + "'; was the system key changed?", e);
      }
    }
    return value;
  }

}
