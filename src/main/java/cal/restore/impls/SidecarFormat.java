package cal.restore.impls;

import cal.prim.transforms.Compression;
import cal.restore.types.BackupMetadata;
import cal.restore.types.EncryptionInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the <code>.meta.json</code> document stored next to each backup.
 *
 * <p>Older backups put <code>iv</code>, <code>authTag</code> and
 * <code>encryptionProfileId</code> at the top level instead of in an
 * <code>encryption</code> block; both layouts are accepted.
 */
public abstract class SidecarFormat {

  public static final String SUFFIX = ".meta.json";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static String sidecarPath(String artifactPath) {
    return artifactPath + SUFFIX;
  }

  public static BackupMetadata parse(String json) throws IOException {
    JsonNode root = MAPPER.readTree(json);
    if (root == null || !root.isObject()) {
      throw new IOException("sidecar metadata is not a JSON object");
    }

    BackupMetadata.BackupMetadataBuilder b = BackupMetadata.builder()
        .sourceType(text(root, "sourceType"))
        .sourceName(text(root, "sourceName"))
        .jobName(text(root, "jobName"))
        .engineVersion(text(root, "engineVersion"))
        .engineEdition(text(root, "engineEdition"))
        .locked(root.path("locked").asBoolean(false));

    JsonNode databases = root.path("databases");
    if (databases.isNumber()) {
      b.databaseCount(databases.asInt());
    } else if (databases.isObject()) {
      if (databases.path("count").isNumber()) {
        b.databaseCount(databases.path("count").asInt());
      }
      List<String> names = new ArrayList<>();
      for (JsonNode name : databases.path("names")) {
        names.add(name.asText());
      }
      b.databaseNames(names);
    }

    String compression = text(root, "compression");
    if (compression != null) {
      b.compression(Compression.parse(compression)
          .orElseThrow(() -> new IOException("unknown compression '" + compression + "' in sidecar metadata")));
    }

    b.encryption(encryption(root));
    return b.build();
  }

  private static @Nullable EncryptionInfo encryption(JsonNode root) {
    JsonNode block = root.path("encryption");
    if (block.isObject()) {
      return new EncryptionInfo(
          block.path("enabled").asBoolean(false),
          text(block, "profileId"),
          text(block, "iv"),
          text(block, "authTag"));
    }
    String iv = text(root, "iv");
    String authTag = text(root, "authTag");
    boolean enabled = block.asBoolean(false) || iv != null || authTag != null;
    if (!enabled) {
      return null;
    }
    return new EncryptionInfo(true, text(root, "encryptionProfileId"), iv, authTag);
  }

  private static @Nullable String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    String s = value.asText();
    return s.isEmpty() ? null : s;
  }

}
