package cal.restore.storage;

import cal.prim.ProgressListener;
import cal.restore.Util;
import cal.restore.adapters.StorageAdapter;
import cal.restore.adapters.TextReader;
import cal.restore.errors.ConfigurationMissing;
import cal.restore.types.AdapterSettings;
import cal.restore.types.ConnectionTest;
import cal.restore.types.FileInfo;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Backups in an S3 bucket, or any service that speaks the S3 API
 * (set <code>endpoint</code> and usually <code>forcePathStyle</code>).
 */
public class S3StorageAdapter implements StorageAdapter {

  public static final String ID = "s3";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Settings(
      String bucket,
      @Nullable String region,
      @Nullable String endpoint,
      @Nullable String accessKeyId,
      @Nullable String secretAccessKey,
      @Nullable String pathPrefix,
      boolean forcePathStyle) {

    static Settings from(AdapterSettings settings) {
      Settings s = MAPPER.convertValue(settings.asMap(), Settings.class);
      if (s.bucket() == null || s.bucket().isEmpty()) {
        throw new IllegalArgumentException("S3 storage needs a 'bucket'");
      }
      return s;
    }

    /**
     * The object key for a path relative to the configured prefix.
     */
    String key(String remotePath) {
      String path = remotePath;
      while (path.startsWith("/")) {
        path = path.substring(1);
      }
      if (pathPrefix == null || pathPrefix.isEmpty()) {
        return path;
      }
      String prefix = pathPrefix.endsWith("/") ? pathPrefix : pathPrefix + "/";
      return path.isEmpty() ? prefix : prefix + path;
    }

    S3Client client() {
      S3ClientBuilder builder = S3Client.builder()
          .region(Region.of(region != null && !region.isEmpty() ? region : "us-east-1"))
          .forcePathStyle(forcePathStyle);
      if (endpoint != null && !endpoint.isEmpty()) {
        builder.endpointOverride(URI.create(endpoint));
      }
      if (accessKeyId != null && secretAccessKey != null) {
        builder.credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKeyId, secretAccessKey)));
      }
      return builder.build();
    }
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String displayName() {
    return "Amazon S3";
  }

  @Override
  public List<FileInfo> list(AdapterSettings settings, String dir) throws IOException {
    Settings s = Settings.from(settings);
    String prefix = s.key(dir);
    if (!prefix.isEmpty() && !prefix.endsWith("/")) {
      prefix = prefix + "/";
    }
    String base = s.key("");
    List<FileInfo> result = new ArrayList<>();
    try (S3Client client = s.client()) {
      ListObjectsV2Request request = ListObjectsV2Request.builder().bucket(s.bucket()).prefix(prefix).build();
      for (S3Object object : client.listObjectsV2Paginator(request).contents()) {
        if (object.key().endsWith("/")) {
          continue;
        }
        String relative = object.key().substring(Math.min(base.length(), object.key().length()));
        result.add(new FileInfo(Util.basename(object.key()), relative, object.size(), object.lastModified()));
      }
    } catch (SdkException e) {
      throw new IOException(e);
    }
    return result;
  }

  @Override
  public boolean download(AdapterSettings settings, String remotePath, Path localPath, ProgressListener progress) throws IOException {
    Settings s = Settings.from(settings);
    try (S3Client client = s.client();
         ResponseInputStream<GetObjectResponse> in = client.getObject(
             GetObjectRequest.builder().bucket(s.bucket()).key(s.key(remotePath)).build());
         OutputStream out = Files.newOutputStream(localPath)) {
      Long length = in.response().contentLength();
      Util.copyStream(in, out, length != null ? length : -1, progress);
      return true;
    } catch (NoSuchKeyException e) {
      Files.deleteIfExists(localPath);
      return false;
    } catch (SdkException e) {
      // "SdkException" covers network errors, malformed requests and
      // unparseable responses alike
      throw new IOException(e);
    }
  }

  @Override
  public boolean upload(AdapterSettings settings, Path localPath, String remotePath) throws IOException {
    Settings s = Settings.from(settings);
    try (S3Client client = s.client()) {
      client.putObject(PutObjectRequest.builder().bucket(s.bucket()).key(s.key(remotePath)).build(),
          RequestBody.fromFile(localPath));
      return true;
    } catch (SdkException e) {
      throw new IOException(e);
    }
  }

  @Override
  public boolean delete(AdapterSettings settings, String remotePath) throws IOException {
    // S3 reports success for keys that do not exist
    Settings s = Settings.from(settings);
    try (S3Client client = s.client()) {
      client.deleteObject(DeleteObjectRequest.builder().bucket(s.bucket()).key(s.key(remotePath)).build());
      return true;
    } catch (SdkException e) {
      throw new IOException(e);
    }
  }

  @Override
  public Optional<TextReader> reading() {
    return Optional.of((settings, remotePath) -> {
      Settings s = Settings.from(settings);
      try (S3Client client = s.client();
           InputStream in = client.getObject(GetObjectRequest.builder().bucket(s.bucket()).key(s.key(remotePath)).build())) {
        return new String(Util.read(in), StandardCharsets.UTF_8);
      } catch (NoSuchKeyException e) {
        return null;
      } catch (SdkException e) {
        throw new IOException(e);
      }
    });
  }

  @Override
  public void checkSettings(AdapterSettings settings) throws ConfigurationMissing {
    try {
      Settings.from(settings);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationMissing("Invalid settings: " + e.getMessage(), e);
    }
  }

  @Override
  public ConnectionTest test(AdapterSettings settings) {
    Settings s = Settings.from(settings);
    try (S3Client client = s.client()) {
      client.headBucket(HeadBucketRequest.builder().bucket(s.bucket()).build());
      return ConnectionTest.ok("Bucket " + s.bucket() + " is accessible");
    } catch (SdkException e) {
      return ConnectionTest.failed("Cannot access bucket " + s.bucket() + ": " + e.getMessage());
    }
  }

}
