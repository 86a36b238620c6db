package cal.restore.types;

import java.time.Instant;

public record FileInfo(String name, String path, long size, Instant lastModified) {
}
