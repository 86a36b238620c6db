package cal.prim.transforms;

import org.checkerframework.checker.mustcall.qual.MustCallAlias;

import java.io.IOException;
import java.io.InputStream;

/**
 * Undoes one encoding step (encryption, compression) of a stored artifact.
 * Closing the returned stream closes <code>data</code>.
 */
public interface StreamDecoder {

  @MustCallAlias InputStream decode(@MustCallAlias InputStream data) throws IOException;

}
