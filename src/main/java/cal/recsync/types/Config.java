package cal.recsync.types;

import lombok.Value;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.Path;

@Value
public class Config {
  HostId host;
  Path database;
  Path keyFile;
  @Nullable String relay;
  int pageSize;
  int uploadBatchSize;
}
