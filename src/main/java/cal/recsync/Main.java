package cal.recsync;

import cal.prim.MalformedDataException;
import cal.prim.PreconditionFailed;
import cal.prim.storage.EventuallyConsistentDirectory;
import cal.prim.storage.LocalDirectory;
import cal.prim.storage.S3Directory;
import cal.prim.time.UnreliableWallClock;
import cal.recsync.crypto.AesGcmEnvelope;
import cal.recsync.crypto.DecryptionFailed;
import cal.recsync.crypto.MasterKey;
import cal.recsync.crypto.RecordEncryption;
import cal.recsync.impls.ChainCorrupted;
import cal.recsync.impls.ChainVerifier;
import cal.recsync.impls.DirectoryRelay;
import cal.recsync.impls.KeyRotation;
import cal.recsync.impls.KvStore;
import cal.recsync.impls.SqliteRecordStore;
import cal.recsync.impls.SyncFailed;
import cal.recsync.impls.Syncer;
import cal.recsync.types.Config;
import cal.recsync.types.HostId;
import cal.recsync.types.KvRecord;
import cal.recsync.types.SyncReport;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.checkerframework.checker.nullness.qual.Nullable;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.SecureRandom;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Main {

  private static final String HOME = System.getProperty("user.home");
  private static final Path CFG_FILE = Paths.get(HOME, ".recsync-config.json").toAbsolutePath();
  private static final Path DATA_DIR = Paths.get(HOME, ".recsync");
  private static final Region DEFAULT_AWS_REGION = Region.US_EAST_2;
  private static final int DEFAULT_PAGE_SIZE = 100;
  private static final Pattern S3_RELAY = Pattern.compile("^s3://([^/]+)(?:/([^/]+))?/?$");

  private static void showHelp(Options options) {
    new HelpFormatter().printHelp("recsync [options]", options);
  }

  public static void main(String[] args) throws IOException {
    Options options = new Options();

    // flags
    options.addOption("h", "help", false, "Show help and quit");
    options.addOption("C", "config", true, "Configuration file (default " + CFG_FILE + ")");
    options.addOption(Option.builder().longOpt("no-verify").desc("Do not trial-decrypt downloaded records").build());

    // actions
    options.addOption(Option.builder().longOpt("generate-key").hasArg().optionalArg(true).argName("FILE")
            .desc("Create a new master key (in the configured key file unless FILE is given)").build());
    options.addOption(Option.builder("s").longOpt("set").numberOfArgs(2).argName("KEY VALUE").desc("Set a key").build());
    options.addOption(Option.builder("g").longOpt("get").hasArg().argName("KEY").desc("Print the latest value of a key").build());
    options.addOption("y", "sync", false, "Sync with the relay");
    options.addOption("v", "verify", false, "Check the structure of every kv chain this host knows about");
    options.addOption(Option.builder().longOpt("rotate-key").hasArg().argName("NEW_KEY_FILE")
            .desc("Re-wrap every local record under the key in NEW_KEY_FILE").build());
    options.addOption(Option.builder().longOpt("status").desc("Show counts and the last sync time").build());

    CommandLine cli;
    try {
      cli = new DefaultParser().parse(options, args);
    } catch (ParseException e) {
      System.err.println("Failed to parse options: " + e);
      showHelp(options);
      System.exit(1);
      return;
    }

    if (cli.hasOption('h')) {
      showHelp(options);
      return;
    }

    final boolean generateKey = cli.hasOption("generate-key");
    final boolean set = cli.hasOption('s');
    final boolean get = cli.hasOption('g');
    final boolean sync = cli.hasOption('y');
    final boolean verify = cli.hasOption('v');
    final boolean rotate = cli.hasOption("rotate-key");
    final boolean status = cli.hasOption("status");
    final boolean verifyDownloads = !cli.hasOption("no-verify");

    if (!generateKey && !set && !get && !sync && !verify && !rotate && !status) {
      System.err.println("No action specified. Did you mean to pass '--sync'?");
      return;
    }

    // ------------------------------------------------------------------------------
    // Set up actors and configuration

    final Path cfgFile = cli.hasOption('C') ? Paths.get(cli.getOptionValue('C')).toAbsolutePath() : CFG_FILE;
    final Config config;
    try {
      config = loadConfig(cfgFile);
    } catch (FileNotFoundException e) {
      System.err.println("Config file '" + cfgFile + "' not found");
      System.exit(1);
      return;
    }

    final UnreliableWallClock clock = UnreliableWallClock.SYSTEM_CLOCK;
    final RecordEncryption encryption = new AesGcmEnvelope();

    if (generateKey) {
      String target = cli.getOptionValue("generate-key");
      Path keyFile = target != null ? expandHome(target) : config.getKeyFile();
      MasterKey key = MasterKey.generate(new SecureRandom());
      key.write(keyFile);
      System.out.println("Wrote " + key + " to " + keyFile);
      System.out.println("Copy this file to every host that should share your records.");
    }

    if (!set && !get && !sync && !verify && !rotate && !status) {
      return;
    }

    final MasterKey key = readKey(config.getKeyFile());

    try (SqliteRecordStore store = openStore(config.getDatabase())) {

      // ------------------------------------------------------------------------------
      // Do the work

      if (set) {
        String[] kv = cli.getOptionValues('s');
        KvStore kvStore = new KvStore(store, encryption, key, config.getHost(), clock);
        try {
          kvStore.set(kv[0], kv[1]);
        } catch (PreconditionFailed e) {
          System.err.println("Another process kept writing at the same time: " + e.getMessage());
          System.exit(1);
        }
      }

      if (get) {
        KvStore kvStore = new KvStore(store, encryption, key, config.getHost(), clock);
        Optional<String> value;
        try {
          value = kvStore.get(cli.getOptionValue('g'));
        } catch (DecryptionFailed e) {
          System.err.println("A record could not be decrypted; is " + config.getKeyFile() + " the right key?");
          System.exit(1);
          return;
        } catch (MalformedDataException e) {
          System.err.println("The kv chain is damaged: " + e.getMessage());
          System.exit(1);
          return;
        }
        if (value.isPresent()) {
          System.out.println(value.get());
        } else {
          System.err.println("Not set");
          System.exit(1);
        }
      }

      if (sync) {
        String relayLocation = config.getRelay();
        if (relayLocation == null) {
          System.err.println("No relay configured; add \"relay\" to " + cfgFile);
          System.exit(1);
          return;
        }
        Syncer syncer = new Syncer(
                store, store,
                new DirectoryRelay(openRelayDirectory(relayLocation), clock, config.getPageSize()),
                clock,
                config.getUploadBatchSize(),
                verifyDownloads ? encryption : null,
                verifyDownloads ? key : null);
        try {
          SyncReport report = syncer.sync();
          System.out.println("Sync complete: " + report);
        } catch (SyncFailed e) {
          System.err.println("Sync failed: " + e.getCause());
          System.err.println("Progress before the failure: " + e.partialReport());
          System.exit(1);
        }
      }

      if (verify) {
        ChainVerifier verifier = new ChainVerifier(store);
        List<String> corrupted = new ArrayList<>();
        for (HostId host : store.hosts()) {
          System.out.print(host + "/" + KvRecord.TAG + ": ");
          try {
            System.out.println(verifier.verify(host, KvRecord.TAG) + " records OK");
          } catch (ChainCorrupted e) {
            System.out.println("CORRUPT");
            System.err.println(e.getMessage());
            corrupted.add(e.host() + "/" + e.tag());
          }
        }
        if (!corrupted.isEmpty()) {
          System.err.println("Corrupt chains: " + String.join(", ", corrupted));
          System.exit(1);
        }
      }

      if (rotate) {
        Path newKeyFile = expandHome(cli.getOptionValue("rotate-key"));
        MasterKey newKey = readKey(newKeyFile);
        try {
          long n = new KeyRotation(store, encryption).rotate(key, newKey);
          System.out.println("Re-wrapped " + n + " records under " + newKey);
          System.out.println("Replace " + config.getKeyFile() + " with " + newKeyFile + " on every host.");
        } catch (DecryptionFailed e) {
          System.err.println("Some records are wrapped by neither " + key + " nor " + newKey + "; rotation stopped.");
          System.exit(1);
        }
      }

      if (status) {
        System.out.println("host:        " + config.getHost());
        System.out.println("key:         " + key.id());
        System.out.println("records:     " + store.count());
        System.out.println("kv chain:    " + store.len(config.getHost(), KvRecord.TAG));
        System.out.println("last sync:   " + store.lastSync());
      }

    }
  }

  private static MasterKey readKey(Path keyFile) throws IOException {
    try {
      return MasterKey.read(keyFile);
    } catch (NoSuchFileException e) {
      System.err.println("Key file '" + keyFile + "' not found; create one with --generate-key");
      System.exit(1);
      throw e;
    } catch (MalformedDataException e) {
      System.err.println("Key file '" + keyFile + "' is corrupt: " + e.getMessage());
      System.exit(1);
      throw new IOException(e);
    }
  }

  private static SqliteRecordStore openStore(Path database) throws IOException {
    try {
      return new SqliteRecordStore(database);
    } catch (SQLException e) {
      throw new IOException("failed to open database " + database, e);
    }
  }

  static EventuallyConsistentDirectory openRelayDirectory(String location) throws IOException {
    Matcher m = S3_RELAY.matcher(location);
    if (m.matches()) {
      String bucket = m.group(1);
      String region = m.group(2);
      S3Client s3 = S3Client.builder()
              .credentialsProvider(DefaultCredentialsProvider.create())
              .region(region != null ? Region.of(region) : DEFAULT_AWS_REGION)
              .build();
      return new S3Directory(s3, bucket);
    }
    return new LocalDirectory(expandHome(location));
  }

  private static Path expandHome(String path) {
    if (path.equals("~") || path.startsWith("~/")) {
      return Paths.get(HOME + path.substring(1)).toAbsolutePath();
    }
    return Paths.get(path).toAbsolutePath();
  }

  private static class RawConfig {
    public @Nullable String host;
    public @Nullable String database;
    public @Nullable String keyFile;
    public @Nullable String relay;
    public @Nullable Integer pageSize;
    public @Nullable Integer uploadBatchSize;
  }

  static Config loadConfig(Path target) throws IOException {

    JsonFactory f = new JsonFactory();
    f.enable(JsonParser.Feature.ALLOW_COMMENTS);
    ObjectMapper mapper = new ObjectMapper(f);

    RawConfig r;
    try (InputStream in = new FileInputStream(target.toString())) {
      r = mapper.readValue(in, RawConfig.class);
    }

    if (r.host == null) {
      throw new IllegalArgumentException("Config at " + target + " is missing \"host\"");
    }

    int pageSize = r.pageSize != null ? r.pageSize : DEFAULT_PAGE_SIZE;
    int uploadBatchSize = r.uploadBatchSize != null ? r.uploadBatchSize : Syncer.DEFAULT_UPLOAD_BATCH_SIZE;
    if (pageSize <= 0 || uploadBatchSize <= 0) {
      throw new IllegalArgumentException("Config at " + target + " has a non-positive page or batch size");
    }

    return new Config(
            new HostId(r.host),
            r.database != null ? expandHome(r.database) : DATA_DIR.resolve("records.db"),
            r.keyFile != null ? expandHome(r.keyFile) : DATA_DIR.resolve("key"),
            r.relay,
            pageSize,
            uploadBatchSize);
  }

}
