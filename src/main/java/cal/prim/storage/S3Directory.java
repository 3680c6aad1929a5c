package cal.prim.storage;

import cal.recsync.Util;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * A directory stored as the objects of one S3 bucket.  Record entries are small, so every write
 * is a single <code>PutObject</code> request.
 */
public class S3Directory implements EventuallyConsistentDirectory {

  private final String bucket;
  private final S3Client s3client;

  public S3Directory(S3Client s3client, String bucketName) throws IOException {
    this.bucket = bucketName;
    this.s3client = s3client;
    try {
      try {
        s3client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
      } catch (NoSuchBucketException e) {
        s3client.createBucket(CreateBucketRequest.builder().bucket(bucketName).build());
      }
    } catch (SdkException e) {
      throw new IOException(e);
    }
  }

  @Override
  public Stream<String> list() throws IOException {
    return listFrom(ListObjectsV2Request.builder().bucket(bucket).build());
  }

  @Override
  public Stream<String> listAfter(String startAfter) throws IOException {
    return listFrom(ListObjectsV2Request.builder().bucket(bucket).startAfter(startAfter).build());
  }

  private Stream<String> listFrom(ListObjectsV2Request request) throws IOException {
    // S3 returns keys in ascending UTF-8 binary order, which matches String
    // ordering for the ASCII names the relay uses.
    List<String> result = new ArrayList<>();
    try {
      ListObjectsV2Response listing = s3client.listObjectsV2(request);
      for (;;) {
        for (S3Object o : listing.contents()) {
          result.add(o.key());
        }
        if (!Boolean.TRUE.equals(listing.isTruncated())) {
          break;
        }
        listing = s3client.listObjectsV2(request.toBuilder()
                .continuationToken(listing.nextContinuationToken())
                .build());
      }
    } catch (SdkException e) {
      throw new IOException(e);
    }
    return result.stream();
  }

  @Override
  public void createOrReplace(String name, InputStream stream) throws IOException {
    byte[] bytes = Util.read(stream);
    try {
      s3client.putObject(
              PutObjectRequest.builder()
                      .bucket(bucket)
                      .key(name)
                      .contentType("application/json")
                      .build(),
              RequestBody.fromBytes(bytes));
    } catch (SdkException e) {
      throw new IOException(e);
    }
  }

  @Override
  public InputStream open(String name) throws IOException {
    try {
      return s3client.getObject(
              GetObjectRequest.builder()
                      .bucket(bucket)
                      .key(name)
                      .build());
    } catch (NoSuchKeyException e) {
      throw new NoSuchFileException(name);
    } catch (SdkException e) {
      // any other kind of error: malformed request, network error,
      // unparseable response
      throw new IOException(e);
    }
  }

}
