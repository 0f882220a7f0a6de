package dev.videosearch.media;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Object store and frame extraction settings, bound from {@code videosearch.media.*}.
 *
 * @param region AWS region of the buckets
 * @param endpoint endpoint override for S3-compatible stores (MinIO, LocalStack); blank for AWS
 * @param pathStyleAccess whether to address buckets by path instead of virtual host
 * @param thumbnailBucket bucket receiving generated thumbnails
 * @param thumbnailPrefix key prefix of generated thumbnails
 * @param ffmpegBinary ffmpeg executable
 * @param frameTimeoutSeconds ceiling for one frame extraction
 * @param frameWidth width of extracted frames
 * @param frameHeight height of extracted frames
 */
@ConfigurationProperties(prefix = "videosearch.media")
public record MediaProperties(
    String region,
    @Nullable String endpoint,
    boolean pathStyleAccess,
    String thumbnailBucket,
    String thumbnailPrefix,
    String ffmpegBinary,
    int frameTimeoutSeconds,
    int frameWidth,
    int frameHeight) {}
