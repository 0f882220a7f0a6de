package dev.videosearch.ingestion;

import dev.videosearch.clip.ClipDocument;
import dev.videosearch.media.FrameExtractionException;
import dev.videosearch.media.FrameExtractor;
import dev.videosearch.media.MediaProperties;
import dev.videosearch.media.ObjectStore;
import dev.videosearch.media.ObjectStoreException;
import dev.videosearch.media.S3Uri;
import dev.videosearch.store.RateLimitedException;
import dev.videosearch.store.UpstreamUnavailableException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Generates a preview image for every clip of a video and attaches it to the clip in place.
 *
 * <p>The source video is downloaded once; a frame is grabbed at each clip's start, uploaded under
 * the thumbnail prefix with a random name, and its {@code s3://} reference stored on the clip.
 * When a {@link ClipSummarizer} is configured, the same pass replaces each clip's text with a
 * generated summary. Per-clip failures are counted and do not stop the run.
 */
@Service
public class ThumbnailService {

    static final String CONTENT_TYPE = "image/jpeg";

    private static final Logger log = LoggerFactory.getLogger(ThumbnailService.class);

    private final ClipIndexer clipIndexer;
    private final ObjectStore objectStore;
    private final FrameExtractor frameExtractor;
    private final MediaProperties properties;
    private final Optional<ClipSummarizer> summarizer;

    public ThumbnailService(ClipIndexer clipIndexer,
                            ObjectStore objectStore,
                            FrameExtractor frameExtractor,
                            MediaProperties properties,
                            Optional<ClipSummarizer> summarizer) {
        this.clipIndexer = clipIndexer;
        this.objectStore = objectStore;
        this.frameExtractor = frameExtractor;
        this.properties = properties;
        this.summarizer = summarizer;
    }

    /**
     * Generates thumbnails for the clips of a video that have none.
     *
     * @param videoId the video
     * @return per-clip counts
     * @throws UpstreamUnavailableException if the source video cannot be downloaded
     */
    public ThumbnailReport generateThumbnails(String videoId) {
        List<ClipDocument> clips = clipIndexer.clipsOf(videoId);
        if (clips.isEmpty()) {
            log.warn("No clips found for video {}", videoId);
            return new ThumbnailReport(videoId, 0, 0, 0, 0, 0);
        }
        S3Uri source = S3Uri.parse(clips.get(0).videoPath());

        Path video = null;
        try {
            video = Files.createTempFile("video-", suffix(source));
            objectStore.download(source, video);
            log.info("Generating thumbnails for {} clips of video {}", clips.size(), videoId);

            int processed = 0;
            int failed = 0;
            int skipped = 0;
            int summarized = 0;
            for (ClipDocument clip : clips) {
                if (clip.thumbnailUri() != null) {
                    skipped++;
                    continue;
                }
                if (attach(video, clip)) {
                    processed++;
                } else {
                    failed++;
                }
                if (summarize(clip)) {
                    summarized++;
                }
            }
            log.info("Thumbnails for video {}: {} processed, {} failed, {} skipped, {} summarized",
                    videoId, processed, failed, skipped, summarized);
            return new ThumbnailReport(videoId, clips.size(), processed, failed, skipped, summarized);
        } catch (ObjectStoreException e) {
            throw new UpstreamUnavailableException("Could not download " + source, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create a temporary file for " + source, e);
        } finally {
            deleteQuietly(video);
        }
    }

    private boolean attach(Path video, ClipDocument clip) {
        try {
            byte[] frame = frameExtractor.extractFrame(video, clip.timestampStart());
            S3Uri target = new S3Uri(properties.thumbnailBucket(),
                    properties.thumbnailPrefix() + UUID.randomUUID() + ".jpg");
            objectStore.put(frame, target, CONTENT_TYPE);
            if (!clipIndexer.attachThumbnail(clip.clipId(), target.toString())) {
                log.warn("Clip {} disappeared before its thumbnail was attached", clip.clipId());
                return false;
            }
            log.debug("Attached {} to clip {}", target, clip.clipId());
            return true;
        } catch (FrameExtractionException | ObjectStoreException e) {
            log.warn("Thumbnail failed for clip {} at {}s: {}", clip.clipId(), clip.timestampStart(), e.getMessage());
            return false;
        } catch (UpstreamUnavailableException | RateLimitedException | DataAccessException e) {
            log.error("Could not attach thumbnail to clip {}", clip.clipId(), e);
            return false;
        }
    }

    private boolean summarize(ClipDocument clip) {
        if (summarizer.isEmpty()) {
            return false;
        }
        Optional<String> summary = summarizer.get().summarize(clip.clipText());
        if (summary.isEmpty()) {
            return false;
        }
        try {
            return clipIndexer.replaceClipText(clip.clipId(), summary.get());
        } catch (UpstreamUnavailableException | RateLimitedException | DataAccessException e) {
            log.error("Could not store summary of clip {}", clip.clipId(), e);
            return false;
        }
    }

    private static String suffix(S3Uri source) {
        String name = source.fileName();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? ".mp4" : name.substring(dot);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temporary video {}", file, e);
        }
    }
}
